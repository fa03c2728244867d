package com.iotstuff.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iotstuff.anomaly.config.AerospikeConfig;
import com.iotstuff.anomaly.model.Baseline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class BaselineRepository {

    private static final Logger log = LoggerFactory.getLogger(BaselineRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public BaselineRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(Baseline baseline) {
        Key key = new Key(namespace, AerospikeConfig.SET_DEVICE_BASELINES, baseline.getDeviceId());
        String json;
        try {
            json = objectMapper.writeValueAsString(baseline);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize baseline for " + baseline.getDeviceId(), e);
        }

        client.put(writePolicy, key,
                new Bin("deviceId", baseline.getDeviceId()),
                new Bin("baselineJson", json),
                new Bin("createdAt", baseline.getCreatedAt()));

        log.info("Saved baseline for device {}: mean={}, std={}, samples={}",
                baseline.getDeviceId(), baseline.getMean(), baseline.getStd(), baseline.getSampleCount());
    }

    /**
     * @return the device's baseline, or null when none has been calibrated
     * @throws IllegalStateException when the stored baseline cannot be decoded
     */
    public Baseline findByDeviceId(String deviceId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DEVICE_BASELINES, deviceId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return null;
        }
        String json = record.getString("baselineJson");
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Baseline.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable baseline for device " + deviceId, e);
        }
    }

    public boolean delete(String deviceId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DEVICE_BASELINES, deviceId);
        return client.delete(writePolicy, key);
    }
}
