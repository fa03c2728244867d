package com.iotstuff.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.iotstuff.anomaly.config.AerospikeConfig;
import com.iotstuff.anomaly.model.DeviceState;
import com.iotstuff.anomaly.model.RollingWindow;
import com.iotstuff.anomaly.model.SmoothingState;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-device rolling window and smoothing state.
 *
 * Record layout (set {@code device_state}, key = device id):
 * <ul>
 *   <li>{@code deviceId} - string</li>
 *   <li>{@code window} - list of doubles, oldest first</li>
 *   <li>{@code ewma}, {@code ewmstd}, {@code lastValue} - doubles, absent while unset</li>
 *   <li>{@code updatedAt} - epoch millis of the last write</li>
 * </ul>
 */
@Repository
public class DeviceStateRepository {

    static final String BIN_DEVICE_ID = "deviceId";
    static final String BIN_WINDOW = "window";
    static final String BIN_EWMA = "ewma";
    static final String BIN_EWMSTD = "ewmstd";
    static final String BIN_LAST_VALUE = "lastValue";
    static final String BIN_UPDATED_AT = "updatedAt";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public DeviceStateRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * @return the stored state, or null when the device has never been seen
     * @throws CorruptStateException when the record exists but cannot be decoded
     */
    public DeviceState findByDeviceId(String deviceId, int windowCapacity) {
        Key key = new Key(namespace, AerospikeConfig.SET_DEVICE_STATE, deviceId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return null;
        }
        try {
            return mapRecordToState(deviceId, record, windowCapacity);
        } catch (RuntimeException e) {
            throw new CorruptStateException(deviceId, record.generation, e);
        }
    }

    /**
     * Writes the state. With {@code conditional} set, the write only succeeds if the record is
     * still at the generation it was loaded with (or still absent for a new device).
     *
     * @throws StateWriteConflictException when a conditional write loses a race
     */
    public void save(DeviceState state, boolean conditional) {
        Key key = new Key(namespace, AerospikeConfig.SET_DEVICE_STATE, state.getDeviceId());
        WritePolicy policy = new WritePolicy(writePolicy);

        if (conditional) {
            if (state.isPersisted()) {
                policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
                policy.generation = state.getGeneration();
                policy.recordExistsAction = RecordExistsAction.REPLACE_ONLY;
            } else {
                policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
            }
        } else {
            policy.recordExistsAction = RecordExistsAction.REPLACE;
        }

        SmoothingState smoothing = state.getSmoothing() != null ? state.getSmoothing() : SmoothingState.unset();

        try {
            client.put(policy, key,
                    new Bin(BIN_DEVICE_ID, state.getDeviceId()),
                    new Bin(BIN_WINDOW, state.getWindow().toList()),
                    doubleBin(BIN_EWMA, smoothing.getEwma()),
                    doubleBin(BIN_EWMSTD, smoothing.getEwmstd()),
                    doubleBin(BIN_LAST_VALUE, smoothing.getLastValue()),
                    new Bin(BIN_UPDATED_AT, System.currentTimeMillis()));
        } catch (AerospikeException e) {
            int code = e.getResultCode();
            if (conditional && (code == ResultCode.GENERATION_ERROR
                    || code == ResultCode.KEY_EXISTS_ERROR
                    || code == ResultCode.KEY_NOT_FOUND_ERROR)) {
                throw new StateWriteConflictException(state.getDeviceId(), state.getGeneration(), e);
            }
            throw e;
        }
    }

    private DeviceState mapRecordToState(String deviceId, Record record, int windowCapacity) {
        List<?> stored = record.getList(BIN_WINDOW);
        List<Double> readings = new ArrayList<>();
        if (stored != null) {
            for (Object v : stored) {
                readings.add(((Number) v).doubleValue());
            }
        }

        SmoothingState smoothing = SmoothingState.builder()
                .ewma(readDouble(record, BIN_EWMA))
                .ewmstd(readDouble(record, BIN_EWMSTD))
                .lastValue(readDouble(record, BIN_LAST_VALUE))
                .build();

        return DeviceState.builder()
                .deviceId(deviceId)
                .window(RollingWindow.of(windowCapacity, readings))
                .smoothing(smoothing)
                .generation(record.generation)
                .build();
    }

    private static Double readDouble(Record record, String bin) {
        Object value = record.getValue(bin);
        return value != null ? ((Number) value).doubleValue() : null;
    }

    private static Bin doubleBin(String name, Double value) {
        return value != null ? new Bin(name, value.doubleValue()) : Bin.asNull(name);
    }
}
