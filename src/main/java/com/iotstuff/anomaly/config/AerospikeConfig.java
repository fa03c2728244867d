package com.iotstuff.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("!test")
public class AerospikeConfig {

    public static final String SET_DEVICE_STATE = "device_state";
    public static final String SET_DEVICE_BASELINES = "device_baselines";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:telemetry}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        // The ingestion path degrades to cold start on store failures, so keep reads short
        clientPolicy.readPolicyDefault.totalTimeout = 1000;
        clientPolicy.readPolicyDefault.socketTimeout = 500;

        clientPolicy.writePolicyDefault.totalTimeout = 1000;
        clientPolicy.writePolicyDefault.socketTimeout = 500;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 1000;
        policy.socketTimeout = 500;
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 1000;
        policy.socketTimeout = 500;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
