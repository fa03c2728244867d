package com.iotstuff.anomaly.contract;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.iotstuff.anomaly.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

/**
 * Drives a reading through the wired application: controller, orchestrator, engine and the
 * Aerospike-backed state store over the mocked client.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class ReadingIngestionFlowTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private AerospikeClient aerospikeClient;

    @BeforeEach
    void resetClient() {
        Mockito.clearInvocations(aerospikeClient);
    }

    private ResponseEntity<String> postJson(String path, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.postForEntity(path, new HttpEntity<>(body, headers), String.class);
    }

    @Test
    void firstReading_warmsUpAndCreatesStateRecord() {
        ResponseEntity<String> response = postJson("/api/v1/readings",
                "{\"device_id\":\"dev-7\",\"cpu\":42.5,\"timestamp\":1739886764000}");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(response.getBody());
        assertThat((Boolean) json.read("$.anomalyDetected")).isFalse();

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        ArgumentCaptor<Key> key = ArgumentCaptor.forClass(Key.class);
        verify(aerospikeClient).put(policy.capture(), key.capture(), any(Bin[].class));
        assertThat(key.getValue().namespace).isEqualTo("test");
        assertThat(key.getValue().setName).isEqualTo("device_state");
        assertThat(policy.getValue().recordExistsAction).isEqualTo(RecordExistsAction.CREATE_ONLY);
    }

    @Test
    void batch_countsInvalidReadingsAsFailed() {
        ResponseEntity<String> response = postJson("/api/v1/readings/batch",
                "[{\"deviceId\":\"dev-8\",\"value\":40.0},{\"deviceId\":\"dev-8\"}]");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(response.getBody());
        assertThat((Integer) json.read("$.recordsProcessed")).isEqualTo(1);
        assertThat((Integer) json.read("$.recordsFailed")).isEqualTo(1);
    }
}
