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
import com.iotstuff.anomaly.model.DeviceState;
import com.iotstuff.anomaly.model.SmoothingState;
import com.iotstuff.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeviceStateRepositoryTest {

    @Mock private AerospikeClient client;

    private DeviceStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new DeviceStateRepository(client, "test", new WritePolicy(), new Policy());
    }

    private static Record record(Map<String, Object> bins, int generation) {
        return new Record(bins, generation, 0);
    }

    @Test
    void findByDeviceId_noRecord_returnsNull() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(repository.findByDeviceId("dev-1", 100)).isNull();
    }

    @Test
    void findByDeviceId_decodesWindowSmoothingAndGeneration() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("deviceId", "dev-1");
        bins.put("window", List.of(49.0, 51.0, 50L));
        bins.put("ewma", 50.2);
        bins.put("lastValue", 50.0);
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(record(bins, 7));

        DeviceState state = repository.findByDeviceId("dev-1", 100);

        assertThat(state.getDeviceId()).isEqualTo("dev-1");
        assertThat(state.getWindow().toList()).containsExactly(49.0, 51.0, 50.0);
        assertThat(state.getWindow().capacity()).isEqualTo(100);
        assertThat(state.getSmoothing().getEwma()).isEqualTo(50.2);
        assertThat(state.getSmoothing().getEwmstd()).isNull();
        assertThat(state.getSmoothing().getLastValue()).isEqualTo(50.0);
        assertThat(state.getGeneration()).isEqualTo(7);
    }

    @Test
    void findByDeviceId_undecodableBins_throwsCorruptStateWithGeneration() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("window", List.of("not", "numbers"));
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(record(bins, 4));

        assertThatThrownBy(() -> repository.findByDeviceId("dev-1", 100))
                .isInstanceOfSatisfying(CorruptStateException.class,
                        e -> assertThat(e.getGeneration()).isEqualTo(4));
    }

    @Test
    void save_conditionalNewDevice_createsOnly() {
        repository.save(DeviceState.empty("dev-1", 100), true);

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client).put(policy.capture(), any(Key.class), any(Bin[].class));
        assertThat(policy.getValue().recordExistsAction).isEqualTo(RecordExistsAction.CREATE_ONLY);
        assertThat(policy.getValue().generationPolicy).isEqualTo(GenerationPolicy.NONE);
    }

    @Test
    void save_conditionalExistingDevice_expectsLoadedGeneration() {
        DeviceState state = TestDataFactory.createState("dev-1", TestDataFactory.alternatingReadings(5))
                .toBuilder().generation(12).build();

        repository.save(state, true);

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client).put(policy.capture(), any(Key.class), any(Bin[].class));
        assertThat(policy.getValue().generationPolicy).isEqualTo(GenerationPolicy.EXPECT_GEN_EQUAL);
        assertThat(policy.getValue().generation).isEqualTo(12);
        assertThat(policy.getValue().recordExistsAction).isEqualTo(RecordExistsAction.REPLACE_ONLY);
    }

    @Test
    void save_unconditional_replaces() {
        DeviceState state = TestDataFactory.createState("dev-1", TestDataFactory.alternatingReadings(5));

        repository.save(state, false);

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client).put(policy.capture(), any(Key.class), any(Bin[].class));
        assertThat(policy.getValue().recordExistsAction).isEqualTo(RecordExistsAction.REPLACE);
        assertThat(policy.getValue().generationPolicy).isEqualTo(GenerationPolicy.NONE);
    }

    @Test
    void save_writesAllStateBins() {
        SmoothingState smoothing = SmoothingState.builder().ewma(50.0).lastValue(51.0).build();
        DeviceState state = TestDataFactory.createState("dev-1", List.of(49.0, 51.0), smoothing);

        repository.save(state, false);

        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(any(WritePolicy.class), any(Key.class), bins.capture());
        assertThat(bins.getValue()).extracting(b -> b.name)
                .containsExactly("deviceId", "window", "ewma", "ewmstd", "lastValue", "updatedAt");
        assertThat(bins.getValue()[1].value.getObject()).isEqualTo(List.of(49.0, 51.0));
    }

    @Test
    void save_generationMismatch_throwsConflict() {
        doThrow(new AerospikeException(ResultCode.GENERATION_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
        DeviceState state = TestDataFactory.createState("dev-1", TestDataFactory.alternatingReadings(5));

        assertThatThrownBy(() -> repository.save(state, true))
                .isInstanceOfSatisfying(StateWriteConflictException.class,
                        e -> assertThat(e.getExpectedGeneration()).isEqualTo(1));
    }

    @Test
    void save_recordCreatedConcurrently_throwsConflict() {
        doThrow(new AerospikeException(ResultCode.KEY_EXISTS_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.save(DeviceState.empty("dev-1", 100), true))
                .isInstanceOf(StateWriteConflictException.class);
    }

    @Test
    void save_otherStoreError_propagatesUnchanged() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.save(DeviceState.empty("dev-1", 100), true))
                .isInstanceOf(AerospikeException.class)
                .isNotInstanceOf(StateWriteConflictException.class);
    }
}
