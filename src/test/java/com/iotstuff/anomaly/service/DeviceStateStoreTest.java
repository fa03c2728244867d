package com.iotstuff.anomaly.service;

import com.iotstuff.anomaly.config.DetectionConfig;
import com.iotstuff.anomaly.config.MetricsConfig;
import com.iotstuff.anomaly.model.Baseline;
import com.iotstuff.anomaly.model.DeviceState;
import com.iotstuff.anomaly.repository.BaselineRepository;
import com.iotstuff.anomaly.repository.CorruptStateException;
import com.iotstuff.anomaly.repository.DeviceStateRepository;
import com.iotstuff.anomaly.repository.StateWriteConflictException;
import com.iotstuff.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeviceStateStoreTest {

    @Mock private DeviceStateRepository stateRepository;
    @Mock private BaselineRepository baselineRepository;
    @Mock private MetricsConfig metricsConfig;

    private DetectionConfig config;
    private DeviceStateStore store;

    @BeforeEach
    void setUp() {
        config = new DetectionConfig();
        store = new DeviceStateStore(stateRepository, baselineRepository, config, metricsConfig);
    }

    @Test
    void load_noRecord_returnsEmptyStateWithoutFallback() {
        when(stateRepository.findByDeviceId("dev-1", 100)).thenReturn(null);

        DeviceState state = store.load("dev-1");

        assertThat(state.getDeviceId()).isEqualTo("dev-1");
        assertThat(state.getWindow().isEmpty()).isTrue();
        assertThat(state.getWindow().capacity()).isEqualTo(100);
        assertThat(state.getSmoothing().getEwma()).isNull();
        assertThat(state.isPersisted()).isFalse();
        verifyNoInteractions(metricsConfig);
    }

    @Test
    void load_existingRecord_returnsIt() {
        DeviceState stored = TestDataFactory.createState("dev-1", TestDataFactory.alternatingReadings(10));
        when(stateRepository.findByDeviceId("dev-1", 100)).thenReturn(stored);

        assertThat(store.load("dev-1")).isSameAs(stored);
    }

    @Test
    void load_storeUnavailable_degradesToColdStart() {
        when(stateRepository.findByDeviceId("dev-1", 100)).thenThrow(new RuntimeException("connection refused"));

        DeviceState state = store.load("dev-1");

        assertThat(state.getWindow().isEmpty()).isTrue();
        assertThat(state.getGeneration()).isZero();
        verify(metricsConfig).recordStateFallback("load");
    }

    @Test
    void load_corruptRecord_degradesToColdStartKeepingGeneration() {
        when(stateRepository.findByDeviceId("dev-1", 100))
                .thenThrow(new CorruptStateException("dev-1", 9, new ClassCastException()));

        DeviceState state = store.load("dev-1");

        assertThat(state.getWindow().isEmpty()).isTrue();
        assertThat(state.getGeneration()).isEqualTo(9);
        verify(metricsConfig).recordStateFallback("load_corrupt");
    }

    @Test
    void save_passesLockingModeToRepository() {
        DeviceState state = DeviceState.empty("dev-1", 100);

        assertThat(store.save(state)).isTrue();
        verify(stateRepository).save(state, true);

        config.getState().setOptimisticLocking(false);
        store.save(state);
        verify(stateRepository).save(state, false);
    }

    @Test
    void save_conflict_propagatesForRetry() {
        DeviceState state = DeviceState.empty("dev-1", 100);
        doThrow(new StateWriteConflictException("dev-1", 0, null)).when(stateRepository).save(state, true);

        assertThatThrownBy(() -> store.save(state)).isInstanceOf(StateWriteConflictException.class);
    }

    @Test
    void save_storeFailure_isSwallowed() {
        DeviceState state = DeviceState.empty("dev-1", 100);
        doThrow(new RuntimeException("timeout")).when(stateRepository).save(state, true);

        assertThat(store.save(state)).isFalse();
        verify(metricsConfig).recordStateFallback("save");
    }

    @Test
    void loadBaseline_present_returnsIt() {
        Baseline baseline = TestDataFactory.createBaseline("dev-1");
        when(baselineRepository.findByDeviceId("dev-1")).thenReturn(baseline);

        assertThat(store.loadBaseline("dev-1")).isSameAs(baseline);
    }

    @Test
    void loadBaseline_failure_fallsBackToAdaptive() {
        when(baselineRepository.findByDeviceId("dev-1")).thenThrow(new IllegalStateException("bad json"));

        assertThat(store.loadBaseline("dev-1")).isNull();
        verify(metricsConfig).recordStateFallback("baseline");
    }
}
