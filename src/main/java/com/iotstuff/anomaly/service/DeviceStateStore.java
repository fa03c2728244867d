package com.iotstuff.anomaly.service;

import com.iotstuff.anomaly.config.DetectionConfig;
import com.iotstuff.anomaly.config.MetricsConfig;
import com.iotstuff.anomaly.model.Baseline;
import com.iotstuff.anomaly.model.DeviceState;
import com.iotstuff.anomaly.repository.BaselineRepository;
import com.iotstuff.anomaly.repository.CorruptStateException;
import com.iotstuff.anomaly.repository.DeviceStateRepository;
import com.iotstuff.anomaly.repository.StateWriteConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The only persistence boundary of the detection path.
 *
 * Reads never fail: a missing record is a cold start, and any decode or connectivity
 * failure is logged and also treated as a cold start. Writes swallow store failures too,
 * except for write conflicts, which the caller retries.
 */
@Service
public class DeviceStateStore {

    private static final Logger log = LoggerFactory.getLogger(DeviceStateStore.class);

    private final DeviceStateRepository stateRepository;
    private final BaselineRepository baselineRepository;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public DeviceStateStore(DeviceStateRepository stateRepository,
                            BaselineRepository baselineRepository,
                            DetectionConfig config,
                            MetricsConfig metricsConfig) {
        this.stateRepository = stateRepository;
        this.baselineRepository = baselineRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public DeviceState load(String deviceId) {
        try {
            DeviceState state = stateRepository.findByDeviceId(deviceId, config.getWindowCapacity());
            if (state == null) {
                log.debug("No prior state for device {}. Starting cold.", deviceId);
                return DeviceState.empty(deviceId, config.getWindowCapacity());
            }
            return state;
        } catch (CorruptStateException e) {
            log.error("Failed to decode state for device {}. Starting cold.", deviceId, e);
            metricsConfig.recordStateFallback("load_corrupt");
            return DeviceState.empty(deviceId, config.getWindowCapacity()).toBuilder()
                    .generation(e.getGeneration())
                    .build();
        } catch (Exception e) {
            log.error("Failed to load state for device {}: {}. Starting cold.", deviceId, e.getMessage(), e);
            metricsConfig.recordStateFallback("load");
            return DeviceState.empty(deviceId, config.getWindowCapacity());
        }
    }

    /**
     * @return true when the state was written
     * @throws StateWriteConflictException when optimistic locking is on and another writer won
     */
    public boolean save(DeviceState state) {
        try {
            stateRepository.save(state, config.getState().isOptimisticLocking());
            return true;
        } catch (StateWriteConflictException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to save state for device {}: {}", state.getDeviceId(), e.getMessage(), e);
            metricsConfig.recordStateFallback("save");
            return false;
        }
    }

    public Baseline loadBaseline(String deviceId) {
        try {
            return baselineRepository.findByDeviceId(deviceId);
        } catch (Exception e) {
            log.error("Failed to load baseline for device {}: {}. Using adaptive thresholds.",
                    deviceId, e.getMessage(), e);
            metricsConfig.recordStateFallback("baseline");
            return null;
        }
    }
}
