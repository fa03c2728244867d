package com.iotstuff.anomaly.service;

import com.iotstuff.anomaly.engine.ThresholdCalculator;
import com.iotstuff.anomaly.engine.WindowStatistics;
import com.iotstuff.anomaly.model.Baseline;
import com.iotstuff.anomaly.model.ThresholdSet;
import com.iotstuff.anomaly.repository.BaselineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Calibrates and manages pinned baselines. A baseline is computed once from a set of
 * representative readings and then overrides adaptive thresholds for that device.
 */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final BaselineRepository baselineRepository;

    public BaselineService(BaselineRepository baselineRepository) {
        this.baselineRepository = baselineRepository;
    }

    /**
     * @throws IllegalArgumentException with fewer than two readings, or any non-finite reading
     */
    public Baseline calibrate(String deviceId, List<Double> values) {
        if (values == null || values.size() < 2) {
            throw new IllegalArgumentException("At least 2 readings are required to calibrate a baseline");
        }
        if (values.stream().anyMatch(v -> v == null || !Double.isFinite(v))) {
            throw new IllegalArgumentException("Calibration readings must be finite numbers");
        }

        double mean = WindowStatistics.mean(values);
        double std = WindowStatistics.sampleStdDev(values);
        ThresholdSet thresholds = ThresholdCalculator.fromStatistics(mean, std);

        Baseline baseline = Baseline.builder()
                .deviceId(deviceId)
                .mean(mean)
                .std(std)
                .median(WindowStatistics.median(values))
                .zScoreThreshold(thresholds.zScore())
                .ewmaScoreThreshold(thresholds.ewmaScore())
                .rateOfChangeThreshold(thresholds.rateOfChange())
                .madThreshold(thresholds.mad())
                .hampelThreshold(thresholds.hampel())
                .sampleCount(values.size())
                .createdAt(System.currentTimeMillis())
                .build();

        baselineRepository.save(baseline);
        log.info("Calibrated baseline for device {} from {} readings", deviceId, values.size());
        return baseline;
    }

    public Baseline getBaseline(String deviceId) {
        return baselineRepository.findByDeviceId(deviceId);
    }

    public boolean deleteBaseline(String deviceId) {
        boolean deleted = baselineRepository.delete(deviceId);
        if (deleted) {
            log.info("Deleted baseline for device {}. Adaptive thresholds apply from the next reading.", deviceId);
        }
        return deleted;
    }
}
