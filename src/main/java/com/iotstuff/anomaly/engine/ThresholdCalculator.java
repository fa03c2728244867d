package com.iotstuff.anomaly.engine;

import com.iotstuff.anomaly.config.DetectionConfig;
import com.iotstuff.anomaly.model.Baseline;
import com.iotstuff.anomaly.model.ThresholdSet;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives the five detector thresholds for a reading.
 *
 * A pinned baseline wins outright. Otherwise a window below half capacity gets the fixed
 * defaults, and a warm window gets thresholds clamped from its mean and standard deviation:
 * <pre>
 *   z_score        = clamp(mean/std,        2.0, 3.0)   (2.5 when std == 0)
 *   ewma_score     = clamp(2*std/mean,      1.5, 2.5)   (2.0 when mean <= 0)
 *   rate_of_change = clamp(3*std,          15.0, 25.0)
 *   mad            = clamp(3.5 + std/10,    3.0, 4.0)
 *   hampel         = clamp(3.0 + std/20,    2.5, 3.5)
 * </pre>
 */
@Component
public class ThresholdCalculator {

    private final DetectionConfig config;

    public ThresholdCalculator(DetectionConfig config) {
        this.config = config;
    }

    public ThresholdSet compute(List<Double> window, Baseline baseline) {
        return compute(window, ThresholdSource.of(baseline));
    }

    public ThresholdSet compute(List<Double> window, ThresholdSource source) {
        if (source instanceof ThresholdSource.Pinned pinned) {
            return pinned.baseline().toThresholdSet();
        }
        if (window.size() < config.getWarmUpSize()) {
            return config.getDefaultThresholds().toThresholdSet();
        }
        return fromStatistics(WindowStatistics.mean(window), WindowStatistics.sampleStdDev(window));
    }

    public static ThresholdSet fromStatistics(double mean, double std) {
        return new ThresholdSet(
                clamp(std > 0 ? mean / std : 2.5, 2.0, 3.0),
                clamp(mean > 0 ? 2 * std / mean : 2.0, 1.5, 2.5),
                clamp(3 * std, 15.0, 25.0),
                clamp(3.5 + std / 10, 3.0, 4.0),
                clamp(3.0 + std / 20, 2.5, 3.5));
    }

    static double clamp(double x, double lo, double hi) {
        return Math.max(lo, Math.min(hi, x));
    }
}
