package com.iotstuff.anomaly.config;

import com.iotstuff.anomaly.model.ThresholdSet;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Number of most recent readings kept per device (FIFO).
    private int windowCapacity = 100;

    // EWMA smoothing factor for the mean (0 < alpha <= 1).
    private double alpha = 0.1;

    // Decay factor for the exponentially weighted deviation.
    private double lambda = 0.98;

    // Hampel half-width; the filter needs 2k+1 readings.
    private int hampelK = 7;

    // Number of detectors that must agree before a reading is reported.
    private int minTriggers = 2;

    // Thresholds used while the window is below half capacity.
    private DefaultThresholds defaultThresholds = new DefaultThresholds();

    private State state = new State();

    /**
     * Readings needed before the full scoring path runs.
     */
    public int getWarmUpSize() {
        return windowCapacity / 2;
    }

    @Data
    public static class DefaultThresholds {
        private double zScore = 2.5;
        private double ewmaScore = 2.0;
        private double rateOfChange = 20.0;
        private double mad = 3.5;
        private double hampel = 3.0;

        public ThresholdSet toThresholdSet() {
            return new ThresholdSet(zScore, ewmaScore, rateOfChange, mad, hampel);
        }
    }

    @Data
    public static class State {
        // Conditional writes keyed on the record generation. false = last writer wins.
        private boolean optimisticLocking = true;
        private int maxWriteAttempts = 3;
    }
}
