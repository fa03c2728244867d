package com.iotstuff.anomaly.engine;

import com.iotstuff.anomaly.model.AnomalyReport;
import com.iotstuff.anomaly.model.DeviceState;

import java.util.List;

/**
 * Result of running the engine over one reading: the state to persist, whether the device is
 * still warming up, every detector's outcome (empty while warming up), and the report if any.
 */
public record DetectionOutcome(DeviceState nextState,
                               boolean warmingUp,
                               List<DetectorOutcome> detectorOutcomes,
                               AnomalyReport report) {

    public static DetectionOutcome warmingUp(DeviceState nextState) {
        return new DetectionOutcome(nextState, true, List.of(), null);
    }

    public boolean isAnomaly() {
        return report != null;
    }
}
