package com.iotstuff.anomaly.engine;

import com.iotstuff.anomaly.model.DetectorType;

public record DetectorOutcome(DetectorType type, double score, boolean triggered) {

    /**
     * The detector could not produce a meaningful score (zero spread, too little history).
     */
    public static DetectorOutcome abstain(DetectorType type) {
        return new DetectorOutcome(type, 0.0, false);
    }

    public static DetectorOutcome scored(DetectorType type, double score, double threshold) {
        return new DetectorOutcome(type, score, score > threshold);
    }
}
