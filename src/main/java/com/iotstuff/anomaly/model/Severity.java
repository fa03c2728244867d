package com.iotstuff.anomaly.model;

public enum Severity {
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Classifies a reading that already passed the trigger-count gate.
     * CRITICAL is checked first, then HIGH; anything else is MEDIUM.
     */
    public static Severity classify(int triggeredCount, double zScore, double zScoreThreshold) {
        if (triggeredCount >= 4 || zScore > 2 * zScoreThreshold) return CRITICAL;
        if (triggeredCount >= 3 || zScore > 1.5 * zScoreThreshold) return HIGH;
        return MEDIUM;
    }

    public boolean isAtLeast(Severity floor) {
        return compareTo(floor) >= 0;
    }
}
