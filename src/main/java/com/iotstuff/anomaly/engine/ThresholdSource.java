package com.iotstuff.anomaly.engine;

import com.iotstuff.anomaly.model.Baseline;

/**
 * Where a reading's thresholds come from: a device's pinned baseline, or the live window.
 */
public sealed interface ThresholdSource permits ThresholdSource.Pinned, ThresholdSource.Adaptive {

    static ThresholdSource of(Baseline baseline) {
        return baseline != null ? new Pinned(baseline) : new Adaptive();
    }

    record Pinned(Baseline baseline) implements ThresholdSource {}

    record Adaptive() implements ThresholdSource {}
}
