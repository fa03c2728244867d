package com.iotstuff.anomaly.engine;

import com.iotstuff.anomaly.model.DetectorType;

/**
 * One statistical test for abnormal readings.
 * A detector triggers when its score strictly exceeds the threshold it is given.
 */
public interface Detector {

    DetectorType getType();

    /**
     * @param context   statistics for the current reading
     * @param threshold this detector's threshold for the current reading
     * @return the score, or {@link DetectorOutcome#abstain} when the score is undefined
     */
    DetectorOutcome evaluate(DetectionContext context, double threshold);
}
