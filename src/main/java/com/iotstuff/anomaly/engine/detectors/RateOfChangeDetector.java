package com.iotstuff.anomaly.engine.detectors;

import com.iotstuff.anomaly.engine.DetectionContext;
import com.iotstuff.anomaly.engine.Detector;
import com.iotstuff.anomaly.engine.DetectorOutcome;
import com.iotstuff.anomaly.model.DetectorType;
import org.springframework.stereotype.Component;

/**
 * Absolute jump from the previous reading. Scores 0 for a device's first reading.
 */
@Component
public class RateOfChangeDetector implements Detector {

    @Override
    public DetectorType getType() {
        return DetectorType.RATE_OF_CHANGE;
    }

    @Override
    public DetectorOutcome evaluate(DetectionContext context, double threshold) {
        Double previous = context.getPreviousValue();
        double score = previous != null ? Math.abs(context.getValue() - previous) : 0.0;
        return DetectorOutcome.scored(getType(), score, threshold);
    }
}
