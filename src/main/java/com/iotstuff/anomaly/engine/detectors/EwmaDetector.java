package com.iotstuff.anomaly.engine.detectors;

import com.iotstuff.anomaly.engine.DetectionContext;
import com.iotstuff.anomaly.engine.Detector;
import com.iotstuff.anomaly.engine.DetectorOutcome;
import com.iotstuff.anomaly.model.DetectorType;
import org.springframework.stereotype.Component;

/**
 * Deviation from the exponentially weighted mean, scaled by the exponentially weighted
 * standard deviation. A zero EW-std is treated as 1.0.
 */
@Component
public class EwmaDetector implements Detector {

    @Override
    public DetectorType getType() {
        return DetectorType.EWMA_SCORE;
    }

    @Override
    public DetectorOutcome evaluate(DetectionContext context, double threshold) {
        double ewmstd = context.getEwmstd() != 0 ? context.getEwmstd() : 1.0;
        double score = context.getEwmaDeviation() / ewmstd;
        return DetectorOutcome.scored(getType(), score, threshold);
    }
}
