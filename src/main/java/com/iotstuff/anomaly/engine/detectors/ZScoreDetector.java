package com.iotstuff.anomaly.engine.detectors;

import com.iotstuff.anomaly.engine.DetectionContext;
import com.iotstuff.anomaly.engine.Detector;
import com.iotstuff.anomaly.engine.DetectorOutcome;
import com.iotstuff.anomaly.model.DetectorType;
import org.springframework.stereotype.Component;

/**
 * Distance of the reading from the window mean, in sample standard deviations.
 */
@Component
public class ZScoreDetector implements Detector {

    @Override
    public DetectorType getType() {
        return DetectorType.Z_SCORE;
    }

    @Override
    public DetectorOutcome evaluate(DetectionContext context, double threshold) {
        if (context.getStd() <= 0) {
            return DetectorOutcome.abstain(getType());
        }
        double score = Math.abs(context.getValue() - context.getMean()) / context.getStd();
        return DetectorOutcome.scored(getType(), score, threshold);
    }
}
