package com.iotstuff.anomaly.engine.detectors;

import com.iotstuff.anomaly.engine.DetectionContext;
import com.iotstuff.anomaly.engine.Detector;
import com.iotstuff.anomaly.engine.DetectorOutcome;
import com.iotstuff.anomaly.engine.WindowStatistics;
import com.iotstuff.anomaly.model.DetectorType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Iglewicz-Hoaglin modified z-score over the whole window:
 * {@code 0.6745 * (value - median) / MAD}. Only readings above the median can trigger.
 * Abstains when the MAD is zero.
 */
@Component
public class ModifiedZScoreDetector implements Detector {

    static final double CONSISTENCY_CONSTANT = 0.6745;

    @Override
    public DetectorType getType() {
        return DetectorType.MAD;
    }

    @Override
    public DetectorOutcome evaluate(DetectionContext context, double threshold) {
        List<Double> window = context.getWindow();
        if (window.isEmpty()) {
            return DetectorOutcome.abstain(getType());
        }
        double median = WindowStatistics.median(window);
        double mad = WindowStatistics.medianAbsoluteDeviation(window, median);
        if (mad == 0) {
            return DetectorOutcome.abstain(getType());
        }
        double score = CONSISTENCY_CONSTANT * (context.getValue() - median) / mad;
        return DetectorOutcome.scored(getType(), score, threshold);
    }
}
