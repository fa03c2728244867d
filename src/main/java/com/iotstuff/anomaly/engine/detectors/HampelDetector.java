package com.iotstuff.anomaly.engine.detectors;

import com.iotstuff.anomaly.engine.DetectionContext;
import com.iotstuff.anomaly.engine.Detector;
import com.iotstuff.anomaly.engine.DetectorOutcome;
import com.iotstuff.anomaly.engine.WindowStatistics;
import com.iotstuff.anomaly.model.DetectorType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Hampel filter: compares the newest reading with the median and MAD of the 2k readings
 * immediately before it. Needs at least 2k+1 readings; abstains when the MAD is zero.
 */
@Component
public class HampelDetector implements Detector {

    @Override
    public DetectorType getType() {
        return DetectorType.HAMPEL;
    }

    @Override
    public DetectorOutcome evaluate(DetectionContext context, double threshold) {
        List<Double> window = context.getWindow();
        int k = context.getHampelK();
        if (k < 1 || window.size() < 2 * k + 1) {
            return DetectorOutcome.abstain(getType());
        }

        int newest = window.size() - 1;
        List<Double> preceding = window.subList(newest - 2 * k, newest);
        double median = WindowStatistics.median(preceding);
        double mad = WindowStatistics.medianAbsoluteDeviation(preceding, median);
        if (mad == 0) {
            return DetectorOutcome.abstain(getType());
        }
        double score = Math.abs(context.getValue() - median) / mad;
        return DetectorOutcome.scored(getType(), score, threshold);
    }
}
