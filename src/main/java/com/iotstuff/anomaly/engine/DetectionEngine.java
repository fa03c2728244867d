package com.iotstuff.anomaly.engine;

import com.iotstuff.anomaly.config.DetectionConfig;
import com.iotstuff.anomaly.model.AnomalyReport;
import com.iotstuff.anomaly.model.Baseline;
import com.iotstuff.anomaly.model.DetectorType;
import com.iotstuff.anomaly.model.DeviceState;
import com.iotstuff.anomaly.model.RollingWindow;
import com.iotstuff.anomaly.model.Severity;
import com.iotstuff.anomaly.model.SmoothingState;
import com.iotstuff.anomaly.model.TelemetryReading;
import com.iotstuff.anomaly.model.ThresholdSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores one reading against a device's rolling window.
 *
 * Flow:
 * 1. Append the reading to a copy of the window (oldest evicted when full)
 * 2. Below half capacity: warming up, only the last value is carried forward
 * 3. Resolve thresholds (pinned baseline, else adaptive)
 * 4. Update the EWMA and EW-std with the reading
 * 5. Run every registered detector
 * 6. Report when at least {@code minTriggers} detectors agree, with a severity
 *
 * The engine does no I/O: the same state, baseline and reading always give the same outcome.
 * The input state is never modified.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final DetectionConfig config;
    private final ThresholdCalculator thresholdCalculator;
    private final Map<DetectorType, Detector> detectors;

    public DetectionEngine(DetectionConfig config, ThresholdCalculator thresholdCalculator,
                           List<Detector> detectors) {
        this.config = config;
        this.thresholdCalculator = thresholdCalculator;
        // EnumMap iterates in declaration order, which fixes the order of methods_triggered
        this.detectors = new EnumMap<>(DetectorType.class);

        for (Detector detector : detectors) {
            this.detectors.put(detector.getType(), detector);
            log.info("Registered detector: {} -> {}",
                    detector.getType().getKey(), detector.getClass().getSimpleName());
        }
    }

    public DetectionOutcome process(TelemetryReading reading, DeviceState state, Baseline baseline) {
        double value = reading.getValue();
        RollingWindow window = state.getWindow().copy();
        window.append(value);

        SmoothingState prior = state.getSmoothing() != null ? state.getSmoothing() : SmoothingState.unset();

        if (window.size() < config.getWarmUpSize()) {
            log.debug("Device {} warming up ({}/{} readings)",
                    reading.getDeviceId(), window.size(), config.getWarmUpSize());
            SmoothingState next = prior.toBuilder().lastValue(value).build();
            return DetectionOutcome.warmingUp(state.toBuilder().window(window).smoothing(next).build());
        }

        List<Double> values = window.toList();
        ThresholdSet thresholds = thresholdCalculator.compute(values, baseline);
        double mean = WindowStatistics.mean(values);
        double std = WindowStatistics.sampleStdDev(values);

        double ewma = prior.getEwma() == null
                ? mean
                : config.getAlpha() * value + (1 - config.getAlpha()) * prior.getEwma();
        double deviation = Math.abs(value - ewma);
        double ewmstd = prior.getEwmstd() == null
                ? 1.0
                : Math.sqrt(config.getLambda() * prior.getEwmstd() * prior.getEwmstd()
                        + (1 - config.getLambda()) * deviation * deviation);

        DetectionContext context = DetectionContext.builder()
                .value(value)
                .window(values)
                .mean(mean)
                .std(std)
                .ewmaDeviation(deviation)
                .ewmstd(ewmstd)
                .previousValue(prior.getLastValue())
                .hampelK(config.getHampelK())
                .build();

        List<DetectorOutcome> outcomes = runDetectors(reading.getDeviceId(), context, thresholds);

        SmoothingState next = SmoothingState.builder()
                .ewma(ewma)
                .ewmstd(ewmstd)
                .lastValue(value)
                .build();
        DeviceState nextState = state.toBuilder().window(window).smoothing(next).build();

        List<DetectorType> triggered = outcomes.stream()
                .filter(DetectorOutcome::triggered)
                .map(DetectorOutcome::type)
                .toList();

        if (triggered.size() < config.getMinTriggers()) {
            return new DetectionOutcome(nextState, false, outcomes, null);
        }

        double zScore = scoreOf(outcomes, DetectorType.Z_SCORE);
        Severity severity = Severity.classify(triggered.size(), zScore, thresholds.zScore());

        AnomalyReport report = AnomalyReport.builder()
                .value(value)
                .severity(severity)
                .methodsTriggered(triggered)
                .methodCount(triggered.size())
                .zScore(zScore)
                .ewmaScore(scoreOf(outcomes, DetectorType.EWMA_SCORE))
                .rateOfChange(scoreOf(outcomes, DetectorType.RATE_OF_CHANGE))
                .madScore(scoreOf(outcomes, DetectorType.MAD))
                .hampelRatio(scoreOf(outcomes, DetectorType.HAMPEL))
                .hampelTriggered(triggered.contains(DetectorType.HAMPEL))
                .mean(mean)
                .std(std)
                .thresholds(thresholds)
                .window(List.copyOf(values))
                .build();

        log.info("Anomaly detected for device={}: value={}, severity={}, methods={}",
                reading.getDeviceId(), value, severity, triggered);

        return new DetectionOutcome(nextState, false, outcomes, report);
    }

    private List<DetectorOutcome> runDetectors(String deviceId, DetectionContext context,
                                               ThresholdSet thresholds) {
        List<DetectorOutcome> outcomes = new ArrayList<>(detectors.size());
        for (Map.Entry<DetectorType, Detector> entry : detectors.entrySet()) {
            DetectorType type = entry.getKey();
            try {
                DetectorOutcome outcome = entry.getValue().evaluate(context, thresholds.forDetector(type));
                outcomes.add(outcome);
                if (outcome.triggered()) {
                    log.debug("Detector {} triggered for device {}: score={}, threshold={}",
                            type.getKey(), deviceId, outcome.score(), thresholds.forDetector(type));
                }
            } catch (Exception e) {
                log.error("Detector {} failed for device {}: {}", type.getKey(), deviceId, e.getMessage(), e);
                // One broken detector abstains rather than failing the reading
                outcomes.add(DetectorOutcome.abstain(type));
            }
        }
        return outcomes;
    }

    private static double scoreOf(List<DetectorOutcome> outcomes, DetectorType type) {
        return outcomes.stream()
                .filter(o -> o.type() == type)
                .mapToDouble(DetectorOutcome::score)
                .findFirst()
                .orElse(0.0);
    }
}
