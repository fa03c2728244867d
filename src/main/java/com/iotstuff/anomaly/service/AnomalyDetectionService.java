package com.iotstuff.anomaly.service;

import com.iotstuff.anomaly.config.DetectionConfig;
import com.iotstuff.anomaly.config.MetricsConfig;
import com.iotstuff.anomaly.engine.DetectionEngine;
import com.iotstuff.anomaly.engine.DetectionOutcome;
import com.iotstuff.anomaly.engine.DetectorOutcome;
import com.iotstuff.anomaly.model.AnomalyEvent;
import com.iotstuff.anomaly.model.AnomalyReport;
import com.iotstuff.anomaly.model.Baseline;
import com.iotstuff.anomaly.model.DetectionResult;
import com.iotstuff.anomaly.model.DeviceState;
import com.iotstuff.anomaly.model.IngestionSummary;
import com.iotstuff.anomaly.model.TelemetryReading;
import com.iotstuff.anomaly.repository.StateWriteConflictException;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for scoring readings.
 *
 * Flow per reading:
 * 1. Load the device's state and baseline (cold start on any store failure)
 * 2. Run the detection engine
 * 3. Save the updated state, conditional on the generation that was loaded
 * 4. On a write conflict, reload and score again (bounded attempts)
 * 5. Hand any report to the event bus and the notifier; failures there never reach the caller
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DeviceStateStore stateStore;
    private final DetectionEngine detectionEngine;
    private final AnomalyEventPublisher eventPublisher;
    private final TwilioNotificationService notificationService;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(DeviceStateStore stateStore,
                                   DetectionEngine detectionEngine,
                                   AnomalyEventPublisher eventPublisher,
                                   TwilioNotificationService notificationService,
                                   DetectionConfig config,
                                   MetricsConfig metricsConfig) {
        this.stateStore = stateStore;
        this.detectionEngine = detectionEngine;
        this.eventPublisher = eventPublisher;
        this.notificationService = notificationService;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "reading.detect", contextualName = "detect-anomaly")
    public DetectionResult detect(TelemetryReading reading) {
        String deviceId = reading.getDeviceId();
        int maxAttempts = Math.max(1, config.getState().getMaxWriteAttempts());
        DetectionOutcome outcome = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            DeviceState state = stateStore.load(deviceId);
            Baseline baseline = stateStore.loadBaseline(deviceId);

            outcome = detectionEngine.process(reading, state, baseline);

            try {
                stateStore.save(outcome.nextState());
                break;
            } catch (StateWriteConflictException e) {
                if (attempt < maxAttempts) {
                    metricsConfig.recordWriteConflict("retried");
                    log.debug("State for device {} changed concurrently (attempt {}/{}). Retrying.",
                            deviceId, attempt, maxAttempts);
                } else {
                    metricsConfig.recordWriteConflict("exhausted");
                    log.warn("Giving up on saving state for device {} after {} conflicting attempts. " +
                            "This reading is scored but not retained in the window.", deviceId, maxAttempts);
                }
            }
        }

        metricsConfig.recordReading(outcome.warmingUp() ? "warming_up" : "active");
        for (DetectorOutcome detector : outcome.detectorOutcomes()) {
            if (detector.triggered()) {
                metricsConfig.recordDetectorTriggered(detector.type().getKey());
            }
        }

        AnomalyReport report = outcome.report();
        if (report != null) {
            metricsConfig.recordAnomaly(report.getSeverity().name());
            dispatch(reading, report);
        }

        return DetectionResult.of(report);
    }

    /**
     * Scores a batch in order. Invalid readings are skipped and counted as failed; one bad
     * reading never stops the rest of the batch.
     */
    @Observed(name = "reading.detect_batch", contextualName = "detect-anomaly-batch")
    public IngestionSummary detectAll(List<TelemetryReading> readings) {
        int processed = 0;
        int anomalies = 0;
        int failed = 0;

        for (TelemetryReading reading : readings) {
            if (reading == null || !reading.isValid()) {
                failed++;
                log.warn("Skipping invalid reading: {}", reading);
                continue;
            }
            if (reading.getTimestamp() == 0) {
                reading.setTimestamp(System.currentTimeMillis());
            }
            try {
                DetectionResult result = detect(reading);
                processed++;
                if (result.anomalyDetected()) {
                    anomalies++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to process reading for device {}: {}",
                        reading.getDeviceId(), e.getMessage(), e);
            }
        }

        log.info("Batch complete: processed={}, anomalies={}, failed={}", processed, anomalies, failed);
        return new IngestionSummary(processed, anomalies, failed);
    }

    private void dispatch(TelemetryReading reading, AnomalyReport report) {
        try {
            AnomalyEvent event = eventPublisher.toEvent(reading, report);
            eventPublisher.publish(event);
            notificationService.notifyIfSevere(event);
        } catch (Exception e) {
            // Sinks are best effort; the detection result stands regardless
            log.error("Failed to dispatch anomaly for device {}: {}", reading.getDeviceId(), e.getMessage(), e);
        }
    }
}
