package com.iotstuff.anomaly.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iotstuff.anomaly.config.EventPublishingConfig;
import com.iotstuff.anomaly.config.MetricsConfig;
import com.iotstuff.anomaly.model.AnomalyEvent;
import com.iotstuff.anomaly.model.AnomalyReport;
import com.iotstuff.anomaly.model.TelemetryReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes anomaly events to the event bus topic, keyed by device id.
 * One attempt per event; failures are logged and counted, never rethrown.
 */
@Service
public class AnomalyEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEventPublisher.class);
    private static final String SINK = "kafka";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final EventPublishingConfig config;
    private final MetricsConfig metricsConfig;

    public AnomalyEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                 ObjectMapper objectMapper,
                                 EventPublishingConfig config,
                                 MetricsConfig metricsConfig) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public AnomalyEvent toEvent(TelemetryReading reading, AnomalyReport report) {
        return AnomalyEvent.builder()
                .source(config.getSource())
                .detailType(config.getDetailType())
                .deviceId(reading.getDeviceId())
                .timestamp(reading.getTimestamp())
                .anomalyType(config.getAnomalyType())
                .deviceLocation(config.getDeviceLocation())
                .deviceName(config.getDeviceName())
                .report(report)
                .build();
    }

    /**
     * @return true when the event was handed to the producer; delivery is not awaited
     */
    public boolean publish(AnomalyEvent event) {
        if (!config.isEnabled()) {
            return false;
        }

        try {
            String payload = objectMapper.writeValueAsString(event);
            kafkaTemplate.send(config.getTopic(), event.getDeviceId(), payload)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            metricsConfig.recordPublish(SINK, "error");
                            log.error("Failed to deliver anomaly event for device={}: {}",
                                    event.getDeviceId(), ex.getMessage(), ex);
                        } else {
                            metricsConfig.recordPublish(SINK, "success");
                            log.info("Published {} event for device={} to {}",
                                    config.getDetailType(), event.getDeviceId(), config.getTopic());
                        }
                    });
            return true;
        } catch (Exception e) {
            metricsConfig.recordPublish(SINK, "error");
            log.error("Failed to publish anomaly event for device={}: {}", event.getDeviceId(), e.getMessage(), e);
            return false;
        }
    }
}
