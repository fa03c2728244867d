package com.iotstuff.anomaly.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iotstuff.anomaly.model.TelemetryReading;
import com.iotstuff.anomaly.service.AnomalyDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Stream trigger: consumes JSON readings from the telemetry topic and scores each one.
 * Messages that cannot be decoded are logged and dropped.
 */
@Component
@ConditionalOnProperty(prefix = "ingestion.kafka", name = "enabled", havingValue = "true")
public class ReadingStreamListener {

    private static final Logger log = LoggerFactory.getLogger(ReadingStreamListener.class);

    private final AnomalyDetectionService detectionService;
    private final ObjectMapper objectMapper;

    public ReadingStreamListener(AnomalyDetectionService detectionService, ObjectMapper objectMapper) {
        this.detectionService = detectionService;
        this.objectMapper = objectMapper;
    }

    @KafkaListener(topics = "${ingestion.kafka.topic:telemetry.readings}",
            groupId = "${ingestion.kafka.group-id:anomaly-detection}")
    public void onMessage(String payload) {
        TelemetryReading reading;
        try {
            reading = objectMapper.readValue(payload, TelemetryReading.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping undecodable telemetry message: {}", e.getOriginalMessage());
            return;
        }

        if (!reading.isValid()) {
            log.warn("Dropping invalid reading: {}", reading);
            return;
        }
        if (reading.getTimestamp() == 0) {
            reading.setTimestamp(System.currentTimeMillis());
        }

        detectionService.detect(reading);
    }
}
