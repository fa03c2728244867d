package com.iotstuff.anomaly.controller;

import com.iotstuff.anomaly.model.DetectionResult;
import com.iotstuff.anomaly.model.IngestionSummary;
import com.iotstuff.anomaly.model.TelemetryReading;
import com.iotstuff.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/readings")
@Tag(name = "Readings", description = "Submit device telemetry for anomaly detection")
public class ReadingController {

    private final AnomalyDetectionService detectionService;

    public ReadingController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Score a reading",
            description = "Appends the reading to the device's rolling window and runs the five detectors. " +
                    "Returns anomalyDetected=true with a report when at least two detectors trigger.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = DetectionResult.class)))
    @ApiResponse(responseCode = "400", description = "Missing device id or non-finite value")
    @PostMapping
    public ResponseEntity<?> submitReading(@RequestBody TelemetryReading reading) {
        if (reading.getDeviceId() == null || reading.getDeviceId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "deviceId is required"));
        }
        if (reading.getValue() == null || !Double.isFinite(reading.getValue())) {
            return ResponseEntity.badRequest().body(Map.of("error", "value must be a finite number"));
        }

        if (reading.getTimestamp() == 0) {
            reading.setTimestamp(System.currentTimeMillis());
        }

        DetectionResult result = detectionService.detect(reading);
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Score a batch of readings",
            description = "Scores readings in order. Invalid readings are skipped and counted as failed.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = IngestionSummary.class)))
    @ApiResponse(responseCode = "400", description = "Missing batch body")
    @PostMapping("/batch")
    public ResponseEntity<?> submitBatch(@RequestBody(required = false) List<TelemetryReading> readings) {
        if (readings == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "a JSON array of readings is required"));
        }
        return ResponseEntity.ok(detectionService.detectAll(readings));
    }
}
