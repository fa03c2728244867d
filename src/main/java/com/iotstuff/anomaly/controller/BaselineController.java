package com.iotstuff.anomaly.controller;

import com.iotstuff.anomaly.model.Baseline;
import com.iotstuff.anomaly.service.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/devices/{deviceId}/baseline")
@Tag(name = "Baselines", description = "Calibrate and manage pinned detector thresholds per device")
public class BaselineController {

    private final BaselineService baselineService;

    public BaselineController(BaselineService baselineService) {
        this.baselineService = baselineService;
    }

    @Operation(summary = "Calibrate a baseline",
            description = "Computes mean, standard deviation, median and the five detector thresholds from the " +
                    "given readings and pins them for the device. Replaces any existing baseline.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = Baseline.class)))
    @ApiResponse(responseCode = "400", description = "Fewer than two readings, or a non-finite reading")
    @PostMapping
    public ResponseEntity<?> calibrate(
            @Parameter(description = "Device ID", example = "dev-1")
            @PathVariable String deviceId,
            @RequestBody List<Double> values) {
        try {
            return ResponseEntity.ok(baselineService.calibrate(deviceId, values));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get the pinned baseline")
    @GetMapping
    public ResponseEntity<Baseline> getBaseline(
            @Parameter(description = "Device ID", example = "dev-1")
            @PathVariable String deviceId) {
        Baseline baseline = baselineService.getBaseline(deviceId);
        if (baseline == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(baseline);
    }

    @Operation(summary = "Remove the pinned baseline",
            description = "The device falls back to adaptive thresholds from its next reading.")
    @DeleteMapping
    public ResponseEntity<Void> deleteBaseline(
            @Parameter(description = "Device ID", example = "dev-1")
            @PathVariable String deviceId) {
        if (!baselineService.deleteBaseline(deviceId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
