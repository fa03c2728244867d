package com.iotstuff.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of scoring one reading")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionResult(boolean anomalyDetected, AnomalyReport report) {

    public static DetectionResult none() {
        return new DetectionResult(false, null);
    }

    public static DetectionResult of(AnomalyReport report) {
        return report == null ? none() : new DetectionResult(true, report);
    }
}
