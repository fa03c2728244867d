package com.iotstuff.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Per-detector trigger thresholds for a single reading. Recomputed every invocation, never persisted.
 */
@Schema(description = "Thresholds the five detectors were compared against")
public record ThresholdSet(@JsonProperty("z_score") double zScore,
                           @JsonProperty("ewma_score") double ewmaScore,
                           @JsonProperty("rate_of_change") double rateOfChange,
                           @JsonProperty("mad") double mad,
                           @JsonProperty("hampel") double hampel) {

    public double forDetector(DetectorType type) {
        switch (type) {
            case Z_SCORE:
                return zScore;
            case EWMA_SCORE:
                return ewmaScore;
            case RATE_OF_CHANGE:
                return rateOfChange;
            case MAD:
                return mad;
            case HAMPEL:
                return hampel;
            default:
                throw new IllegalArgumentException("Unknown detector: " + type);
        }
    }
}
