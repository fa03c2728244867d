package com.iotstuff.anomaly.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Calibrated "zero state" for a device. When present its pinned thresholds replace
 * adaptive threshold calculation entirely. Never modified by the detection path.
 * Bound to JSON through its fields only, so the snake_case names are the only keys.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
@Schema(description = "Pinned baseline statistics and detector thresholds for a device")
public class Baseline {

    @Schema(description = "Device identifier", example = "dev-1")
    @JsonProperty("device_id")
    private String deviceId;

    @Schema(description = "Mean of the calibration data", example = "48.5")
    private double mean;

    @Schema(description = "Sample standard deviation of the calibration data", example = "3.2")
    private double std;

    @Schema(description = "Median of the calibration data", example = "48.0")
    private double median;

    @JsonProperty("z_score_threshold")
    private double zScoreThreshold;

    @JsonProperty("ewma_score_threshold")
    private double ewmaScoreThreshold;

    @JsonProperty("rate_of_change_threshold")
    private double rateOfChangeThreshold;

    @JsonProperty("mad_threshold")
    private double madThreshold;

    @JsonProperty("hampel_threshold")
    private double hampelThreshold;

    @Schema(description = "Number of readings the baseline was computed from", example = "500")
    @JsonProperty("sample_count")
    private int sampleCount;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    @JsonProperty("created_at")
    private long createdAt;

    public ThresholdSet toThresholdSet() {
        return new ThresholdSet(zScoreThreshold, ewmaScoreThreshold, rateOfChangeThreshold,
                madThreshold, hampelThreshold);
    }
}
