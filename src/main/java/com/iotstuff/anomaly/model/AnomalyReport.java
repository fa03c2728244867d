package com.iotstuff.anomaly.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Bound to JSON through its fields and builder only; getters are not JSON properties,
 * so each value has exactly one snake_case key.
 */
@Value
@Builder
@Jacksonized
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE)
@Schema(description = "Anomaly produced when at least two detectors trigger on a reading")
public class AnomalyReport {

    @Schema(description = "The reading value that triggered the report", example = "95.0")
    double value;

    @Schema(description = "Severity: MEDIUM, HIGH or CRITICAL", example = "HIGH")
    Severity severity;

    @Schema(description = "Detectors whose score exceeded their threshold", example = "[\"z_score\", \"rate_of_change\"]")
    @JsonProperty("methods_triggered")
    List<DetectorType> methodsTriggered;

    @Schema(description = "Number of detectors triggered", example = "3")
    @JsonProperty("method_count")
    int methodCount;

    @JsonProperty("z_score")
    double zScore;

    @JsonProperty("ewma_score")
    double ewmaScore;

    @JsonProperty("rate_of_change")
    double rateOfChange;

    @Schema(description = "Modified z-score of the reading against the window median")
    @JsonProperty("mad_score")
    double madScore;

    @Schema(description = "Hampel ratio against the preceding readings")
    @JsonProperty("hampel_ratio")
    double hampelRatio;

    @Schema(description = "Whether the Hampel filter triggered")
    @JsonProperty("hampel_score")
    boolean hampelTriggered;

    @Schema(description = "Window mean at detection time", example = "50.1")
    @JsonProperty("cpu_mean")
    double mean;

    @Schema(description = "Window sample standard deviation at detection time", example = "5.8")
    @JsonProperty("cpu_std")
    double std;

    @Schema(description = "Thresholds in effect for this reading")
    ThresholdSet thresholds;

    @Schema(description = "Snapshot of the rolling window, oldest first, including the reported value")
    @JsonProperty("cpu_window")
    List<Double> window;
}
