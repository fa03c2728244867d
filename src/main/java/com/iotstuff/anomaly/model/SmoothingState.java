package com.iotstuff.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exponentially weighted statistics for one device. Null fields mean "not yet computed".
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-device exponential smoothing state")
public class SmoothingState {

    @Schema(description = "Exponentially weighted moving average of the metric", example = "48.2")
    private Double ewma;

    @Schema(description = "Exponentially weighted standard deviation around the EWMA", example = "1.7")
    private Double ewmstd;

    @Schema(description = "Most recent reading value", example = "47.9")
    private Double lastValue;

    public static SmoothingState unset() {
        return new SmoothingState();
    }
}
