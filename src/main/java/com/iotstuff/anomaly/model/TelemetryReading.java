package com.iotstuff.anomaly.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "A single CPU usage sample reported by a device")
public class TelemetryReading {

    @Schema(description = "Device identifier", example = "dev-1")
    @JsonAlias("device_id")
    private String deviceId;

    @Schema(description = "CPU usage in percent", example = "42.7")
    @JsonAlias({"cpu", "cpu_usage"})
    private Double value;

    @Schema(description = "Sample timestamp in epoch milliseconds. Defaults to current time if not provided.", example = "1739886764000")
    private long timestamp;

    public boolean isValid() {
        return deviceId != null && !deviceId.isBlank() && value != null && Double.isFinite(value);
    }
}
