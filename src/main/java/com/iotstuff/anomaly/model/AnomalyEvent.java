package com.iotstuff.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope handed to the event sinks: the report flattened alongside device metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEvent {

    private String source;

    @JsonProperty("detail_type")
    private String detailType;

    @JsonProperty("device_id")
    private String deviceId;

    private long timestamp;

    @JsonProperty("anomaly_type")
    private String anomalyType;

    @JsonProperty("device_location")
    private String deviceLocation;

    @JsonProperty("device_name")
    private String deviceName;

    @JsonUnwrapped
    private AnomalyReport report;
}
