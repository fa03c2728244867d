package com.iotstuff.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Counts for a batch of readings")
public record IngestionSummary(int recordsProcessed, int anomaliesDetected, int recordsFailed) {}
