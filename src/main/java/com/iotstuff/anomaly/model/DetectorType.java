package com.iotstuff.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectorType {
    Z_SCORE("z_score"),
    EWMA_SCORE("ewma_score"),
    RATE_OF_CHANGE("rate_of_change"),
    MAD("mad"),
    HAMPEL("hampel");

    private final String key;

    DetectorType(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
