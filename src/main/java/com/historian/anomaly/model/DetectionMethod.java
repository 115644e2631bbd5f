package com.historian.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Detector families reported in an {@link AnomalySummary}.
 */
public enum DetectionMethod {
    STATISTICAL_DEVIATION("statistical-deviation"),
    ADVANCED_MULTI_ALGORITHM("advanced-multi-algorithm"),
    PATTERN_CHANGE("pattern-change"),
    TREND_CHANGE("trend-change");

    private final String tag;

    DetectionMethod(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
