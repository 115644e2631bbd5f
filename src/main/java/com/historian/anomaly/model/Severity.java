package com.historian.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Severity fromLabel(String label) {
        for (Severity severity : values()) {
            if (severity.label.equalsIgnoreCase(label)) return severity;
        }
        throw new IllegalArgumentException("Unknown severity: " + label);
    }

    /**
     * Classifies a deviation-to-threshold ratio. Non-decreasing in {@code ratio}.
     */
    public static Severity fromRatio(double ratio, double mediumAbove, double highAbove) {
        if (ratio > highAbove) return HIGH;
        if (ratio > mediumAbove) return MEDIUM;
        return LOW;
    }

    public boolean isMoreSevereThan(Severity other) {
        return other == null || ordinal() > other.ordinal();
    }
}
