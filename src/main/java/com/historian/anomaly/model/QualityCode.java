package com.historian.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Historian quality codes attached to each sample. Accepted on the wire either
 * by name or as the raw historian code.
 */
public enum QualityCode {
    GOOD(192),
    BAD(0),
    UNCERTAIN(64);

    private final int code;

    QualityCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Maps a raw historian code to a quality. Codes the historian reports for
     * failures (not connected, sensor failure, ...) are treated as BAD.
     */
    public static QualityCode fromCode(int code) {
        for (QualityCode quality : values()) {
            if (quality.code == code) return quality;
        }
        return BAD;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static QualityCode fromJson(Object value) {
        if (value instanceof Number number) {
            return fromCode(number.intValue());
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            for (QualityCode quality : values()) {
                if (quality.name().equalsIgnoreCase(trimmed)) return quality;
            }
            try {
                return fromCode(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Unknown quality: " + text, e);
            }
        }
        throw new IllegalArgumentException("Unknown quality: " + value);
    }
}
