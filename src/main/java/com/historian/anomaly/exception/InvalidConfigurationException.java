package com.historian.anomaly.exception;

/**
 * Thrown for out-of-range thresholds, window sizes or unknown method names.
 */
public class InvalidConfigurationException extends AnalysisException {

    private final String field;

    public InvalidConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    public static void requirePositive(String field, double value) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new InvalidConfigurationException(field, field + " must be a positive number, got " + value);
        }
    }

    public static void requireNonNegative(String field, double value) {
        if (!(value >= 0) || !Double.isFinite(value)) {
            throw new InvalidConfigurationException(field, field + " must be >= 0, got " + value);
        }
    }
}
