package com.historian.anomaly.exception;

import java.util.Locale;

/**
 * Thrown when fewer usable (finite) samples are available than an analysis requires.
 */
public class InsufficientDataException extends AnalysisException {

    private final int minimumRequired;
    private final int actual;

    public InsufficientDataException(String analysis, int minimumRequired, int actual) {
        super(String.format(Locale.ROOT, "At least %d data points required for %s, got %d",
                minimumRequired, analysis, actual));
        this.minimumRequired = minimumRequired;
        this.actual = actual;
    }

    public int getMinimumRequired() {
        return minimumRequired;
    }

    public int getActual() {
        return actual;
    }

    public static void requireAtLeast(String analysis, int minimumRequired, int actual) {
        if (actual < minimumRequired) {
            throw new InsufficientDataException(analysis, minimumRequired, actual);
        }
    }
}
