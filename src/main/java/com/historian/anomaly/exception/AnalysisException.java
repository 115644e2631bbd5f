package com.historian.anomaly.exception;

/**
 * Base type for errors raised while validating the input of an analysis call.
 * Raised before any statistic is computed, so no partial result exists.
 */
public abstract class AnalysisException extends RuntimeException {

    protected AnalysisException(String message) {
        super(message);
    }
}
