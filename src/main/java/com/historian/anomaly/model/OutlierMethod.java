package com.historian.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.historian.anomaly.exception.InvalidConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Single-method outlier tests selectable for side-by-side comparison.
 */
public enum OutlierMethod {
    ZSCORE("zscore"),
    MODIFIED_ZSCORE("modified-zscore"),
    GRUBBS("grubbs"),
    DIXON("dixon"),
    IQR("iqr");

    private final String methodName;

    OutlierMethod(String methodName) {
        this.methodName = methodName;
    }

    @JsonValue
    public String getMethodName() {
        return methodName;
    }

    @JsonCreator
    public static OutlierMethod fromName(String name) {
        if (name != null) {
            for (OutlierMethod method : values()) {
                if (method.methodName.equalsIgnoreCase(name.trim())) return method;
            }
        }
        throw new InvalidConfigurationException("methods",
                "Unknown detection method: " + name + ". Valid methods: " + Arrays.stream(values())
                        .map(OutlierMethod::getMethodName)
                        .collect(Collectors.joining(", ")));
    }
}
