package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "A single historian sample for one tag")
public class TimeSeriesPoint {

    @Schema(description = "Sample timestamp (ISO-8601)", example = "2024-03-01T10:15:00Z")
    Instant timestamp;

    @Schema(description = "Sampled tag value", example = "55.3")
    double value;

    @Schema(description = "Historian quality of the sample, by name or raw code (192 good, 64 uncertain, 0 bad)", example = "GOOD")
    QualityCode quality;

    @Schema(description = "Historian tag name", example = "Reactor1.Temperature")
    String tagName;

    public boolean hasFiniteValue() {
        return Double.isFinite(value);
    }
}
