package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
@Schema(description = "A sample (or window boundary) flagged by one of the detectors")
public class AnomalyRecord {

    @Schema(description = "Timestamp of the flagged sample or window boundary", example = "2024-03-01T10:15:00Z")
    Instant timestamp;

    @Schema(description = "Observed value (window mean for pattern changes)", example = "175.2")
    double value;

    @Schema(description = "Value the detector expected at this point", example = "55.0")
    double expectedValue;

    @Schema(description = "Detector-specific deviation score, always > 0", example = "6.4")
    double deviation;

    @Schema(description = "Severity derived from the deviation", example = "high")
    Severity severity;

    @Schema(description = "Human-readable explanation",
            example = "Value deviates 6.40 standard deviations from mean")
    String description;
}
