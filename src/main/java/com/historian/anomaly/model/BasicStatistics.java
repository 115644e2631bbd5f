package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Descriptive statistics of a tag's samples")
public class BasicStatistics {

    @Schema(description = "Smallest finite value", example = "12.0")
    double min;

    @Schema(description = "Largest finite value", example = "98.5")
    double max;

    @Schema(description = "Mean of finite values", example = "55.1")
    double average;

    @Schema(description = "Population standard deviation", example = "14.9")
    double standardDeviation;

    @Schema(description = "Number of finite values", example = "100")
    int count;

    @Schema(description = "Share of samples with GOOD quality, in percent", example = "97.0")
    double dataQuality;
}
