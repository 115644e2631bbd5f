package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Central tendency and dispersion of a sample set")
public class StatisticalSummary {

    @Schema(description = "Number of finite values summarised", example = "100")
    int count;

    @Schema(description = "Arithmetic mean", example = "55.1")
    double mean;

    @Schema(description = "Median (average of the two middle values for even counts)", example = "54.8")
    double median;

    @Schema(description = "Population standard deviation", example = "14.9")
    double standardDeviation;

    @Schema(description = "Median absolute deviation from the median, unscaled", example = "10.2")
    double mad;
}
