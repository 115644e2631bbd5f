package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Least-squares line over sample index")
public class TrendLine {

    @Schema(description = "Change in value per sample", example = "0.125")
    double slope;

    @Schema(description = "Fitted value at the first sample", example = "48.2")
    double intercept;

    @Schema(description = "Pearson correlation between index and value, 0 when undefined", example = "0.91")
    double correlation;

    @Schema(description = "Coefficient of determination", example = "0.83")
    double coefficientOfDetermination;

    @Schema(description = "Formatted line equation", example = "y = 0.1250x + 48.2000")
    String equation;
}
