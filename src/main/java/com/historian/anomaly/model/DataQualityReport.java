package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Quality-code breakdown and sampling gaps of a series")
public class DataQualityReport {

    @Schema(example = "100")
    int totalPoints;

    @Schema(example = "95")
    int goodQuality;

    @Schema(example = "3")
    int badQuality;

    @Schema(example = "2")
    int uncertainQuality;

    @Schema(description = "Share of GOOD samples, in percent", example = "95.0")
    double qualityPercentage;

    @Schema(description = "Intervals longer than twice the median sampling interval", example = "1")
    int missingDataGaps;
}
