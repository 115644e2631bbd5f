package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Samples plus the outlier tests to run side by side")
public class DeviationAnalysisRequest {

    @Schema(description = "Historian samples, in any order")
    private List<TimeSeriesPoint> points;

    @Schema(description = "Outlier tests to run; zscore and modified-zscore when omitted",
            example = "[\"zscore\", \"grubbs\"]")
    private List<String> methods;

    @Schema(description = "Per-method thresholds; configured defaults apply when omitted")
    private DeviationAnalysisOptions options;
}
