package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Anomalies found by one outlier test, with the statistics it used")
public class MethodResult {

    @Schema(description = "Outlier test that produced this result", example = "zscore")
    OutlierMethod method;

    @Schema(description = "Anomalies found by this method, ascending by timestamp")
    List<AnomalyRecord> anomalies;

    @Schema(description = "Statistics of the analysed sample")
    StatisticalSummary statistics;
}
