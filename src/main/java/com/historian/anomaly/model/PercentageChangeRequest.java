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
@Schema(description = "Two sample periods whose means are compared")
public class PercentageChangeRequest {

    @Schema(description = "Baseline period")
    private List<TimeSeriesPoint> before;

    @Schema(description = "Comparison period")
    private List<TimeSeriesPoint> after;
}
