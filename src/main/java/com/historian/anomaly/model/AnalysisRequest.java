package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request envelope: the samples to analyse plus optional detector options.
 * Omitted options fall back to the configured detection defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Samples to analyse with optional detector options")
public class AnalysisRequest<O> {

    @Schema(description = "Historian samples, in any order")
    private List<TimeSeriesPoint> points;

    @Schema(description = "Detector options; configured defaults apply when omitted")
    private O options;
}
