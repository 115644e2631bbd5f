package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Merged anomalies from all detectors plus a summary")
public class AnomalyReport {

    @Schema(description = "Distinct anomalies, ascending by timestamp")
    List<AnomalyRecord> anomalies;

    @Schema(description = "Severity breakdown and detectors that ran")
    AnomalySummary summary;
}
