package com.historian.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Severity breakdown of a flagging run")
public class AnomalySummary {

    @Schema(description = "Number of distinct anomalies", example = "4")
    int totalAnomalies;

    @Schema(description = "Anomalies with high severity", example = "1")
    int highSeverity;

    @Schema(description = "Anomalies with medium severity", example = "1")
    int mediumSeverity;

    @Schema(description = "Anomalies with low severity", example = "2")
    int lowSeverity;

    @Schema(description = "Anomalies per analysed point, as a percentage in [0, 100]", example = "4.0")
    double anomalyRate;

    @Schema(description = "Detector families that ran", example = "[\"statistical-deviation\", \"advanced-multi-algorithm\"]")
    List<DetectionMethod> detectionMethods;
}
