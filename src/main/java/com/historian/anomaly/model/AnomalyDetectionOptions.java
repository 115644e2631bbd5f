package com.historian.anomaly.model;

import com.historian.anomaly.exception.InvalidConfigurationException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Options for plain z-score anomaly detection")
public class AnomalyDetectionOptions {

    @Builder.Default
    @Schema(description = "Number of standard deviations a value must exceed", example = "2.0")
    private double threshold = 2.0;

    public void validate() {
        InvalidConfigurationException.requirePositive("threshold", threshold);
    }
}
