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
@Schema(description = "Options for windowed pattern-change detection")
public class PatternChangeOptions {

    @Builder.Default
    @Schema(description = "Samples per window", example = "10")
    private int windowSize = 10;

    @Builder.Default
    @Schema(description = "Minimum shift in means, in pooled standard deviations", example = "1.5")
    private double sensitivityThreshold = 1.5;

    @Builder.Default
    @Schema(description = "Minimum relative change of the mean, in percent", example = "10.0")
    private double minChangePercent = 10.0;

    public void validate() {
        InvalidConfigurationException.requirePositive("windowSize", windowSize);
        InvalidConfigurationException.requirePositive("sensitivityThreshold", sensitivityThreshold);
        InvalidConfigurationException.requireNonNegative("minChangePercent", minChangePercent);
    }
}
