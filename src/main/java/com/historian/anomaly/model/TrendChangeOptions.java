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
@Schema(description = "Options for trend-change detection")
public class TrendChangeOptions {

    @Builder.Default
    @Schema(description = "Samples per regression window (at least 2)", example = "20")
    private int windowSize = 20;

    @Builder.Default
    @Schema(description = "Minimum absolute slope difference between adjacent windows, per sample", example = "0.05")
    private double trendThreshold = 0.05;

    @Builder.Default
    @Schema(description = "Minimum ratio between the larger and smaller window standard deviation", example = "2.0")
    private double volatilityThreshold = 2.0;

    public void validate() {
        InvalidConfigurationException.requirePositive("windowSize", windowSize);
        if (windowSize < 2) {
            throw new InvalidConfigurationException("windowSize",
                    "windowSize must be at least 2 to fit a trend line, got " + windowSize);
        }
        InvalidConfigurationException.requirePositive("trendThreshold", trendThreshold);
        InvalidConfigurationException.requirePositive("volatilityThreshold", volatilityThreshold);
    }
}
