package com.historian.anomaly.model;

import com.historian.anomaly.exception.InvalidConfigurationException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZoneId;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Options for the multi-algorithm detector")
public class AdvancedDetectionOptions {

    @Builder.Default
    @Schema(description = "Z-score threshold", example = "2.0")
    private double statisticalThreshold = 2.0;

    @Builder.Default
    @Schema(description = "IQR fence multiplier k", example = "1.5")
    private double iqrMultiplier = 1.5;

    @Builder.Default
    @Schema(description = "Run trend-change detection over windows of windowSize", example = "true")
    private boolean enableTrendAnalysis = true;

    @Builder.Default
    @Schema(description = "Compare each sample against its hour-of-day baseline", example = "false")
    private boolean enableSeasonalAnalysis = false;

    @Builder.Default
    @Schema(description = "Samples per window", example = "10")
    private int windowSize = 10;

    @Builder.Default
    @Schema(description = "Slope difference flagged by the trend pass", example = "0.1")
    private double trendThreshold = 0.1;

    @Builder.Default
    @Schema(description = "Volatility ratio flagged by the trend pass", example = "2.0")
    private double volatilityThreshold = 2.0;

    @Builder.Default
    @Schema(description = "Time zone used for hour-of-day baselines", example = "UTC")
    private String seasonalZone = "UTC";

    public void validate() {
        InvalidConfigurationException.requirePositive("statisticalThreshold", statisticalThreshold);
        InvalidConfigurationException.requirePositive("iqrMultiplier", iqrMultiplier);
        InvalidConfigurationException.requirePositive("windowSize", windowSize);
        InvalidConfigurationException.requirePositive("trendThreshold", trendThreshold);
        InvalidConfigurationException.requirePositive("volatilityThreshold", volatilityThreshold);
        seasonalZoneId();
    }

    public ZoneId seasonalZoneId() {
        return SeasonalZones.resolve(seasonalZone);
    }
}
