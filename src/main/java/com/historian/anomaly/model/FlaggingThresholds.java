package com.historian.anomaly.model;

import com.historian.anomaly.exception.InvalidConfigurationException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZoneId;

/**
 * Combined thresholds for the top-level flagging run. Trend thresholds are
 * derived from {@link #trendSensitivity}: the slope threshold is
 * {@code 0.05 / trendSensitivity} and the volatility threshold is
 * {@code 2.0 * trendSensitivity}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Thresholds for comprehensive anomaly flagging")
public class FlaggingThresholds {

    static final double BASE_TREND_THRESHOLD = 0.05;
    static final double BASE_VOLATILITY_THRESHOLD = 2.0;

    @Builder.Default
    @Schema(description = "Z-score threshold", example = "2.5")
    private double statisticalDeviation = 2.5;

    @Builder.Default
    @Schema(description = "IQR fence multiplier k", example = "1.5")
    private double iqrMultiplier = 1.5;

    @Builder.Default
    @Schema(description = "Scales the derived trend-change thresholds", example = "1.5")
    private double trendSensitivity = 1.5;

    @Builder.Default
    @Schema(description = "Pattern-change sensitivity threshold", example = "1.5")
    private double patternSensitivity = 1.5;

    @Builder.Default
    @Schema(description = "Minimum relative mean change for a pattern change, in percent", example = "10.0")
    private double minChangePercent = 10.0;

    @Builder.Default
    @Schema(description = "Run the multi-algorithm detector", example = "true")
    private boolean enableAdvanced = true;

    @Builder.Default
    @Schema(description = "Include hour-of-day baselines in the multi-algorithm detector", example = "false")
    private boolean enableSeasonal = false;

    @Builder.Default
    @Schema(description = "Run pattern-change detection when enough data exists", example = "true")
    private boolean enablePatternDetection = true;

    @Builder.Default
    @Schema(description = "Run trend-change detection when enough data exists", example = "true")
    private boolean enableTrendDetection = true;

    @Builder.Default
    @Schema(description = "Samples per window for windowed detectors", example = "15")
    private int windowSize = 15;

    @Builder.Default
    @Schema(description = "Time zone used for hour-of-day baselines", example = "UTC")
    private String seasonalZone = "UTC";

    public void validate() {
        InvalidConfigurationException.requirePositive("statisticalDeviation", statisticalDeviation);
        InvalidConfigurationException.requirePositive("iqrMultiplier", iqrMultiplier);
        InvalidConfigurationException.requirePositive("trendSensitivity", trendSensitivity);
        InvalidConfigurationException.requirePositive("patternSensitivity", patternSensitivity);
        InvalidConfigurationException.requireNonNegative("minChangePercent", minChangePercent);
        InvalidConfigurationException.requirePositive("windowSize", windowSize);
        seasonalZoneId();
    }

    public ZoneId seasonalZoneId() {
        return SeasonalZones.resolve(seasonalZone);
    }

    public PatternChangeOptions toPatternChangeOptions() {
        return PatternChangeOptions.builder()
                .windowSize(windowSize)
                .sensitivityThreshold(patternSensitivity)
                .minChangePercent(minChangePercent)
                .build();
    }

    public TrendChangeOptions toTrendChangeOptions() {
        return TrendChangeOptions.builder()
                .windowSize(Math.max(2, windowSize))
                .trendThreshold(BASE_TREND_THRESHOLD / trendSensitivity)
                .volatilityThreshold(BASE_VOLATILITY_THRESHOLD * trendSensitivity)
                .build();
    }

    public AdvancedDetectionOptions toAdvancedOptions() {
        return AdvancedDetectionOptions.builder()
                .statisticalThreshold(statisticalDeviation)
                .iqrMultiplier(iqrMultiplier)
                .enableTrendAnalysis(true)
                .enableSeasonalAnalysis(enableSeasonal)
                .windowSize(windowSize)
                .seasonalZone(seasonalZone)
                .build();
    }
}
