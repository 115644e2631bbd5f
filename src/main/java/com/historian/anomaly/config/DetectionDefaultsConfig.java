package com.historian.anomaly.config;

import com.historian.anomaly.model.AdvancedDetectionOptions;
import com.historian.anomaly.model.AnomalyDetectionOptions;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.FlaggingThresholds;
import com.historian.anomaly.model.PatternChangeOptions;
import com.historian.anomaly.model.TrendChangeOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Detector defaults applied when a REST caller omits the options block.
 * Mutable at runtime via the config endpoint; changes reset on restart.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionDefaultsConfig {

    // Plain z-score detection
    private double zscoreThreshold = 2.0;

    // Side-by-side deviation analysis
    private double deviationZscoreThreshold = 2.5;
    private double modifiedZscoreThreshold = 3.5;
    private double grubbsThreshold = 1.0;
    private double grubbsSignificance = 0.05;
    private double iqrMultiplier = 1.5;

    // Time zone for hour-of-day baselines
    private String seasonalZone = "UTC";

    private Pattern pattern = new Pattern();
    private Trend trend = new Trend();
    private Advanced advanced = new Advanced();
    private Flagging flagging = new Flagging();

    @Data
    public static class Pattern {
        private int windowSize = 10;
        private double sensitivityThreshold = 1.5;
        private double minChangePercent = 10.0;
    }

    @Data
    public static class Trend {
        private int windowSize = 20;
        private double trendThreshold = 0.05;
        private double volatilityThreshold = 2.0;
    }

    @Data
    public static class Advanced {
        private double statisticalThreshold = 2.0;
        private int windowSize = 10;
        private boolean enableTrendAnalysis = true;
        private boolean enableSeasonalAnalysis = false;
        private double trendThreshold = 0.1;
        private double volatilityThreshold = 2.0;
    }

    @Data
    public static class Flagging {
        private double statisticalDeviation = 2.5;
        private double trendSensitivity = 1.5;
        private double patternSensitivity = 1.5;
        private double minChangePercent = 10.0;
        private int windowSize = 15;
        private boolean enableAdvanced = true;
        private boolean enableSeasonal = false;
        private boolean enablePatternDetection = true;
        private boolean enableTrendDetection = true;
    }

    public AnomalyDetectionOptions anomalyDefaults() {
        return AnomalyDetectionOptions.builder()
                .threshold(zscoreThreshold)
                .build();
    }

    public DeviationAnalysisOptions deviationDefaults() {
        return DeviationAnalysisOptions.builder()
                .zscoreThreshold(deviationZscoreThreshold)
                .modifiedZscoreThreshold(modifiedZscoreThreshold)
                .grubbsThreshold(grubbsThreshold)
                .grubbsSignificance(grubbsSignificance)
                .iqrMultiplier(iqrMultiplier)
                .build();
    }

    public PatternChangeOptions patternDefaults() {
        return PatternChangeOptions.builder()
                .windowSize(pattern.getWindowSize())
                .sensitivityThreshold(pattern.getSensitivityThreshold())
                .minChangePercent(pattern.getMinChangePercent())
                .build();
    }

    public TrendChangeOptions trendDefaults() {
        return TrendChangeOptions.builder()
                .windowSize(trend.getWindowSize())
                .trendThreshold(trend.getTrendThreshold())
                .volatilityThreshold(trend.getVolatilityThreshold())
                .build();
    }

    public AdvancedDetectionOptions advancedDefaults() {
        return AdvancedDetectionOptions.builder()
                .statisticalThreshold(advanced.getStatisticalThreshold())
                .iqrMultiplier(iqrMultiplier)
                .enableTrendAnalysis(advanced.isEnableTrendAnalysis())
                .enableSeasonalAnalysis(advanced.isEnableSeasonalAnalysis())
                .windowSize(advanced.getWindowSize())
                .trendThreshold(advanced.getTrendThreshold())
                .volatilityThreshold(advanced.getVolatilityThreshold())
                .seasonalZone(seasonalZone)
                .build();
    }

    public FlaggingThresholds flaggingDefaults() {
        return FlaggingThresholds.builder()
                .statisticalDeviation(flagging.getStatisticalDeviation())
                .iqrMultiplier(iqrMultiplier)
                .trendSensitivity(flagging.getTrendSensitivity())
                .patternSensitivity(flagging.getPatternSensitivity())
                .minChangePercent(flagging.getMinChangePercent())
                .windowSize(flagging.getWindowSize())
                .enableAdvanced(flagging.isEnableAdvanced())
                .enableSeasonal(flagging.isEnableSeasonal())
                .enablePatternDetection(flagging.isEnablePatternDetection())
                .enableTrendDetection(flagging.isEnableTrendDetection())
                .seasonalZone(seasonalZone)
                .build();
    }
}
