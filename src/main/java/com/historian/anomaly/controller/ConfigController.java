package com.historian.anomaly.controller;

import com.historian.anomaly.config.DetectionDefaultsConfig;
import com.historian.anomaly.exception.InvalidConfigurationException;
import com.historian.anomaly.model.AdvancedDetectionOptions;
import com.historian.anomaly.model.AnomalyDetectionOptions;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.FlaggingThresholds;
import com.historian.anomaly.model.PatternChangeOptions;
import com.historian.anomaly.model.TrendChangeOptions;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify the detector defaults applied when a request omits options")
public class ConfigController {

    private final DetectionDefaultsConfig defaultsConfig;

    public ConfigController(DetectionDefaultsConfig defaultsConfig) {
        this.defaultsConfig = defaultsConfig;
    }

    @Operation(summary = "Get detector defaults")
    @GetMapping("/detection")
    public ResponseEntity<Map<String, Object>> getDetectionDefaults() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("zscoreThreshold", defaultsConfig.getZscoreThreshold());
        body.put("deviationZscoreThreshold", defaultsConfig.getDeviationZscoreThreshold());
        body.put("modifiedZscoreThreshold", defaultsConfig.getModifiedZscoreThreshold());
        body.put("grubbsThreshold", defaultsConfig.getGrubbsThreshold());
        body.put("grubbsSignificance", defaultsConfig.getGrubbsSignificance());
        body.put("iqrMultiplier", defaultsConfig.getIqrMultiplier());
        body.put("seasonalZone", defaultsConfig.getSeasonalZone());
        body.put("pattern", defaultsConfig.patternDefaults());
        body.put("trend", defaultsConfig.trendDefaults());
        body.put("advanced", defaultsConfig.advancedDefaults());
        body.put("flagging", defaultsConfig.flaggingDefaults());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update detector defaults",
            description = "Omitted keys keep their current value. Nested sections (pattern, trend, advanced, " +
                    "flagging) are merged key by key. Nothing is applied unless every value is valid. " +
                    "Changes apply immediately but reset on restart.")
    @PutMapping("/detection")
    public ResponseEntity<Map<String, Object>> updateDetectionDefaults(@RequestBody Map<String, Object> body) {
        DetectionDefaultsConfig.Pattern pattern = defaultsConfig.getPattern();
        DetectionDefaultsConfig.Trend trend = defaultsConfig.getTrend();
        DetectionDefaultsConfig.Advanced advanced = defaultsConfig.getAdvanced();
        DetectionDefaultsConfig.Flagging flagging = defaultsConfig.getFlagging();
        Map<String, Object> patternBody = section(body, "pattern");
        Map<String, Object> trendBody = section(body, "trend");
        Map<String, Object> advancedBody = section(body, "advanced");
        Map<String, Object> flaggingBody = section(body, "flagging");

        String seasonalZone = body.containsKey("seasonalZone")
                ? String.valueOf(body.get("seasonalZone"))
                : defaultsConfig.getSeasonalZone();

        AnomalyDetectionOptions anomalyOptions = AnomalyDetectionOptions.builder()
                .threshold(toDouble(body, "zscoreThreshold", defaultsConfig.getZscoreThreshold()))
                .build();
        DeviationAnalysisOptions deviationOptions = DeviationAnalysisOptions.builder()
                .zscoreThreshold(toDouble(body, "deviationZscoreThreshold",
                        defaultsConfig.getDeviationZscoreThreshold()))
                .modifiedZscoreThreshold(toDouble(body, "modifiedZscoreThreshold",
                        defaultsConfig.getModifiedZscoreThreshold()))
                .grubbsThreshold(toDouble(body, "grubbsThreshold", defaultsConfig.getGrubbsThreshold()))
                .grubbsSignificance(toDouble(body, "grubbsSignificance", defaultsConfig.getGrubbsSignificance()))
                .iqrMultiplier(toDouble(body, "iqrMultiplier", defaultsConfig.getIqrMultiplier()))
                .build();
        PatternChangeOptions patternOptions = PatternChangeOptions.builder()
                .windowSize(toInt(patternBody, "windowSize", pattern.getWindowSize()))
                .sensitivityThreshold(toDouble(patternBody, "sensitivityThreshold",
                        pattern.getSensitivityThreshold()))
                .minChangePercent(toDouble(patternBody, "minChangePercent", pattern.getMinChangePercent()))
                .build();
        TrendChangeOptions trendOptions = TrendChangeOptions.builder()
                .windowSize(toInt(trendBody, "windowSize", trend.getWindowSize()))
                .trendThreshold(toDouble(trendBody, "trendThreshold", trend.getTrendThreshold()))
                .volatilityThreshold(toDouble(trendBody, "volatilityThreshold", trend.getVolatilityThreshold()))
                .build();
        AdvancedDetectionOptions advancedOptions = AdvancedDetectionOptions.builder()
                .statisticalThreshold(toDouble(advancedBody, "statisticalThreshold",
                        advanced.getStatisticalThreshold()))
                .iqrMultiplier(deviationOptions.getIqrMultiplier())
                .windowSize(toInt(advancedBody, "windowSize", advanced.getWindowSize()))
                .enableTrendAnalysis(toBoolean(advancedBody, "enableTrendAnalysis",
                        advanced.isEnableTrendAnalysis()))
                .enableSeasonalAnalysis(toBoolean(advancedBody, "enableSeasonalAnalysis",
                        advanced.isEnableSeasonalAnalysis()))
                .trendThreshold(toDouble(advancedBody, "trendThreshold", advanced.getTrendThreshold()))
                .volatilityThreshold(toDouble(advancedBody, "volatilityThreshold",
                        advanced.getVolatilityThreshold()))
                .seasonalZone(seasonalZone)
                .build();
        FlaggingThresholds flaggingThresholds = FlaggingThresholds.builder()
                .statisticalDeviation(toDouble(flaggingBody, "statisticalDeviation",
                        flagging.getStatisticalDeviation()))
                .iqrMultiplier(deviationOptions.getIqrMultiplier())
                .trendSensitivity(toDouble(flaggingBody, "trendSensitivity", flagging.getTrendSensitivity()))
                .patternSensitivity(toDouble(flaggingBody, "patternSensitivity", flagging.getPatternSensitivity()))
                .minChangePercent(toDouble(flaggingBody, "minChangePercent", flagging.getMinChangePercent()))
                .windowSize(toInt(flaggingBody, "windowSize", flagging.getWindowSize()))
                .enableAdvanced(toBoolean(flaggingBody, "enableAdvanced", flagging.isEnableAdvanced()))
                .enableSeasonal(toBoolean(flaggingBody, "enableSeasonal", flagging.isEnableSeasonal()))
                .enablePatternDetection(toBoolean(flaggingBody, "enablePatternDetection",
                        flagging.isEnablePatternDetection()))
                .enableTrendDetection(toBoolean(flaggingBody, "enableTrendDetection",
                        flagging.isEnableTrendDetection()))
                .seasonalZone(seasonalZone)
                .build();

        // Rejected values surface as 400 through AnalysisExceptionHandler
        anomalyOptions.validate();
        deviationOptions.validate();
        patternOptions.validate();
        trendOptions.validate();
        advancedOptions.validate();
        flaggingThresholds.validate();

        defaultsConfig.setZscoreThreshold(anomalyOptions.getThreshold());
        defaultsConfig.setDeviationZscoreThreshold(deviationOptions.getZscoreThreshold());
        defaultsConfig.setModifiedZscoreThreshold(deviationOptions.getModifiedZscoreThreshold());
        defaultsConfig.setGrubbsThreshold(deviationOptions.getGrubbsThreshold());
        defaultsConfig.setGrubbsSignificance(deviationOptions.getGrubbsSignificance());
        defaultsConfig.setIqrMultiplier(deviationOptions.getIqrMultiplier());
        defaultsConfig.setSeasonalZone(seasonalZone);

        pattern.setWindowSize(patternOptions.getWindowSize());
        pattern.setSensitivityThreshold(patternOptions.getSensitivityThreshold());
        pattern.setMinChangePercent(patternOptions.getMinChangePercent());

        trend.setWindowSize(trendOptions.getWindowSize());
        trend.setTrendThreshold(trendOptions.getTrendThreshold());
        trend.setVolatilityThreshold(trendOptions.getVolatilityThreshold());

        advanced.setStatisticalThreshold(advancedOptions.getStatisticalThreshold());
        advanced.setWindowSize(advancedOptions.getWindowSize());
        advanced.setEnableTrendAnalysis(advancedOptions.isEnableTrendAnalysis());
        advanced.setEnableSeasonalAnalysis(advancedOptions.isEnableSeasonalAnalysis());
        advanced.setTrendThreshold(advancedOptions.getTrendThreshold());
        advanced.setVolatilityThreshold(advancedOptions.getVolatilityThreshold());

        flagging.setStatisticalDeviation(flaggingThresholds.getStatisticalDeviation());
        flagging.setTrendSensitivity(flaggingThresholds.getTrendSensitivity());
        flagging.setPatternSensitivity(flaggingThresholds.getPatternSensitivity());
        flagging.setMinChangePercent(flaggingThresholds.getMinChangePercent());
        flagging.setWindowSize(flaggingThresholds.getWindowSize());
        flagging.setEnableAdvanced(flaggingThresholds.isEnableAdvanced());
        flagging.setEnableSeasonal(flaggingThresholds.isEnableSeasonal());
        flagging.setEnablePatternDetection(flaggingThresholds.isEnablePatternDetection());
        flagging.setEnableTrendDetection(flaggingThresholds.isEnableTrendDetection());

        return getDetectionDefaults();
    }

    // ── Helpers ──

    @SuppressWarnings("unchecked")
    private Map<String, Object> section(Map<String, Object> body, String key) {
        Object v = body.get(key);
        if (v == null) return Map.of();
        if (v instanceof Map<?, ?>) return (Map<String, Object>) v;
        throw new InvalidConfigurationException(key, key + " must be an object");
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(v.toString());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key, key + " must be a number, got " + v);
        }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(v.toString());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key, key + " must be an integer, got " + v);
        }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        String s = v.toString();
        if ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s)) return Boolean.parseBoolean(s);
        throw new InvalidConfigurationException(key, key + " must be true or false, got " + v);
    }
}
