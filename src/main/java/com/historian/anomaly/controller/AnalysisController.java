package com.historian.anomaly.controller;

import com.historian.anomaly.config.DetectionDefaultsConfig;
import com.historian.anomaly.model.AdvancedDetectionOptions;
import com.historian.anomaly.model.AnalysisRequest;
import com.historian.anomaly.model.AnomalyDetectionOptions;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.AnomalyReport;
import com.historian.anomaly.model.BasicStatistics;
import com.historian.anomaly.model.DataQualityReport;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.DeviationAnalysisRequest;
import com.historian.anomaly.model.FlaggingThresholds;
import com.historian.anomaly.model.MethodResult;
import com.historian.anomaly.model.PatternChangeOptions;
import com.historian.anomaly.model.PercentageChangeRequest;
import com.historian.anomaly.model.TimeSeriesPoint;
import com.historian.anomaly.model.TrendChangeOptions;
import com.historian.anomaly.model.TrendLine;
import com.historian.anomaly.service.AnomalyDetectionService;
import com.historian.anomaly.service.TimeSeriesStatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Anomaly, pattern-change and trend-change detection over historian samples")
public class AnalysisController {

    private final AnomalyDetectionService anomalyDetectionService;
    private final TimeSeriesStatisticsService statisticsService;
    private final DetectionDefaultsConfig defaultsConfig;

    public AnalysisController(AnomalyDetectionService anomalyDetectionService,
                              TimeSeriesStatisticsService statisticsService,
                              DetectionDefaultsConfig defaultsConfig) {
        this.anomalyDetectionService = anomalyDetectionService;
        this.statisticsService = statisticsService;
        this.defaultsConfig = defaultsConfig;
    }

    // ── Anomaly detection ──

    @Operation(summary = "Z-score anomaly detection",
            description = "Flags samples more than `threshold` standard deviations from the mean. " +
                    "Requires at least 3 finite samples.")
    @PostMapping("/anomalies")
    public ResponseEntity<List<AnomalyRecord>> detectAnomalies(
            @RequestBody AnalysisRequest<AnomalyDetectionOptions> request) {
        AnomalyDetectionOptions options = orDefault(request.getOptions(), defaultsConfig.anomalyDefaults());
        return ResponseEntity.ok(anomalyDetectionService.detectAnomalies(request.getPoints(), options));
    }

    @Operation(summary = "Multi-algorithm anomaly detection",
            description = "Z-score and IQR fences, plus optional trend-change and hour-of-day passes. " +
                    "Results are deduplicated and sorted by timestamp.")
    @PostMapping("/advanced")
    public ResponseEntity<List<AnomalyRecord>> detectAdvancedAnomalies(
            @RequestBody AnalysisRequest<AdvancedDetectionOptions> request) {
        AdvancedDetectionOptions options = orDefault(request.getOptions(), defaultsConfig.advancedDefaults());
        return ResponseEntity.ok(anomalyDetectionService.detectAdvancedAnomalies(request.getPoints(), options));
    }

    @Operation(summary = "Pattern-change detection",
            description = "Compares adjacent windows and flags significant shifts of the mean.")
    @PostMapping("/pattern-changes")
    public ResponseEntity<List<AnomalyRecord>> detectPatternChanges(
            @RequestBody AnalysisRequest<PatternChangeOptions> request) {
        PatternChangeOptions options = orDefault(request.getOptions(), defaultsConfig.patternDefaults());
        return ResponseEntity.ok(anomalyDetectionService.detectPatternChanges(request.getPoints(), options));
    }

    @Operation(summary = "Trend-change detection",
            description = "Compares slope and volatility of adjacent windows.")
    @PostMapping("/trend-changes")
    public ResponseEntity<List<AnomalyRecord>> detectTrendChanges(
            @RequestBody AnalysisRequest<TrendChangeOptions> request) {
        TrendChangeOptions options = orDefault(request.getOptions(), defaultsConfig.trendDefaults());
        return ResponseEntity.ok(anomalyDetectionService.detectTrendChanges(request.getPoints(), options));
    }

    @Operation(summary = "Statistical deviation analysis",
            description = "Runs each requested outlier test (zscore, modified-zscore, grubbs, dixon, iqr) " +
                    "independently and returns one result per method.")
    @PostMapping("/deviation-analysis")
    public ResponseEntity<List<MethodResult>> performDeviationAnalysis(
            @RequestBody DeviationAnalysisRequest request) {
        DeviationAnalysisOptions options = orDefault(request.getOptions(), defaultsConfig.deviationDefaults());
        return ResponseEntity.ok(anomalyDetectionService.performStatisticalDeviationAnalysis(
                request.getPoints(), request.getMethods(), options));
    }

    @Operation(summary = "Comprehensive anomaly flagging",
            description = "Runs every enabled detector that has enough data and returns the merged anomalies " +
                    "with a severity summary.")
    @PostMapping("/flag")
    public ResponseEntity<AnomalyReport> flagAnomalies(@RequestBody AnalysisRequest<FlaggingThresholds> request) {
        FlaggingThresholds thresholds = orDefault(request.getOptions(), defaultsConfig.flaggingDefaults());
        return ResponseEntity.ok(anomalyDetectionService.flagAnomalies(request.getPoints(), thresholds));
    }

    // ── Statistics ──

    @Operation(summary = "Basic statistics of the finite values")
    @PostMapping("/statistics")
    public ResponseEntity<BasicStatistics> calculateStatistics(@RequestBody AnalysisRequest<Void> request) {
        return ResponseEntity.ok(statisticsService.calculateStatistics(request.getPoints()));
    }

    @Operation(summary = "Least-squares trend line over sample index")
    @PostMapping("/trend-line")
    public ResponseEntity<TrendLine> calculateTrendLine(@RequestBody AnalysisRequest<Void> request) {
        return ResponseEntity.ok(statisticsService.calculateTrendLine(request.getPoints()));
    }

    @Operation(summary = "Trailing moving average")
    @PostMapping("/moving-average")
    public ResponseEntity<List<TimeSeriesPoint>> calculateMovingAverage(
            @Parameter(description = "Samples per window", example = "5")
            @RequestParam(defaultValue = "5") int windowSize,
            @RequestBody AnalysisRequest<Void> request) {
        return ResponseEntity.ok(statisticsService.calculateMovingAverage(request.getPoints(), windowSize));
    }

    @Operation(summary = "Percentage change between the means of two periods")
    @PostMapping("/percentage-change")
    public ResponseEntity<Map<String, Double>> calculatePercentageChange(
            @RequestBody PercentageChangeRequest request) {
        double change = statisticsService.calculatePercentageChange(request.getBefore(), request.getAfter());
        return ResponseEntity.ok(Map.of("percentageChange", change));
    }

    @Operation(summary = "Quality-code breakdown and sampling gaps")
    @PostMapping("/data-quality")
    public ResponseEntity<DataQualityReport> calculateDataQuality(@RequestBody AnalysisRequest<Void> request) {
        return ResponseEntity.ok(statisticsService.calculateDataQuality(request.getPoints()));
    }

    private static <O> O orDefault(O requested, O fallback) {
        return requested != null ? requested : fallback;
    }
}
