package com.historian.anomaly.service;

import com.historian.anomaly.config.MetricsConfig;
import com.historian.anomaly.engine.AdvancedAnomalyDetector;
import com.historian.anomaly.engine.AnomalyAggregator;
import com.historian.anomaly.engine.PatternChangeDetector;
import com.historian.anomaly.engine.StatisticalDeviationEngine;
import com.historian.anomaly.engine.TrendChangeDetector;
import com.historian.anomaly.exception.AnalysisException;
import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.model.AdvancedDetectionOptions;
import com.historian.anomaly.model.AnomalyDetectionOptions;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.AnomalyReport;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.FlaggingThresholds;
import com.historian.anomaly.model.MethodResult;
import com.historian.anomaly.model.PatternChangeOptions;
import com.historian.anomaly.model.TimeSeriesPoint;
import com.historian.anomaly.model.TrendChangeOptions;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for every anomaly analysis.
 *
 * Each call validates its options, runs the matching detector and records
 * {@code analysis.*} metrics. Rejected calls are counted by reason and the
 * {@link AnalysisException} is rethrown unchanged.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final StatisticalDeviationEngine deviationEngine;
    private final AdvancedAnomalyDetector advancedAnomalyDetector;
    private final PatternChangeDetector patternChangeDetector;
    private final TrendChangeDetector trendChangeDetector;
    private final AnomalyAggregator anomalyAggregator;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(StatisticalDeviationEngine deviationEngine,
                                   AdvancedAnomalyDetector advancedAnomalyDetector,
                                   PatternChangeDetector patternChangeDetector,
                                   TrendChangeDetector trendChangeDetector,
                                   AnomalyAggregator anomalyAggregator,
                                   MetricsConfig metricsConfig) {
        this.deviationEngine = deviationEngine;
        this.advancedAnomalyDetector = advancedAnomalyDetector;
        this.patternChangeDetector = patternChangeDetector;
        this.trendChangeDetector = trendChangeDetector;
        this.anomalyAggregator = anomalyAggregator;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "analysis.detect_anomalies", contextualName = "detect-anomalies")
    public List<AnomalyRecord> detectAnomalies(List<TimeSeriesPoint> data, AnomalyDetectionOptions options) {
        List<AnomalyRecord> anomalies = run("anomalies",
                () -> deviationEngine.detectAnomalies(data, options.getThreshold()));
        metricsConfig.recordAnalysis("anomalies", sizeOf(data), anomalies.size());
        return anomalies;
    }

    @Observed(name = "analysis.detect_advanced", contextualName = "detect-advanced-anomalies")
    public List<AnomalyRecord> detectAdvancedAnomalies(List<TimeSeriesPoint> data,
                                                       AdvancedDetectionOptions options) {
        List<AnomalyRecord> anomalies = run("advanced", () -> advancedAnomalyDetector.detect(data, options));
        metricsConfig.recordAnalysis("advanced", sizeOf(data), anomalies.size());
        return anomalies;
    }

    @Observed(name = "analysis.detect_pattern_changes", contextualName = "detect-pattern-changes")
    public List<AnomalyRecord> detectPatternChanges(List<TimeSeriesPoint> data, PatternChangeOptions options) {
        List<AnomalyRecord> anomalies = run("pattern-changes", () -> patternChangeDetector.detect(data, options));
        metricsConfig.recordAnalysis("pattern-changes", sizeOf(data), anomalies.size());
        return anomalies;
    }

    @Observed(name = "analysis.detect_trend_changes", contextualName = "detect-trend-changes")
    public List<AnomalyRecord> detectTrendChanges(List<TimeSeriesPoint> data, TrendChangeOptions options) {
        List<AnomalyRecord> anomalies = run("trend-changes", () -> trendChangeDetector.detect(data, options));
        metricsConfig.recordAnalysis("trend-changes", sizeOf(data), anomalies.size());
        return anomalies;
    }

    /**
     * Runs each requested outlier test independently and returns one result per method,
     * in request order.
     *
     * @param methods test names; null selects zscore and modified-zscore
     */
    @Observed(name = "analysis.deviation", contextualName = "statistical-deviation-analysis")
    public List<MethodResult> performStatisticalDeviationAnalysis(List<TimeSeriesPoint> data,
                                                                  List<String> methods,
                                                                  DeviationAnalysisOptions options) {
        List<MethodResult> results = run("deviation-analysis",
                () -> deviationEngine.performStatisticalDeviationAnalysis(data, methods, options));
        int flagged = results.stream().mapToInt(r -> r.getAnomalies().size()).sum();
        metricsConfig.recordAnalysis("deviation-analysis", sizeOf(data), flagged);
        return results;
    }

    @Observed(name = "analysis.flag", contextualName = "flag-anomalies")
    public AnomalyReport flagAnomalies(List<TimeSeriesPoint> data, FlaggingThresholds thresholds) {
        AnomalyReport report = run("flag", () -> anomalyAggregator.flagAnomalies(data, thresholds));
        metricsConfig.recordAnalysis("flag", sizeOf(data), report.getSummary().getTotalAnomalies());

        if (report.getSummary().getHighSeverity() > 0) {
            log.warn("High-severity anomalies flagged: {} of {} ({} points)",
                    report.getSummary().getHighSeverity(), report.getSummary().getTotalAnomalies(), sizeOf(data));
        }
        return report;
    }

    private <T> T run(String operation, Supplier<T> analysis) {
        try {
            return analysis.get();
        } catch (AnalysisException e) {
            String reason = e instanceof InsufficientDataException ? "insufficient-data" : "invalid-configuration";
            metricsConfig.recordRejected(operation, reason);
            log.debug("Analysis {} rejected ({}): {}", operation, reason, e.getMessage());
            throw e;
        }
    }

    private static int sizeOf(List<TimeSeriesPoint> data) {
        return data == null ? 0 : data.size();
    }
}
