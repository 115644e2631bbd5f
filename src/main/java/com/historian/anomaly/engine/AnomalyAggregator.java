package com.historian.anomaly.engine;

import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.AnomalyReport;
import com.historian.anomaly.model.AnomalySummary;
import com.historian.anomaly.model.DetectionMethod;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.FlaggingThresholds;
import com.historian.anomaly.model.OutlierMethod;
import com.historian.anomaly.model.StatisticalSummary;
import com.historian.anomaly.model.TimeSeriesPoint;
import com.historian.anomaly.model.TrendChangeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Top-level flagging run.
 *
 * Flow:
 * 1. Validate thresholds and samples (at least 3 finite samples)
 * 2. Z-score and IQR fences over the full sample (always)
 * 3. Multi-algorithm detector, when enabled and the series is long enough
 * 4. Pattern-change detector, when enabled and the series holds max(20, 2 windows)
 * 5. Trend-change detector, when enabled and the series holds 3 windows
 * 6. Merge, deduplicate, sort and summarise
 *
 * Detectors skipped for lack of data are left out of {@code detectionMethods}.
 */
@Component
public class AnomalyAggregator {

    private static final Logger log = LoggerFactory.getLogger(AnomalyAggregator.class);

    public static final int MIN_SAMPLES = 3;

    private final StatisticalDeviationEngine deviationEngine;
    private final AdvancedAnomalyDetector advancedAnomalyDetector;
    private final PatternChangeDetector patternChangeDetector;
    private final TrendChangeDetector trendChangeDetector;

    public AnomalyAggregator(StatisticalDeviationEngine deviationEngine,
                             AdvancedAnomalyDetector advancedAnomalyDetector,
                             PatternChangeDetector patternChangeDetector,
                             TrendChangeDetector trendChangeDetector) {
        this.deviationEngine = deviationEngine;
        this.advancedAnomalyDetector = advancedAnomalyDetector;
        this.patternChangeDetector = patternChangeDetector;
        this.trendChangeDetector = trendChangeDetector;
    }

    public AnomalyReport flagAnomalies(List<TimeSeriesPoint> data, FlaggingThresholds thresholds) {
        thresholds.validate();
        List<TimeSeriesPoint> samples = SampleValidator.normalize(data);
        InsufficientDataException.requireAtLeast("anomaly flagging", MIN_SAMPLES, samples.size());

        int n = samples.size();
        int windowSize = thresholds.getWindowSize();
        List<DetectionMethod> detectionMethods = new ArrayList<>();

        // 1. Point outliers
        StatisticalSummary summary = StatisticsCalculator.summarize(SampleValidator.values(samples));
        DeviationAnalysisOptions deviationOptions = DeviationAnalysisOptions.builder()
                .zscoreThreshold(thresholds.getStatisticalDeviation())
                .iqrMultiplier(thresholds.getIqrMultiplier())
                .build();
        List<AnomalyRecord> statistical = AnomalyMerger.merge(
                deviationEngine.detect(OutlierMethod.ZSCORE, samples, summary, deviationOptions),
                deviationEngine.detect(OutlierMethod.IQR, samples, summary, deviationOptions));
        detectionMethods.add(DetectionMethod.STATISTICAL_DEVIATION);

        // 2. Multi-algorithm
        List<AnomalyRecord> advanced = Collections.emptyList();
        if (thresholds.isEnableAdvanced()) {
            if (n >= AdvancedAnomalyDetector.minimumSamples(windowSize)) {
                advanced = advancedAnomalyDetector.detect(samples, thresholds.toAdvancedOptions());
                detectionMethods.add(DetectionMethod.ADVANCED_MULTI_ALGORITHM);
            } else {
                log.debug("Skipping advanced detection: {} points, {} required",
                        n, AdvancedAnomalyDetector.minimumSamples(windowSize));
            }
        }

        // 3. Pattern changes
        List<AnomalyRecord> patterns = Collections.emptyList();
        if (thresholds.isEnablePatternDetection()) {
            if (n >= PatternChangeDetector.minimumSamples(windowSize)) {
                patterns = patternChangeDetector.detect(samples, thresholds.toPatternChangeOptions());
                detectionMethods.add(DetectionMethod.PATTERN_CHANGE);
            } else {
                log.debug("Skipping pattern change detection: {} points, {} required",
                        n, PatternChangeDetector.minimumSamples(windowSize));
            }
        }

        // 4. Trend changes
        List<AnomalyRecord> trends = Collections.emptyList();
        if (thresholds.isEnableTrendDetection()) {
            TrendChangeOptions trendOptions = thresholds.toTrendChangeOptions();
            int required = TrendChangeDetector.minimumSamples(trendOptions.getWindowSize());
            if (n >= required) {
                trends = trendChangeDetector.detect(samples, trendOptions);
                detectionMethods.add(DetectionMethod.TREND_CHANGE);
            } else {
                log.debug("Skipping trend change detection: {} points, {} required", n, required);
            }
        }

        List<AnomalyRecord> anomalies = AnomalyMerger.merge(statistical, advanced, patterns, trends);
        AnomalySummary anomalySummary = summarize(anomalies, n, detectionMethods);

        log.info("Anomaly flagging completed: points={}, total={}, high={}, medium={}, low={}, rate={}%, methods={}",
                n, anomalySummary.getTotalAnomalies(), anomalySummary.getHighSeverity(),
                anomalySummary.getMediumSeverity(), anomalySummary.getLowSeverity(),
                String.format(Locale.ROOT, "%.2f", anomalySummary.getAnomalyRate()), detectionMethods);

        return AnomalyReport.builder()
                .anomalies(anomalies)
                .summary(anomalySummary)
                .build();
    }

    static AnomalySummary summarize(List<AnomalyRecord> anomalies, int analysedPoints,
                                    List<DetectionMethod> detectionMethods) {
        int high = 0;
        int medium = 0;
        int low = 0;
        for (AnomalyRecord anomaly : anomalies) {
            switch (anomaly.getSeverity()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }

        // Window-level records can outnumber samples on short, busy series
        double rate = analysedPoints > 0
                ? Math.min(100.0, anomalies.size() * 100.0 / analysedPoints)
                : 0.0;

        return AnomalySummary.builder()
                .totalAnomalies(anomalies.size())
                .highSeverity(high)
                .mediumSeverity(medium)
                .lowSeverity(low)
                .anomalyRate(rate)
                .detectionMethods(List.copyOf(detectionMethods))
                .build();
    }
}
