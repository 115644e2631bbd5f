package com.historian.anomaly.engine;

import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.model.AdvancedDetectionOptions;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.OutlierMethod;
import com.historian.anomaly.model.StatisticalSummary;
import com.historian.anomaly.model.TimeSeriesPoint;
import com.historian.anomaly.model.TrendChangeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Multi-algorithm detection: z-score and IQR fences over the full sample, plus
 * optional trend-change and hour-of-day passes, merged into one deduplicated,
 * chronologically sorted list.
 *
 * The trend pass needs three windows and is skipped on shorter series; the
 * seasonal pass needs {@value SeasonalDeviationDetector#MIN_SAMPLES} samples.
 */
@Component
public class AdvancedAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AdvancedAnomalyDetector.class);

    public static final int MIN_SAMPLES = 10;

    private final StatisticalDeviationEngine deviationEngine;
    private final TrendChangeDetector trendChangeDetector;
    private final SeasonalDeviationDetector seasonalDeviationDetector;

    public AdvancedAnomalyDetector(StatisticalDeviationEngine deviationEngine,
                                   TrendChangeDetector trendChangeDetector,
                                   SeasonalDeviationDetector seasonalDeviationDetector) {
        this.deviationEngine = deviationEngine;
        this.trendChangeDetector = trendChangeDetector;
        this.seasonalDeviationDetector = seasonalDeviationDetector;
    }

    public static int minimumSamples(int windowSize) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(MIN_SAMPLES, 2L * windowSize));
    }

    public List<AnomalyRecord> detect(List<TimeSeriesPoint> data, AdvancedDetectionOptions options) {
        options.validate();
        List<TimeSeriesPoint> samples = SampleValidator.normalize(data);
        int windowSize = options.getWindowSize();
        InsufficientDataException.requireAtLeast("advanced anomaly detection",
                minimumSamples(windowSize), samples.size());

        StatisticalSummary summary = StatisticsCalculator.summarize(SampleValidator.values(samples));
        DeviationAnalysisOptions deviationOptions = DeviationAnalysisOptions.builder()
                .zscoreThreshold(options.getStatisticalThreshold())
                .iqrMultiplier(options.getIqrMultiplier())
                .build();

        List<AnomalyRecord> statistical =
                deviationEngine.detect(OutlierMethod.ZSCORE, samples, summary, deviationOptions);
        List<AnomalyRecord> iqr =
                deviationEngine.detect(OutlierMethod.IQR, samples, summary, deviationOptions);

        List<AnomalyRecord> trend = Collections.emptyList();
        if (options.isEnableTrendAnalysis()) {
            if (windowSize >= 2 && samples.size() >= TrendChangeDetector.minimumSamples(windowSize)) {
                trend = trendChangeDetector.detect(samples, TrendChangeOptions.builder()
                        .windowSize(windowSize)
                        .trendThreshold(options.getTrendThreshold())
                        .volatilityThreshold(options.getVolatilityThreshold())
                        .build());
            } else {
                log.debug("Skipping trend pass: {} points, window size {}", samples.size(), windowSize);
            }
        }

        List<AnomalyRecord> seasonal = Collections.emptyList();
        if (options.isEnableSeasonalAnalysis()) {
            seasonal = seasonalDeviationDetector.detect(samples, options.seasonalZoneId());
        }

        List<AnomalyRecord> merged = AnomalyMerger.merge(statistical, iqr, trend, seasonal);

        log.debug("Advanced anomaly detection completed: points={}, statistical={}, iqr={}, trend={}, "
                        + "seasonal={}, unique={}",
                samples.size(), statistical.size(), iqr.size(), trend.size(), seasonal.size(), merged.size());
        return merged;
    }
}
