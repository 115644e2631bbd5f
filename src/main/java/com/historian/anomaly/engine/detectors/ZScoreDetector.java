package com.historian.anomaly.engine.detectors;

import com.historian.anomaly.engine.OutlierDetector;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.OutlierMethod;
import com.historian.anomaly.model.Severity;
import com.historian.anomaly.model.StatisticalSummary;
import com.historian.anomaly.model.TimeSeriesPoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Flags samples lying more than {@code threshold} standard deviations from the mean.
 *
 * Logic: z = |value - mean| / stdDev, flagged when z > threshold.
 * Severity by z / threshold: above 2 is high, above 1.5 medium, otherwise low.
 *
 * A constant series (stdDev == 0) has no outliers.
 */
@Component
public class ZScoreDetector implements OutlierDetector {

    static final double MEDIUM_RATIO = 1.5;
    static final double HIGH_RATIO = 2.0;

    @Override
    public OutlierMethod getSupportedMethod() {
        return OutlierMethod.ZSCORE;
    }

    @Override
    public List<AnomalyRecord> detect(List<TimeSeriesPoint> samples, StatisticalSummary summary,
                                      DeviationAnalysisOptions options) {
        double stdDev = summary.getStandardDeviation();
        if (!(stdDev > 0)) {
            return Collections.emptyList();
        }

        double threshold = options.getZscoreThreshold();
        List<AnomalyRecord> anomalies = new ArrayList<>();

        for (TimeSeriesPoint point : samples) {
            double zScore = Math.abs(point.getValue() - summary.getMean()) / stdDev;
            if (!(zScore > threshold)) {
                continue;
            }

            anomalies.add(AnomalyRecord.builder()
                    .timestamp(point.getTimestamp())
                    .value(point.getValue())
                    .expectedValue(summary.getMean())
                    .deviation(zScore)
                    .severity(Severity.fromRatio(zScore / threshold, MEDIUM_RATIO, HIGH_RATIO))
                    .description(String.format(Locale.ROOT,
                            "Value deviates %.2f standard deviations from mean (threshold: %.2f)",
                            zScore, threshold))
                    .build());
        }

        return anomalies;
    }
}
