package com.historian.anomaly.engine.detectors;

import com.historian.anomaly.engine.OutlierDetector;
import com.historian.anomaly.engine.SampleValidator;
import com.historian.anomaly.engine.StatisticsCalculator;
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
 * Tukey fences: flags samples below Q1 - k*IQR or above Q3 + k*IQR.
 *
 * expectedValue is the fence that was crossed; deviation is the distance beyond
 * that fence divided by the IQR. Severity by deviation / k: above 2 is high,
 * above 1.5 medium, otherwise low.
 *
 * Fewer than 4 samples, or IQR == 0, yields no anomalies.
 */
@Component
public class IqrFenceDetector implements OutlierDetector {

    static final int MIN_SAMPLES = 4;

    @Override
    public OutlierMethod getSupportedMethod() {
        return OutlierMethod.IQR;
    }

    @Override
    public List<AnomalyRecord> detect(List<TimeSeriesPoint> samples, StatisticalSummary summary,
                                      DeviationAnalysisOptions options) {
        if (samples.size() < MIN_SAMPLES) {
            return Collections.emptyList();
        }

        double[] values = SampleValidator.values(samples);
        double q1 = StatisticsCalculator.percentile(values, 25);
        double q3 = StatisticsCalculator.percentile(values, 75);
        double iqr = q3 - q1;
        if (!(iqr > 0) || !Double.isFinite(iqr)) {
            return Collections.emptyList();
        }

        double multiplier = options.getIqrMultiplier();
        double lowerFence = q1 - multiplier * iqr;
        double upperFence = q3 + multiplier * iqr;
        List<AnomalyRecord> anomalies = new ArrayList<>();

        for (TimeSeriesPoint point : samples) {
            double value = point.getValue();
            if (!(value < lowerFence || value > upperFence)) {
                continue;
            }

            boolean below = value < lowerFence;
            double fence = below ? lowerFence : upperFence;
            double deviation = Math.abs(value - fence) / iqr;

            anomalies.add(AnomalyRecord.builder()
                    .timestamp(point.getTimestamp())
                    .value(value)
                    .expectedValue(fence)
                    .deviation(deviation)
                    .severity(Severity.fromRatio(deviation / multiplier,
                            ZScoreDetector.MEDIUM_RATIO, ZScoreDetector.HIGH_RATIO))
                    .description(String.format(Locale.ROOT, "IQR outlier: value %s expected range [%.2f, %.2f]",
                            below ? "below" : "above", lowerFence, upperFence))
                    .build());
        }

        return anomalies;
    }
}
