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
 * Robust variant of the z-score built on the median and the median absolute deviation.
 *
 * Logic: M = 0.6745 * (value - median) / MAD, flagged when |M| > threshold.
 * The 0.6745 constant makes MAD consistent with the standard deviation for normal data.
 *
 * MAD == 0 (more than half the samples share one value) yields no anomalies.
 */
@Component
public class ModifiedZScoreDetector implements OutlierDetector {

    static final double CONSISTENCY_CONSTANT = 0.6745;

    @Override
    public OutlierMethod getSupportedMethod() {
        return OutlierMethod.MODIFIED_ZSCORE;
    }

    @Override
    public List<AnomalyRecord> detect(List<TimeSeriesPoint> samples, StatisticalSummary summary,
                                      DeviationAnalysisOptions options) {
        double mad = summary.getMad();
        if (!(mad > 0)) {
            return Collections.emptyList();
        }

        double threshold = options.getModifiedZscoreThreshold();
        List<AnomalyRecord> anomalies = new ArrayList<>();

        for (TimeSeriesPoint point : samples) {
            double modifiedZ = CONSISTENCY_CONSTANT * (point.getValue() - summary.getMedian()) / mad;
            double deviation = Math.abs(modifiedZ);
            if (!(deviation > threshold)) {
                continue;
            }

            anomalies.add(AnomalyRecord.builder()
                    .timestamp(point.getTimestamp())
                    .value(point.getValue())
                    .expectedValue(summary.getMedian())
                    .deviation(deviation)
                    .severity(Severity.fromRatio(deviation / threshold,
                            ZScoreDetector.MEDIUM_RATIO, ZScoreDetector.HIGH_RATIO))
                    .description(String.format(Locale.ROOT, "Modified Z-score anomaly: %.2f (threshold: %.2f)",
                            modifiedZ, threshold))
                    .build());
        }

        return anomalies;
    }
}
