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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Dixon's Q test (r10 ratio) for small samples.
 *
 * Both extremes are tested: Q = gap to the nearest neighbour / full range,
 * compared with the 95% critical value for the sample size. Samples outside
 * 3..30 points are not tested.
 */
@Component
public class DixonQTestDetector implements OutlierDetector {

    static final int MIN_SAMPLES = 3;
    static final int MAX_SAMPLES = 30;
    static final double HIGH_RATIO = 1.2;

    // Q95 critical values for r10, indexed by sample size
    private static final double[] CRITICAL_Q95 = {
            Double.NaN, Double.NaN, Double.NaN,
            0.970, 0.829, 0.710, 0.625, 0.568, 0.526, 0.493, 0.466,
            0.444, 0.426, 0.410, 0.396, 0.384, 0.374, 0.365, 0.356, 0.349, 0.342,
            0.337, 0.331, 0.326, 0.321, 0.317, 0.312, 0.308, 0.305, 0.301, 0.298
    };

    @Override
    public OutlierMethod getSupportedMethod() {
        return OutlierMethod.DIXON;
    }

    @Override
    public List<AnomalyRecord> detect(List<TimeSeriesPoint> samples, StatisticalSummary summary,
                                      DeviationAnalysisOptions options) {
        int n = samples.size();
        if (n < MIN_SAMPLES || n > MAX_SAMPLES) {
            return Collections.emptyList();
        }

        double[] sorted = new double[n];
        for (int i = 0; i < n; i++) {
            sorted[i] = samples.get(i).getValue();
        }
        Arrays.sort(sorted);

        double range = sorted[n - 1] - sorted[0];
        if (!(range > 0) || !Double.isFinite(range)) {
            return Collections.emptyList();
        }

        double critical = criticalValue(n);
        List<AnomalyRecord> anomalies = new ArrayList<>(2);

        double qLow = (sorted[1] - sorted[0]) / range;
        if (qLow > critical) {
            anomalies.add(record(samples, sorted[0], qLow, critical, summary, "low"));
        }

        double qHigh = (sorted[n - 1] - sorted[n - 2]) / range;
        if (qHigh > critical) {
            anomalies.add(record(samples, sorted[n - 1], qHigh, critical, summary, "high"));
        }

        anomalies.sort(Comparator.comparing(AnomalyRecord::getTimestamp));
        return anomalies;
    }

    static double criticalValue(int n) {
        return CRITICAL_Q95[n];
    }

    private AnomalyRecord record(List<TimeSeriesPoint> samples, double extreme, double q,
                                 double critical, StatisticalSummary summary, String side) {
        // A positive gap means the extreme value occurs exactly once
        TimeSeriesPoint point = samples.stream()
                .filter(p -> p.getValue() == extreme)
                .findFirst()
                .orElseThrow();

        return AnomalyRecord.builder()
                .timestamp(point.getTimestamp())
                .value(point.getValue())
                .expectedValue(summary.getMean())
                .deviation(q)
                .severity(q / critical > HIGH_RATIO ? Severity.HIGH : Severity.MEDIUM)
                .description(String.format(Locale.ROOT, "Dixon Q-test anomaly (%s): Q=%.3f (critical: %.3f)",
                        side, q, critical))
                .build();
    }
}
