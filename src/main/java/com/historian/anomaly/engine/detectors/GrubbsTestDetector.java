package com.historian.anomaly.engine.detectors;

import com.historian.anomaly.engine.OutlierDetector;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.OutlierMethod;
import com.historian.anomaly.model.Severity;
import com.historian.anomaly.model.StatisticalSummary;
import com.historian.anomaly.model.TimeSeriesPoint;
import org.apache.commons.math3.distribution.TDistribution;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Two-sided Grubbs test for a single outlier in an approximately normal sample.
 *
 * G = max|value - mean| / stdDev is compared with
 *
 *   Gcrit = (n - 1) / sqrt(n) * sqrt(t^2 / (n - 2 + t^2)),  t = t(1 - alpha / 2n, n - 2)
 *
 * The most extreme sample is flagged when G exceeds both Gcrit and the caller's
 * minimum G ({@code grubbsThreshold}). Raising that minimum can only remove the flag.
 */
@Component
public class GrubbsTestDetector implements OutlierDetector {

    static final int MIN_SAMPLES = 3;
    static final double HIGH_RATIO = 1.3;

    @Override
    public OutlierMethod getSupportedMethod() {
        return OutlierMethod.GRUBBS;
    }

    @Override
    public List<AnomalyRecord> detect(List<TimeSeriesPoint> samples, StatisticalSummary summary,
                                      DeviationAnalysisOptions options) {
        int n = samples.size();
        double stdDev = summary.getStandardDeviation();
        if (n < MIN_SAMPLES || !(stdDev > 0)) {
            return Collections.emptyList();
        }

        TimeSeriesPoint candidate = null;
        double maxDistance = -1.0;
        for (TimeSeriesPoint point : samples) {
            double distance = Math.abs(point.getValue() - summary.getMean());
            if (distance > maxDistance) {
                maxDistance = distance;
                candidate = point;
            }
        }

        double g = maxDistance / stdDev;
        double critical = criticalValue(n, options.getGrubbsSignificance());
        double cutoff = Math.max(options.getGrubbsThreshold(), critical);
        if (!(g > cutoff)) {
            return Collections.emptyList();
        }

        return List.of(AnomalyRecord.builder()
                .timestamp(candidate.getTimestamp())
                .value(candidate.getValue())
                .expectedValue(summary.getMean())
                .deviation(g)
                .severity(g / critical > HIGH_RATIO ? Severity.HIGH : Severity.MEDIUM)
                .description(String.format(Locale.ROOT, "Grubbs test anomaly: G=%.3f (critical: %.3f, alpha=%.3f)",
                        g, critical, options.getGrubbsSignificance()))
                .build());
    }

    static double criticalValue(int n, double alpha) {
        TDistribution distribution = new TDistribution(n - 2);
        double t = distribution.inverseCumulativeProbability(1.0 - alpha / (2.0 * n));
        double tSquared = t * t;
        return ((n - 1) / Math.sqrt(n)) * Math.sqrt(tSquared / (n - 2 + tSquared));
    }
}
