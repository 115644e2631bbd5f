package com.historian.anomaly.engine;

import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.Severity;
import com.historian.anomaly.model.TimeSeriesPoint;
import com.historian.anomaly.model.TrendChangeOptions;
import com.historian.anomaly.model.TrendLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Detects trend reversals and volatility regime changes between adjacent windows.
 *
 * For each boundary (every half window, starting at {@code windowSize}) a
 * least-squares line is fitted to the window before and the window after.
 * The boundary is flagged when
 * <ul>
 *   <li>|slope(after) - slope(before)| > trendThreshold, or</li>
 *   <li>max(sd) / min(sd) of the two windows > volatilityThreshold.</li>
 * </ul>
 * At least three windows of data are required so every flagged boundary has
 * a confirming window behind or ahead of it.
 *
 * deviation is the stronger of the two signals relative to its threshold,
 * capped at {@value #MAX_SCORE}.
 */
@Component
public class TrendChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(TrendChangeDetector.class);

    public static final int WINDOWS_REQUIRED = 3;
    static final double MAX_SCORE = 100.0;

    /**
     * Saturates at {@link Integer#MAX_VALUE}, so an oversized window fails the
     * sample-count check instead of wrapping around.
     */
    public static int minimumSamples(int windowSize) {
        return (int) Math.min(Integer.MAX_VALUE, (long) windowSize * WINDOWS_REQUIRED);
    }

    public List<AnomalyRecord> detect(List<TimeSeriesPoint> data, TrendChangeOptions options) {
        options.validate();
        List<TimeSeriesPoint> samples = SampleValidator.normalize(data);
        int windowSize = options.getWindowSize();
        InsufficientDataException.requireAtLeast("trend change detection",
                minimumSamples(windowSize), samples.size());

        double[] values = SampleValidator.values(samples);
        double trendThreshold = options.getTrendThreshold();
        double volatilityThreshold = options.getVolatilityThreshold();
        int step = Math.max(1, windowSize / 2);
        List<AnomalyRecord> anomalies = new ArrayList<>();

        for (int boundary = windowSize; (long) boundary + windowSize <= values.length; boundary += step) {
            double[] before = Arrays.copyOfRange(values, boundary - windowSize, boundary);
            double[] after = Arrays.copyOfRange(values, boundary, boundary + windowSize);

            TrendLine beforeTrend = StatisticsCalculator.fitLine(before);
            TrendLine afterTrend = StatisticsCalculator.fitLine(after);
            if (!isFinite(beforeTrend) || !isFinite(afterTrend)) {
                // Values too large to fit a line without overflow
                continue;
            }
            double slopeChange = Math.abs(afterTrend.getSlope() - beforeTrend.getSlope());
            boolean reversal = Math.signum(beforeTrend.getSlope()) * Math.signum(afterTrend.getSlope()) < 0
                    && Math.abs(beforeTrend.getSlope()) > trendThreshold;

            double volatilityRatio = volatilityRatio(
                    StatisticsCalculator.populationStandardDeviation(before),
                    StatisticsCalculator.populationStandardDeviation(after));

            boolean slopeShift = slopeChange > trendThreshold;
            boolean volatilityShift = volatilityRatio > volatilityThreshold;
            if (!slopeShift && !volatilityShift) {
                continue;
            }

            double score = Math.min(MAX_SCORE,
                    Math.max(slopeChange / trendThreshold, volatilityRatio / volatilityThreshold));

            List<String> changes = new ArrayList<>();
            if (slopeShift) changes.add(String.format(Locale.ROOT, "slope change: %.4f", slopeChange));
            if (reversal) changes.add("trend direction reversal");
            if (volatilityShift) changes.add(Double.isFinite(volatilityRatio)
                    ? String.format(Locale.ROOT, "volatility change: %.2fx", volatilityRatio)
                    : "volatility change: flat window");

            TimeSeriesPoint changePoint = samples.get(boundary);
            anomalies.add(AnomalyRecord.builder()
                    .timestamp(changePoint.getTimestamp())
                    .value(changePoint.getValue())
                    .expectedValue(beforeTrend.getIntercept() + beforeTrend.getSlope() * windowSize)
                    .deviation(score)
                    .severity(severity(score, reversal, beforeTrend.getSlope(), trendThreshold))
                    .description("Significant trend change: " + String.join(", ", changes))
                    .build());
        }

        log.debug("Trend change detection completed: points={}, changes={}, windowSize={}",
                samples.size(), anomalies.size(), windowSize);
        return anomalies;
    }

    private boolean isFinite(TrendLine line) {
        return Double.isFinite(line.getSlope()) && Double.isFinite(line.getIntercept());
    }

    private double volatilityRatio(double beforeSd, double afterSd) {
        if (!Double.isFinite(beforeSd) || !Double.isFinite(afterSd)) return 1.0;
        double larger = Math.max(beforeSd, afterSd);
        double smaller = Math.min(beforeSd, afterSd);
        if (smaller > 0) return larger / smaller;
        return larger > 0 ? Double.POSITIVE_INFINITY : 1.0;
    }

    private Severity severity(double score, boolean reversal, double beforeSlope, double trendThreshold) {
        if (score > 3 || (reversal && Math.abs(beforeSlope) > trendThreshold * 2)) return Severity.HIGH;
        if (score > 2 || reversal) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
