package com.historian.anomaly.engine;

import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.PatternChangeOptions;
import com.historian.anomaly.model.Severity;
import com.historian.anomaly.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Detects shifts in the level of a series by comparing two adjacent,
 * non-overlapping windows of {@code windowSize} samples.
 *
 * Candidate boundaries start at {@code windowSize} and advance by half a window.
 * Because neighbouring candidates share samples, one level shift raises the
 * score of every boundary within a window of it; only the candidate with the
 * largest shift in that neighbourhood is kept. A kept boundary is flagged when
 * both hold:
 * <ul>
 *   <li>|mean(after) - mean(before)| / |mean(before)| * 100 > minChangePercent</li>
 *   <li>|mean(after) - mean(before)| / pooledStdDev > sensitivityThreshold,
 *       pooledStdDev = sqrt((sd(before)^2 + sd(after)^2) / 2)</li>
 * </ul>
 * Neither the candidates nor the kept set depend on the thresholds, so a lower
 * sensitivity always flags a superset of the boundaries a higher one flags.
 *
 * The flagged record carries the boundary timestamp, the after-window mean as
 * value and the before-window mean as expectedValue.
 */
@Component
public class PatternChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternChangeDetector.class);

    public static final int MIN_SAMPLES = 20;

    /**
     * Saturates at {@link Integer#MAX_VALUE}, so an oversized window fails the
     * sample-count check instead of wrapping around.
     */
    public static int minimumSamples(int windowSize) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(MIN_SAMPLES, 2L * windowSize));
    }

    public List<AnomalyRecord> detect(List<TimeSeriesPoint> data, PatternChangeOptions options) {
        options.validate();
        List<TimeSeriesPoint> samples = SampleValidator.normalize(data);
        int windowSize = options.getWindowSize();
        InsufficientDataException.requireAtLeast("pattern change detection",
                minimumSamples(windowSize), samples.size());

        List<Candidate> candidates = candidates(SampleValidator.values(samples), windowSize);
        List<AnomalyRecord> anomalies = new ArrayList<>();

        for (int i = 0; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            if (!isStrongestNearby(candidates, i, windowSize)) {
                continue;
            }
            if (!(candidate.meanChangePercent > options.getMinChangePercent())) {
                continue;
            }
            if (!(candidate.shift > options.getSensitivityThreshold())) {
                continue;
            }

            double shift = candidate.shift;
            double deviation = Double.isFinite(shift) ? shift : candidate.meanChangePercent / 100.0;
            anomalies.add(AnomalyRecord.builder()
                    .timestamp(samples.get(candidate.boundary).getTimestamp())
                    .value(candidate.afterMean)
                    .expectedValue(candidate.beforeMean)
                    .deviation(deviation)
                    .severity(severity(candidate.meanChangePercent, shift / options.getSensitivityThreshold()))
                    .description(String.format(Locale.ROOT,
                            "Pattern change detected: mean shifted by %.1f%% (%s pooled standard deviations)",
                            candidate.meanChangePercent,
                            Double.isFinite(shift) ? String.format(Locale.ROOT, "%.2f", shift) : "unbounded"))
                    .build());
        }

        log.debug("Pattern change detection completed: points={}, candidates={}, changes={}, windowSize={}, sensitivity={}",
                samples.size(), candidates.size(), anomalies.size(), windowSize, options.getSensitivityThreshold());
        return anomalies;
    }

    private List<Candidate> candidates(double[] values, int windowSize) {
        int step = Math.max(1, windowSize / 2);
        List<Candidate> candidates = new ArrayList<>();

        for (int boundary = windowSize; (long) boundary + windowSize <= values.length; boundary += step) {
            double[] before = Arrays.copyOfRange(values, boundary - windowSize, boundary);
            double[] after = Arrays.copyOfRange(values, boundary, boundary + windowSize);

            double beforeMean = StatisticsCalculator.mean(before);
            double afterMean = StatisticsCalculator.mean(after);
            double meanChange = Math.abs(afterMean - beforeMean);

            // A zero baseline has no meaningful relative change
            double meanChangePercent = beforeMean != 0 ? meanChange / Math.abs(beforeMean) * 100.0 : 0.0;

            double beforeSd = StatisticsCalculator.populationStandardDeviation(before);
            double afterSd = StatisticsCalculator.populationStandardDeviation(after);
            double pooledSd = Math.sqrt((beforeSd * beforeSd + afterSd * afterSd) / 2.0);

            double shift;
            if (!(meanChange > 0) || !Double.isFinite(meanChange) || !Double.isFinite(pooledSd)) {
                // No change, or windows too large to compare without overflow
                shift = 0.0;
                meanChangePercent = 0.0;
            } else if (pooledSd > 0) {
                shift = meanChange / pooledSd;
            } else {
                // Two flat windows at different levels: the shift is unbounded
                shift = Double.POSITIVE_INFINITY;
            }

            candidates.add(new Candidate(boundary, beforeMean, afterMean, meanChange, meanChangePercent, shift));
        }
        return candidates;
    }

    /**
     * True when no candidate closer than {@code windowSize} has a larger shift.
     * Ties go to the larger mean change, then to the earlier boundary.
     */
    private boolean isStrongestNearby(List<Candidate> candidates, int index, int windowSize) {
        Candidate candidate = candidates.get(index);
        for (int j = index - 1; j >= 0 && candidate.boundary - candidates.get(j).boundary < windowSize; j--) {
            if (!candidate.outranks(candidates.get(j))) return false;
        }
        for (int j = index + 1; j < candidates.size()
                && candidates.get(j).boundary - candidate.boundary < windowSize; j++) {
            if (candidates.get(j).outranks(candidate)) return false;
        }
        return true;
    }

    private Severity severity(double meanChangePercent, double shiftRatio) {
        if (meanChangePercent > 50 || shiftRatio > 3) return Severity.HIGH;
        if (meanChangePercent > 25 || shiftRatio > 2) return Severity.MEDIUM;
        return Severity.LOW;
    }

    private static final class Candidate {
        final int boundary;
        final double beforeMean;
        final double afterMean;
        final double meanChange;
        final double meanChangePercent;
        final double shift;

        Candidate(int boundary, double beforeMean, double afterMean,
                  double meanChange, double meanChangePercent, double shift) {
            this.boundary = boundary;
            this.beforeMean = beforeMean;
            this.afterMean = afterMean;
            this.meanChange = meanChange;
            this.meanChangePercent = meanChangePercent;
            this.shift = shift;
        }

        /** Strictly stronger than an earlier candidate: larger shift, then larger mean change. */
        boolean outranks(Candidate earlier) {
            if (shift != earlier.shift) return shift > earlier.shift;
            return meanChange > earlier.meanChange;
        }
    }
}
