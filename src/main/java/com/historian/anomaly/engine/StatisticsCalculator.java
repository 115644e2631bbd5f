package com.historian.anomaly.engine;

import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.model.StatisticalSummary;
import com.historian.anomaly.model.TrendLine;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.Arrays;
import java.util.Locale;

/**
 * Numeric primitives shared by all detectors. Every method is a pure function of
 * its arguments; inputs are expected to be finite.
 */
public final class StatisticsCalculator {

    private StatisticsCalculator() {}

    /**
     * Mean, median, population standard deviation and unscaled MAD.
     * A spread that overflows is reported as zero, so detectors treat the
     * sample as degenerate and flag nothing.
     *
     * @throws InsufficientDataException when {@code values} is empty
     */
    public static StatisticalSummary summarize(double[] values) {
        InsufficientDataException.requireAtLeast("statistical summary", 1, values.length);

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double mean = mean(values);
        double median = medianOfSorted(sorted);
        // A constant series must report exactly zero spread; floating-point
        // rounding in the mean would otherwise leave a tiny positive residue.
        boolean constant = sorted[0] == sorted[sorted.length - 1];
        double standardDeviation = constant ? 0.0 : Math.sqrt(StatUtils.populationVariance(values, mean));
        if (!Double.isFinite(standardDeviation)) {
            standardDeviation = 0.0;
        }

        double[] absoluteDeviations = new double[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            absoluteDeviations[i] = Math.abs(sorted[i] - median);
        }
        Arrays.sort(absoluteDeviations);
        double mad = constant ? 0.0 : medianOfSorted(absoluteDeviations);
        if (!Double.isFinite(mad)) {
            mad = 0.0;
        }

        return StatisticalSummary.builder()
                .count(values.length)
                .mean(mean)
                .median(median)
                .standardDeviation(standardDeviation)
                .mad(mad)
                .build();
    }

    public static double mean(double[] values) {
        double mean = StatUtils.mean(values);
        if (Double.isFinite(mean) || values.length == 0) {
            return mean;
        }
        // The running sum overflowed; average pre-scaled values instead
        double scaled = 0.0;
        for (double value : values) {
            scaled += value / values.length;
        }
        return scaled;
    }

    /**
     * May be infinite when the squared deviations overflow; callers decide
     * whether that makes the window unusable.
     */
    public static double populationStandardDeviation(double[] values) {
        if (values.length == 0) return 0.0;
        return Math.sqrt(StatUtils.populationVariance(values));
    }

    /**
     * Quartile by linear interpolation between closest ranks (R-7, as in most spreadsheets).
     *
     * @param quantile percentile in (0, 100]
     */
    public static double percentile(double[] values, double quantile) {
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, quantile);
    }

    /**
     * Least-squares fit of {@code values} against their index 0..n-1.
     * Requires at least two values.
     */
    public static TrendLine fitLine(double[] values) {
        InsufficientDataException.requireAtLeast("trend analysis", 2, values.length);

        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }

        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        double correlation = regression.getR();
        if (!Double.isFinite(correlation)) {
            // Flat series: correlation is undefined
            correlation = 0.0;
        }
        if (!Double.isFinite(slope)) {
            slope = 0.0;
            intercept = mean(values);
        }

        return TrendLine.builder()
                .slope(slope)
                .intercept(intercept)
                .correlation(correlation)
                .coefficientOfDetermination(correlation * correlation)
                .equation(formatEquation(slope, intercept))
                .build();
    }

    public static String formatEquation(double slope, double intercept) {
        String sign = intercept >= 0 ? "+" : "-";
        return String.format(Locale.ROOT, "y = %.4fx %s %.4f", slope, sign, Math.abs(intercept));
    }

    private static double medianOfSorted(double[] sorted) {
        int n = sorted.length;
        int mid = n / 2;
        if (n % 2 == 1) {
            return sorted[mid];
        }
        // Halving first keeps the midpoint of two huge values finite
        return sorted[mid - 1] / 2.0 + sorted[mid] / 2.0;
    }
}
