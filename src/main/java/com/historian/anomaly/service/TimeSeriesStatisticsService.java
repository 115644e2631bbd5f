package com.historian.anomaly.service;

import com.historian.anomaly.engine.SampleValidator;
import com.historian.anomaly.engine.StatisticsCalculator;
import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.exception.InvalidConfigurationException;
import com.historian.anomaly.model.BasicStatistics;
import com.historian.anomaly.model.DataQualityReport;
import com.historian.anomaly.model.QualityCode;
import com.historian.anomaly.model.TimeSeriesPoint;
import com.historian.anomaly.model.TrendLine;
import io.micrometer.observation.annotation.Observed;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics over historian samples: summary figures, trend line,
 * moving average, relative change between two periods and quality accounting.
 */
@Service
public class TimeSeriesStatisticsService {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesStatisticsService.class);

    /**
     * Min, max, mean and population standard deviation of the finite values.
     * {@code dataQuality} is the share of GOOD samples among all samples, finite or not.
     */
    @Observed(name = "statistics.basic", contextualName = "calculate-statistics")
    public BasicStatistics calculateStatistics(List<TimeSeriesPoint> data) {
        List<TimeSeriesPoint> all = SampleValidator.sortedCopy(data);
        InsufficientDataException.requireAtLeast("statistics", 1, all.size());
        double[] values = SampleValidator.values(SampleValidator.normalize(all));
        InsufficientDataException.requireAtLeast("statistics", 1, values.length);

        long good = all.stream().filter(p -> p.getQuality() == QualityCode.GOOD).count();

        BasicStatistics statistics = BasicStatistics.builder()
                .min(StatUtils.min(values))
                .max(StatUtils.max(values))
                .average(StatisticsCalculator.mean(values))
                .standardDeviation(StatisticsCalculator.populationStandardDeviation(values))
                .count(values.length)
                .dataQuality(good * 100.0 / all.size())
                .build();

        log.debug("Statistics calculated: count={}, min={}, max={}, average={}",
                statistics.getCount(), statistics.getMin(), statistics.getMax(), statistics.getAverage());
        return statistics;
    }

    @Observed(name = "statistics.trend_line", contextualName = "calculate-trend-line")
    public TrendLine calculateTrendLine(List<TimeSeriesPoint> data) {
        double[] values = SampleValidator.values(SampleValidator.normalize(data));
        InsufficientDataException.requireAtLeast("trend analysis", 2, values.length);

        TrendLine trendLine = StatisticsCalculator.fitLine(values);
        log.debug("Trend line calculated: {} over {} points (r2={})",
                trendLine.getEquation(), values.length, trendLine.getCoefficientOfDetermination());
        return trendLine;
    }

    /**
     * Trailing simple moving average. Each full window yields one point stamped
     * with its last sample; non-finite values inside a window are skipped, and a
     * window with no finite value yields nothing.
     */
    @Observed(name = "statistics.moving_average", contextualName = "calculate-moving-average")
    public List<TimeSeriesPoint> calculateMovingAverage(List<TimeSeriesPoint> data, int windowSize) {
        InvalidConfigurationException.requirePositive("windowSize", windowSize);
        List<TimeSeriesPoint> samples = SampleValidator.sortedCopy(data);
        InsufficientDataException.requireAtLeast("moving average", windowSize, samples.size());

        List<TimeSeriesPoint> result = new ArrayList<>(samples.size() - windowSize + 1);
        for (int end = windowSize - 1; end < samples.size(); end++) {
            double sum = 0;
            int finite = 0;
            for (int i = end - windowSize + 1; i <= end; i++) {
                TimeSeriesPoint point = samples.get(i);
                if (point.hasFiniteValue()) {
                    sum += point.getValue();
                    finite++;
                }
            }
            if (finite > 0) {
                result.add(samples.get(end).toBuilder().value(sum / finite).build());
            }
        }

        log.debug("Moving average calculated: originalPoints={}, averagedPoints={}, windowSize={}",
                samples.size(), result.size(), windowSize);
        return result;
    }

    /**
     * Relative change of the mean of {@code after} against the mean of {@code before}, in percent.
     */
    public double calculatePercentageChange(List<TimeSeriesPoint> before, List<TimeSeriesPoint> after) {
        double[] beforeValues = SampleValidator.values(SampleValidator.normalize(before));
        double[] afterValues = SampleValidator.values(SampleValidator.normalize(after));
        InsufficientDataException.requireAtLeast("percentage change (before)", 1, beforeValues.length);
        InsufficientDataException.requireAtLeast("percentage change (after)", 1, afterValues.length);

        double beforeAverage = StatisticsCalculator.mean(beforeValues);
        if (beforeAverage == 0) {
            throw new InvalidConfigurationException("before",
                    "Cannot compute a percentage change from a zero baseline average");
        }
        double afterAverage = StatisticsCalculator.mean(afterValues);
        return (afterAverage - beforeAverage) / Math.abs(beforeAverage) * 100.0;
    }

    /**
     * Quality-code counts plus the number of sampling gaps, where a gap is an
     * interval longer than twice the median interval. Never throws; empty input
     * yields an all-zero report.
     */
    @Observed(name = "statistics.data_quality", contextualName = "calculate-data-quality")
    public DataQualityReport calculateDataQuality(List<TimeSeriesPoint> data) {
        List<TimeSeriesPoint> samples = SampleValidator.sortedCopy(data);
        if (samples.isEmpty()) {
            return DataQualityReport.builder().build();
        }

        int good = 0;
        int bad = 0;
        int uncertain = 0;
        for (TimeSeriesPoint point : samples) {
            QualityCode quality = point.getQuality() != null ? point.getQuality() : QualityCode.BAD;
            switch (quality) {
                case GOOD -> good++;
                case UNCERTAIN -> uncertain++;
                default -> bad++;
            }
        }

        return DataQualityReport.builder()
                .totalPoints(samples.size())
                .goodQuality(good)
                .badQuality(bad)
                .uncertainQuality(uncertain)
                .qualityPercentage(good * 100.0 / samples.size())
                .missingDataGaps(countGaps(samples))
                .build();
    }

    private int countGaps(List<TimeSeriesPoint> samples) {
        if (samples.size() < 2) {
            return 0;
        }
        long[] intervals = new long[samples.size() - 1];
        for (int i = 1; i < samples.size(); i++) {
            intervals[i - 1] = Duration.between(samples.get(i - 1).getTimestamp(),
                    samples.get(i).getTimestamp()).toMillis();
        }
        long[] sorted = intervals.clone();
        Arrays.sort(sorted);
        long medianInterval = sorted[sorted.length / 2];

        int gaps = 0;
        for (long interval : intervals) {
            if (interval > medianInterval * 2) gaps++;
        }
        return gaps;
    }
}
