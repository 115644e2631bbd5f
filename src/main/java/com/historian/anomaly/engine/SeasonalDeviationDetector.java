package com.historian.anomaly.engine;

import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.Severity;
import com.historian.anomaly.model.TimeSeriesPoint;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares each sample against the baseline of its hour-of-day slot.
 *
 * Samples are grouped by hour in the given zone; slots with at least two samples
 * and a positive standard deviation get a baseline. A sample is flagged when it
 * lies more than {@value #DEVIATION_THRESHOLD} slot standard deviations from the
 * slot mean (above 4 is high, above 3 medium).
 *
 * Series shorter than {@value #MIN_SAMPLES} samples cannot cover a day and yield no anomalies.
 */
@Component
public class SeasonalDeviationDetector {

    public static final int MIN_SAMPLES = 24;
    static final double DEVIATION_THRESHOLD = 2.0;

    /**
     * @param samples validated samples (see {@link SampleValidator#normalize})
     */
    public List<AnomalyRecord> detect(List<TimeSeriesPoint> samples, ZoneId zone) {
        List<AnomalyRecord> anomalies = new ArrayList<>();
        if (samples.size() < MIN_SAMPLES) {
            return anomalies;
        }

        Map<Integer, List<Double>> valuesByHour = new HashMap<>();
        for (TimeSeriesPoint point : samples) {
            valuesByHour.computeIfAbsent(hourOf(point, zone), h -> new ArrayList<>()).add(point.getValue());
        }

        Map<Integer, double[]> baselines = new HashMap<>();
        for (Map.Entry<Integer, List<Double>> slot : valuesByHour.entrySet()) {
            if (slot.getValue().size() < 2) continue;
            double[] values = slot.getValue().stream().mapToDouble(Double::doubleValue).toArray();
            double sd = StatisticsCalculator.populationStandardDeviation(values);
            if (sd > 0 && Double.isFinite(sd)) {
                baselines.put(slot.getKey(), new double[]{StatisticsCalculator.mean(values), sd});
            }
        }

        for (TimeSeriesPoint point : samples) {
            int hour = hourOf(point, zone);
            double[] baseline = baselines.get(hour);
            if (baseline == null) continue;

            double deviation = Math.abs(point.getValue() - baseline[0]) / baseline[1];
            if (!(deviation > DEVIATION_THRESHOLD)) continue;

            anomalies.add(AnomalyRecord.builder()
                    .timestamp(point.getTimestamp())
                    .value(point.getValue())
                    .expectedValue(baseline[0])
                    .deviation(deviation)
                    .severity(deviation > 4 ? Severity.HIGH : deviation > 3 ? Severity.MEDIUM : Severity.LOW)
                    .description(String.format(Locale.ROOT,
                            "Seasonal anomaly: value deviates %.2f standard deviations from hour %d pattern",
                            deviation, hour))
                    .build());
        }

        return anomalies;
    }

    private int hourOf(TimeSeriesPoint point, ZoneId zone) {
        return point.getTimestamp().atZone(zone).getHour();
    }
}
