package com.historian.anomaly.engine;

import com.historian.anomaly.model.TimeSeriesPoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a raw historian sample list into the working set every detector expects:
 * ascending by timestamp, with null entries, untimestamped entries and non-finite
 * values (NaN, +/-Infinity) removed.
 *
 * The caller's list is never modified; a fresh list is returned on every call.
 */
public final class SampleValidator {

    private static final Comparator<TimeSeriesPoint> CHRONOLOGICAL =
            Comparator.comparing(TimeSeriesPoint::getTimestamp);

    private SampleValidator() {}

    public static List<TimeSeriesPoint> normalize(List<TimeSeriesPoint> raw) {
        if (raw == null || raw.isEmpty()) {
            return new ArrayList<>();
        }

        List<TimeSeriesPoint> usable = new ArrayList<>(raw.size());
        for (TimeSeriesPoint point : raw) {
            if (point != null && point.getTimestamp() != null && point.hasFiniteValue()) {
                usable.add(point);
            }
        }

        // List.sort is stable: samples sharing a timestamp keep their input order
        usable.sort(CHRONOLOGICAL);
        return usable;
    }

    /**
     * Sorts without dropping non-finite values. Used where every sample counts
     * (quality accounting), never as input to mean/variance math.
     */
    public static List<TimeSeriesPoint> sortedCopy(List<TimeSeriesPoint> raw) {
        if (raw == null || raw.isEmpty()) {
            return new ArrayList<>();
        }
        List<TimeSeriesPoint> copy = new ArrayList<>(raw.size());
        for (TimeSeriesPoint point : raw) {
            if (point != null && point.getTimestamp() != null) {
                copy.add(point);
            }
        }
        copy.sort(CHRONOLOGICAL);
        return copy;
    }

    public static double[] values(List<TimeSeriesPoint> samples) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).getValue();
        }
        return values;
    }
}
