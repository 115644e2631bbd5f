package com.historian.anomaly.engine;

import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.OutlierMethod;
import com.historian.anomaly.model.StatisticalSummary;
import com.historian.anomaly.model.TimeSeriesPoint;

import java.util.List;

/**
 * Interface for all single-method outlier tests.
 * Each implementation handles a specific OutlierMethod.
 */
public interface OutlierDetector {

    /**
     * The outlier test this detector implements.
     */
    OutlierMethod getSupportedMethod();

    /**
     * Run the test over a validated working set.
     *
     * @param samples finite samples, ascending by timestamp (see {@link SampleValidator})
     * @param summary statistics of {@code samples}
     * @param options thresholds; each detector reads only its own
     * @return flagged samples, ascending by timestamp; empty when the sample is degenerate
     */
    List<AnomalyRecord> detect(List<TimeSeriesPoint> samples, StatisticalSummary summary,
                               DeviationAnalysisOptions options);
}
