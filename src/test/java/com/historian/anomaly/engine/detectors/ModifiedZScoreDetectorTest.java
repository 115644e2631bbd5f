package com.historian.anomaly.engine.detectors;

import com.historian.anomaly.engine.SampleValidator;
import com.historian.anomaly.engine.StatisticsCalculator;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.Severity;
import com.historian.anomaly.model.StatisticalSummary;
import com.historian.anomaly.model.TimeSeriesPoint;
import com.historian.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ModifiedZScoreDetectorTest {

    private final ModifiedZScoreDetector detector = new ModifiedZScoreDetector();

    private List<AnomalyRecord> detect(List<TimeSeriesPoint> points, double threshold) {
        StatisticalSummary summary = StatisticsCalculator.summarize(SampleValidator.values(points));
        return detector.detect(points, summary,
                DeviationAnalysisOptions.builder().modifiedZscoreThreshold(threshold).build());
    }

    @Test
    void detect_outlier_flaggedAgainstMedian() {
        // median 10, MAD 0.1
        List<TimeSeriesPoint> points = TestDataFactory.series(10, 10.1, 9.9, 10.2, 9.8, 10, 10.1, 9.9, 10, 20);

        List<AnomalyRecord> anomalies = detect(points, 3.5);

        assertThat(anomalies).hasSize(1);
        AnomalyRecord outlier = anomalies.get(0);
        assertThat(outlier.getValue()).isEqualTo(20.0);
        assertThat(outlier.getExpectedValue()).isCloseTo(10.0, within(1e-9));
        assertThat(outlier.getDeviation()).isCloseTo(67.45, within(0.01));
        assertThat(outlier.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(outlier.getDescription()).startsWith("Modified Z-score anomaly");
    }

    @Test
    void detect_zeroMad_returnsEmpty() {
        // more than half the samples share one value
        List<TimeSeriesPoint> points = TestDataFactory.series(5, 5, 5, 5, 9);

        assertThat(detect(points, 3.5)).isEmpty();
    }

    @Test
    void detect_everyDeviationExceedsThreshold() {
        List<TimeSeriesPoint> points = TestDataFactory.gaussianSeries(7L, 200, 50, 5);

        for (double threshold : new double[]{0.5, 1.0, 2.0, 3.5}) {
            assertThat(detect(points, threshold))
                    .allSatisfy(a -> assertThat(a.getDeviation()).isGreaterThan(threshold));
        }
    }
}
