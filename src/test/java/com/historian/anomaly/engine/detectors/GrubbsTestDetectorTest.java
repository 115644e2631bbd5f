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

class GrubbsTestDetectorTest {

    private final GrubbsTestDetector detector = new GrubbsTestDetector();

    private static final List<TimeSeriesPoint> WITH_OUTLIER =
            TestDataFactory.series(10, 10.1, 9.9, 10.2, 9.8, 10, 10.1, 9.9, 10, 20);

    private List<AnomalyRecord> detect(List<TimeSeriesPoint> points, double threshold) {
        StatisticalSummary summary = StatisticsCalculator.summarize(SampleValidator.values(points));
        return detector.detect(points, summary, DeviationAnalysisOptions.builder().grubbsThreshold(threshold).build());
    }

    @Test
    void criticalValue_matchesPublishedTable() {
        // two-sided, alpha = 0.05
        assertThat(GrubbsTestDetector.criticalValue(3, 0.05)).isCloseTo(1.155, within(0.001));
        assertThat(GrubbsTestDetector.criticalValue(10, 0.05)).isCloseTo(2.290, within(0.001));
        assertThat(GrubbsTestDetector.criticalValue(30, 0.05)).isCloseTo(2.908, within(0.002));
    }

    @Test
    void detect_singleOutlier_flagsMostExtremeValue() {
        List<AnomalyRecord> anomalies = detect(WITH_OUTLIER, 1.0);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getValue()).isEqualTo(20.0);
        assertThat(anomalies.get(0).getExpectedValue()).isCloseTo(11.0, within(1e-9));
        assertThat(anomalies.get(0).getSeverity()).isIn(Severity.MEDIUM, Severity.HIGH);
        assertThat(anomalies.get(0).getDescription()).contains("Grubbs test anomaly: G=");
    }

    @Test
    void detect_thresholdAboveStatistic_returnsEmpty() {
        // G is about 3.0 for this sample
        assertThat(detect(WITH_OUTLIER, 3.5)).isEmpty();
    }

    @Test
    void detect_noOutlier_returnsEmpty() {
        List<TimeSeriesPoint> points = TestDataFactory.series(10, 11, 12, 13, 14, 15, 16, 17, 18, 19);

        assertThat(detect(points, 1.0)).isEmpty();
    }

    @Test
    void detect_constantSeries_returnsEmpty() {
        assertThat(detect(TestDataFactory.constantSeries(12, 3.0), 1.0)).isEmpty();
    }
}
