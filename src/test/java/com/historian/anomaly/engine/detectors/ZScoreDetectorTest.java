package com.historian.anomaly.engine.detectors;

import com.historian.anomaly.engine.SampleValidator;
import com.historian.anomaly.engine.StatisticsCalculator;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.OutlierMethod;
import com.historian.anomaly.model.Severity;
import com.historian.anomaly.model.StatisticalSummary;
import com.historian.anomaly.model.TimeSeriesPoint;
import com.historian.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ZScoreDetectorTest {

    private final ZScoreDetector detector = new ZScoreDetector();

    private List<AnomalyRecord> detect(List<TimeSeriesPoint> points, double threshold) {
        StatisticalSummary summary = StatisticsCalculator.summarize(SampleValidator.values(points));
        return detector.detect(points, summary, DeviationAnalysisOptions.builder().zscoreThreshold(threshold).build());
    }

    @Test
    void getSupportedMethod_returnsZscore() {
        assertThat(detector.getSupportedMethod()).isEqualTo(OutlierMethod.ZSCORE);
    }

    @Test
    void detect_singleSpike_flaggedAsHigh() {
        List<TimeSeriesPoint> points = TestDataFactory.withValueAt(
                TestDataFactory.oscillatingSeries(100, 55, 15), 50, 55 + 8 * 15);

        List<AnomalyRecord> anomalies = detect(points, 2.0);

        assertThat(anomalies).hasSize(1);
        AnomalyRecord spike = anomalies.get(0);
        assertThat(spike.getTimestamp()).isEqualTo(TestDataFactory.timestampAt(50));
        assertThat(spike.getValue()).isEqualTo(175.0);
        assertThat(spike.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(spike.getDeviation()).isGreaterThan(4.0);
        assertThat(spike.getDescription()).contains("standard deviations from mean");
    }

    @Test
    void detect_expectedValueIsMean() {
        List<TimeSeriesPoint> points = TestDataFactory.series(10, 10, 10, 10, 10, 10, 10, 10, 10, 50);

        List<AnomalyRecord> anomalies = detect(points, 2.0);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getExpectedValue()).isCloseTo(14.0, within(1e-9));
        // z = 36 / 12 = 3.0
        assertThat(anomalies.get(0).getDeviation()).isCloseTo(3.0, within(1e-9));
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(Severity.LOW);
    }

    @Test
    void detect_constantSeries_returnsEmpty() {
        assertThat(detect(TestDataFactory.constantSeries(30, 42.0), 2.0)).isEmpty();
    }

    @Test
    void detect_valueExactlyAtThreshold_notFlagged() {
        // mean 0, population sd 1: both values sit exactly 1 sd away
        List<TimeSeriesPoint> points = TestDataFactory.series(-1, 1, -1, 1);

        assertThat(detect(points, 1.0)).isEmpty();
    }

    @Test
    void detect_severityBands_followThresholdRatio() {
        // mean 14, sd 12, z = 3.0 for the last sample
        List<TimeSeriesPoint> points = TestDataFactory.series(10, 10, 10, 10, 10, 10, 10, 10, 10, 50);

        assertThat(detect(points, 2.9).get(0).getSeverity()).isEqualTo(Severity.LOW);
        assertThat(detect(points, 1.9).get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(detect(points, 1.4).get(0).getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void detect_commaDecimalDefaultLocale_describesWithDots() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            List<AnomalyRecord> anomalies = detect(
                    TestDataFactory.series(10, 10, 10, 10, 10, 10, 10, 10, 10, 50), 2.0);

            assertThat(anomalies.get(0).getDescription())
                    .isEqualTo("Value deviates 3.00 standard deviations from mean (threshold: 2.00)");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
