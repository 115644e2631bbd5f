package com.historian.anomaly.engine;

import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.exception.InvalidConfigurationException;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.AnomalyReport;
import com.historian.anomaly.model.AnomalySummary;
import com.historian.anomaly.model.DetectionMethod;
import com.historian.anomaly.model.FlaggingThresholds;
import com.historian.anomaly.model.Severity;
import com.historian.anomaly.model.TimeSeriesPoint;
import com.historian.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnomalyAggregatorTest {

    private AnomalyAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = TestDataFactory.createAggregator();
    }

    @Test
    void flagAnomalies_longSeriesWithSpike_runsEveryDetector() {
        List<TimeSeriesPoint> points = TestDataFactory.withValueAt(
                TestDataFactory.oscillatingSeries(100, 55, 15), 50, 175);

        AnomalyReport report = aggregator.flagAnomalies(points, FlaggingThresholds.builder().build());

        assertThat(report.getSummary().getDetectionMethods()).containsExactly(
                DetectionMethod.STATISTICAL_DEVIATION, DetectionMethod.ADVANCED_MULTI_ALGORITHM,
                DetectionMethod.PATTERN_CHANGE, DetectionMethod.TREND_CHANGE);
        assertThat(report.getAnomalies()).filteredOn(a -> a.getValue() == 175.0).singleElement()
                .satisfies(a -> assertThat(a.getSeverity()).isEqualTo(Severity.HIGH));
        assertThat(report.getSummary().getHighSeverity()).isPositive();
    }

    @Test
    void flagAnomalies_threePoints_returnsEmptyReport() {
        AnomalyReport report = aggregator.flagAnomalies(TestDataFactory.series(10, 11, 12),
                FlaggingThresholds.builder().build());

        assertThat(report.getAnomalies()).isEmpty();
        AnomalySummary summary = report.getSummary();
        assertThat(summary.getTotalAnomalies()).isZero();
        assertThat(summary.getAnomalyRate()).isZero();
        assertThat(summary.getDetectionMethods()).containsExactly(DetectionMethod.STATISTICAL_DEVIATION);
    }

    @Test
    void flagAnomalies_twoPoints_throwsWithMinimumThree() {
        assertThatThrownBy(() -> aggregator.flagAnomalies(TestDataFactory.series(10, 11),
                FlaggingThresholds.builder().build()))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("At least 3");
    }

    @Test
    void flagAnomalies_levelStep_reportsPatternChange() {
        List<TimeSeriesPoint> points = TestDataFactory.stepSeries(40, 50, 40, 80);

        AnomalyReport report = aggregator.flagAnomalies(points, FlaggingThresholds.builder().build());

        assertThat(report.getAnomalies())
                .anySatisfy(a -> assertThat(a.getDescription()).startsWith("Pattern change detected"));
    }

    @Test
    void flagAnomalies_disabledDetectors_onlyStatisticalDeviationRuns() {
        FlaggingThresholds thresholds = FlaggingThresholds.builder()
                .enableAdvanced(false)
                .enablePatternDetection(false)
                .enableTrendDetection(false)
                .build();

        AnomalyReport report = aggregator.flagAnomalies(TestDataFactory.stepSeries(40, 50, 40, 80), thresholds);

        assertThat(report.getSummary().getDetectionMethods()).containsExactly(DetectionMethod.STATISTICAL_DEVIATION);
        assertThat(report.getAnomalies()).isEmpty();
    }

    @Test
    void flagAnomalies_mediumSeries_skipsTrendDetection() {
        // 40 points, window 15: advanced and pattern need 30, trend needs 45
        AnomalyReport report = aggregator.flagAnomalies(TestDataFactory.oscillatingSeries(40, 10, 1),
                FlaggingThresholds.builder().build());

        assertThat(report.getSummary().getDetectionMethods()).containsExactly(
                DetectionMethod.STATISTICAL_DEVIATION, DetectionMethod.ADVANCED_MULTI_ALGORITHM,
                DetectionMethod.PATTERN_CHANGE);
    }

    @Test
    void flagAnomalies_nonFiniteValues_areIgnored() {
        List<TimeSeriesPoint> points = TestDataFactory.series(
                10, Double.NaN, 10.2, Double.POSITIVE_INFINITY, 9.9, Double.NEGATIVE_INFINITY, 10.1, 60);

        AnomalyReport report = aggregator.flagAnomalies(points, FlaggingThresholds.builder()
                .statisticalDeviation(1.5)
                .build());

        assertThat(report.getAnomalies()).extracting(AnomalyRecord::getValue).containsExactly(60.0);
        // 1 of 5 finite points
        assertThat(report.getSummary().getAnomalyRate()).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void flagAnomalies_invalidThresholds_throwInvalidConfiguration() {
        List<TimeSeriesPoint> points = TestDataFactory.series(1, 2, 3, 4);

        assertThatThrownBy(() -> aggregator.flagAnomalies(points,
                FlaggingThresholds.builder().statisticalDeviation(0).build()))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> aggregator.flagAnomalies(points,
                FlaggingThresholds.builder().windowSize(-1).build()))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> aggregator.flagAnomalies(points,
                FlaggingThresholds.builder().trendSensitivity(0).build()))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void summarize_countsBySeverity_andClampsRate() {
        List<AnomalyRecord> anomalies = List.of(
                TestDataFactory.createAnomaly(0, 1, Severity.HIGH),
                TestDataFactory.createAnomaly(1, 1, Severity.MEDIUM),
                TestDataFactory.createAnomaly(2, 1, Severity.LOW),
                TestDataFactory.createAnomaly(3, 1, Severity.LOW));

        AnomalySummary summary = AnomalyAggregator.summarize(anomalies, 3,
                List.of(DetectionMethod.STATISTICAL_DEVIATION));

        assertThat(summary.getTotalAnomalies()).isEqualTo(4);
        assertThat(summary.getHighSeverity()).isEqualTo(1);
        assertThat(summary.getMediumSeverity()).isEqualTo(1);
        assertThat(summary.getLowSeverity()).isEqualTo(2);
        assertThat(summary.getAnomalyRate()).isEqualTo(100.0);
    }

    @Test
    void toTrendChangeOptions_derivesThresholdsFromSensitivity() {
        FlaggingThresholds thresholds = FlaggingThresholds.builder().trendSensitivity(2.0).windowSize(1).build();

        assertThat(thresholds.toTrendChangeOptions().getTrendThreshold()).isCloseTo(0.025, within(1e-12));
        assertThat(thresholds.toTrendChangeOptions().getVolatilityThreshold()).isCloseTo(4.0, within(1e-12));
        assertThat(thresholds.toTrendChangeOptions().getWindowSize()).isEqualTo(2);
    }

    @Test
    void flagAnomalies_hugeWindow_skipsWindowedPasses() {
        List<TimeSeriesPoint> points = TestDataFactory.oscillatingSeries(100, 55, 15);
        FlaggingThresholds thresholds = FlaggingThresholds.builder()
                .windowSize(Integer.MAX_VALUE / 2 + 1)
                .build();

        AnomalyReport report = aggregator.flagAnomalies(points, thresholds);

        assertThat(report.getSummary().getDetectionMethods())
                .containsExactly(DetectionMethod.STATISTICAL_DEVIATION);
    }
}
