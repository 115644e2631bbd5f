package com.historian.anomaly.engine;

import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.exception.InvalidConfigurationException;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.PatternChangeOptions;
import com.historian.anomaly.model.Severity;
import com.historian.anomaly.model.TimeSeriesPoint;
import com.historian.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PatternChangeDetectorTest {

    private final PatternChangeDetector detector = new PatternChangeDetector();

    private static PatternChangeOptions options(int windowSize, double sensitivity, double minChangePercent) {
        return PatternChangeOptions.builder()
                .windowSize(windowSize)
                .sensitivityThreshold(sensitivity)
                .minChangePercent(minChangePercent)
                .build();
    }

    @Test
    void detect_levelStep_flagsSegmentBoundary() {
        List<TimeSeriesPoint> points = TestDataFactory.stepSeries(40, 50, 40, 80);

        List<AnomalyRecord> changes = detector.detect(points, options(10, 1.5, 10));

        assertThat(changes).hasSize(1);
        AnomalyRecord change = changes.get(0);
        assertThat(change.getTimestamp()).isEqualTo(TestDataFactory.timestampAt(40));
        assertThat(change.getValue()).isCloseTo(80.0, within(1e-9));
        assertThat(change.getExpectedValue()).isCloseTo(50.0, within(1e-9));
        assertThat(change.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(change.getDescription()).startsWith("Pattern change detected: mean shifted by 60.0%");
    }

    @Test
    void detect_flatWindowsAtDifferentLevels_reportsFiniteDeviation() {
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < 20 ? 10 : 20;
        }

        List<AnomalyRecord> changes = detector.detect(TestDataFactory.series(values), options(10, 1.5, 10));

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).getTimestamp()).isEqualTo(TestDataFactory.timestampAt(20));
        assertThat(changes.get(0).getDeviation()).isCloseTo(1.0, within(1e-9));
        assertThat(changes.get(0).getDescription()).contains("unbounded");
    }

    @Test
    void detect_smallRelativeChange_notFlagged() {
        // 50 -> 52 is a 4% change, below the 10% minimum
        List<TimeSeriesPoint> points = TestDataFactory.stepSeries(40, 50, 40, 52);

        assertThat(detector.detect(points, options(10, 1.5, 10))).isEmpty();
    }

    @Test
    void detect_lowerSensitivity_flagsSuperset() {
        for (long seed = 1; seed <= 20; seed++) {
            List<TimeSeriesPoint> points = TestDataFactory.noisyHistorianSeries(seed, 120);
            Set<Instant> strict = timestamps(detector.detect(points, options(10, 2.5, 5)));
            Set<Instant> loose = timestamps(detector.detect(points, options(10, 1.0, 5)));

            assertThat(loose).containsAll(strict);
        }
    }

    @Test
    void detect_belowMinimumLength_throwsWithMinimum() {
        assertThatThrownBy(() -> detector.detect(TestDataFactory.constantSeries(19, 1), options(10, 1.5, 10)))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("At least 20");
        assertThatThrownBy(() -> detector.detect(TestDataFactory.constantSeries(29, 1), options(15, 1.5, 10)))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> assertThat(((InsufficientDataException) e).getMinimumRequired()).isEqualTo(30));
    }

    @Test
    void detect_invalidOptions_throwInvalidConfiguration() {
        List<TimeSeriesPoint> points = TestDataFactory.constantSeries(40, 1);

        assertThatThrownBy(() -> detector.detect(points, options(0, 1.5, 10)))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> detector.detect(points, options(10, -1, 10)))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> detector.detect(points, options(10, 1.5, -5)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void detect_constantSeries_returnsEmpty() {
        assertThat(detector.detect(TestDataFactory.constantSeries(60, 42.0), options(10, 1.5, 10))).isEmpty();
    }

    private static Set<Instant> timestamps(List<AnomalyRecord> anomalies) {
        return anomalies.stream().map(AnomalyRecord::getTimestamp).collect(Collectors.toSet());
    }

    // ── Noise and limits ──

    @Test
    void detect_noisyLevelStep_flagsOnlyStrongestBoundary() {
        for (long seed = 1; seed <= 50; seed++) {
            Random random = new Random(seed);
            double[] values = new double[80];
            for (int i = 0; i < values.length; i++) {
                values[i] = (i < 40 ? 50 : 80) + 2 * random.nextGaussian();
            }

            List<AnomalyRecord> changes = detector.detect(TestDataFactory.series(values), options(10, 1.5, 10));

            assertThat(changes).as("seed %d", seed).hasSize(1);
            assertThat(changes.get(0).getTimestamp()).as("seed %d", seed)
                    .isEqualTo(TestDataFactory.timestampAt(40));
        }
    }

    @Test
    void detect_windowTooLargeToDouble_throwsInsufficientData() {
        List<TimeSeriesPoint> points = TestDataFactory.constantSeries(40, 1.0);

        assertThatThrownBy(() -> detector.detect(points, options(Integer.MAX_VALUE / 2 + 1, 1.5, 10)))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> assertThat(((InsufficientDataException) e).getMinimumRequired())
                        .isEqualTo(Integer.MAX_VALUE));
        assertThat(PatternChangeDetector.minimumSamples(Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void detect_commaDecimalDefaultLocale_describesWithDots() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            List<AnomalyRecord> changes = detector.detect(
                    TestDataFactory.stepSeries(40, 50, 40, 80), options(10, 1.5, 10));

            assertThat(changes.get(0).getDescription()).startsWith("Pattern change detected: mean shifted by 60.0%");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
