package com.historian.anomaly.config;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsConfigTest {

    private SimpleMeterRegistry registry;
    private MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsConfig = new MetricsConfig(registry);
    }

    @Test
    void recordAnalysis_countsCallsAndRecordsSizes() {
        metricsConfig.recordAnalysis("flag", 100, 4);
        metricsConfig.recordAnalysis("flag", 50, 0);

        assertThat(registry.get("analysis.count").tag("operation", "flag").counter().count()).isEqualTo(2.0);

        DistributionSummary points = registry.get("analysis.points").tag("operation", "flag").summary();
        assertThat(points.count()).isEqualTo(2);
        assertThat(points.totalAmount()).isEqualTo(150.0);

        DistributionSummary anomalies = registry.get("analysis.anomalies").tag("operation", "flag").summary();
        assertThat(anomalies.max()).isEqualTo(4.0);
    }

    @Test
    void recordRejected_tagsByOperationAndReason() {
        metricsConfig.recordRejected("anomalies", "insufficient-data");
        metricsConfig.recordRejected("anomalies", "insufficient-data");
        metricsConfig.recordRejected("anomalies", "invalid-configuration");

        assertThat(registry.get("analysis.rejected.count")
                .tags("operation", "anomalies", "reason", "insufficient-data")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("analysis.rejected.count")
                .tags("operation", "anomalies", "reason", "invalid-configuration")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void recordDetectorTriggered_incrementsByAnomalyCount() {
        metricsConfig.recordDetectorTriggered("grubbs", 3);
        metricsConfig.recordDetectorTriggered("grubbs", 0);

        assertThat(registry.get("detector.triggered.count").tag("method", "grubbs").counter().count())
                .isEqualTo(3.0);
    }
}
