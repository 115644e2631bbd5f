package com.historian.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysis(String operation, int points, int anomalies) {
        Counter.builder("analysis.count")
                .tag("operation", operation)
                .register(registry)
                .increment();

        DistributionSummary.builder("analysis.points")
                .tag("operation", operation)
                .register(registry)
                .record(points);

        DistributionSummary.builder("analysis.anomalies")
                .tag("operation", operation)
                .register(registry)
                .record(anomalies);
    }

    public void recordRejected(String operation, String reason) {
        Counter.builder("analysis.rejected.count")
                .tag("operation", operation)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDetectorTriggered(String method, int anomalies) {
        Counter.builder("detector.triggered.count")
                .tag("method", method)
                .register(registry)
                .increment(anomalies);
    }
}
