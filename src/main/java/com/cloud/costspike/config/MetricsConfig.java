package com.cloud.costspike.config;

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

    public void recordDetection(int totalRows, int anomalyCount, double anomalousCost) {
        Counter.builder("detection.requests")
                .tag("outcome", "success")
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.rows")
                .register(registry)
                .record(totalRows);

        DistributionSummary.builder("detection.anomalies")
                .register(registry)
                .record(anomalyCount);

        DistributionSummary.builder("detection.anomalous_cost")
                .register(registry)
                .record(anomalousCost);
    }

    public void recordRejected(String errorKind) {
        Counter.builder("detection.requests")
                .tag("outcome", "rejected")
                .tag("error", errorKind)
                .register(registry)
                .increment();
    }
}
