package com.infra.whatif.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordVerdict(boolean safe, String overallRiskLevel) {
        Counter.builder("verdict.count")
                .tag("safe", String.valueOf(safe))
                .tag("risk_level", overallRiskLevel)
                .register(registry)
                .increment();
    }

    public void recordBucketFailed(String bucket) {
        Counter.builder("bucket.failed.count")
                .tag("bucket", bucket)
                .register(registry)
                .increment();
    }

    public void recordNoiseFiltered(int excludedCount) {
        Counter.builder("noise.filtered.count")
                .register(registry)
                .increment(excludedCount);
    }

    public void recordReclassification(String outcome) {
        Counter.builder("reclassification.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordOracleCall(String provider, String status) {
        Counter.builder("oracle.call.count")
                .tag("provider", provider)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
