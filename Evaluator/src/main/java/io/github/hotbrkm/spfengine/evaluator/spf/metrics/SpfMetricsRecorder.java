package io.github.hotbrkm.spfengine.evaluator.spf.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class SpfMetricsRecorder {

    private final MeterRegistry registry;

    public SpfMetricsRecorder(MeterRegistry registry) {
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    public void recordResult(String scope, String result) {
        registry.counter("spf.server.result.total",
                "scope", safe(scope),
                "result", safe(result))
                .increment();
    }

    public void recordDnsQuery(String type, String status) {
        registry.counter("spf.server.dns.query.total",
                "type", safe(type),
                "status", safe(status))
                .increment();
    }

    public void recordLimitExceeded(String limit) {
        registry.counter("spf.server.limit.exceeded.total",
                "limit", safe(limit))
                .increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private String safe(String value) {
        return value == null || value.isBlank() ? "none" : value;
    }
}
