package com.health.compliance.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger staleJobCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.staleJobCount = registry.gauge("audit.jobs.stale", new AtomicInteger(0));
    }

    public void recordCaptured(String stream) {
        Counter.builder("audit.capture.records")
                .tag("stream", stream)
                .register(registry)
                .increment();
    }

    public void recordCaptureFailure() {
        Counter.builder("audit.capture.failures")
                .register(registry)
                .increment();
    }

    public void recordAlertRaised(String eventType, String severity) {
        Counter.builder("audit.alerts.raised")
                .tag("event_type", eventType)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordAlertResolved() {
        Counter.builder("audit.alerts.resolved")
                .register(registry)
                .increment();
    }

    public void recordHeuristicRun(String heuristic, String outcome) {
        Counter.builder("audit.detection.heuristic.runs")
                .tag("heuristic", heuristic)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordJobOutcome(String kind, String status) {
        Counter.builder("audit.jobs.completed")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateStaleJobCount(int count) {
        staleJobCount.set(count);
    }
}
