package com.iotstuff.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordReading(String phase) {
        Counter.builder("detection.readings.count")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordDetectorTriggered(String detector) {
        Counter.builder("detector.triggered.count")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String severity) {
        Counter.builder("anomaly.detected.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordStateFallback(String operation) {
        Counter.builder("state.fallback.count")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordWriteConflict(String outcome) {
        Counter.builder("state.write_conflict.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordPublish(String sink, String status) {
        Counter.builder("event.published.count")
                .tag("sink", sink)
                .tag("status", status)
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
}
