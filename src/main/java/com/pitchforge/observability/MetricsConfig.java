package com.pitchforge.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter generationCalls(String provider, String task, boolean success) {
        return Counter.builder("pitchforge.generation.calls")
                .tag("provider", provider)
                .tag("task", task)
                .tag("outcome", success ? "success" : "failure")
                .register(registry);
    }

    public Timer generationLatency(String provider) {
        return Timer.builder("pitchforge.generation.latency")
                .tag("provider", provider)
                .register(registry);
    }

    public Counter inProviderRetries(String provider, String kind) {
        return Counter.builder("pitchforge.generation.retries")
                .tag("provider", provider)
                .tag("kind", kind)
                .register(registry);
    }
}
