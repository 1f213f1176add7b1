package com.onevault.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Meter names used by the core:
 * <ul>
 *   <li>{@code onevault.gateway.decisions} (tags {@code decision}, {@code reason}, {@code tier})</li>
 *   <li>{@code onevault.gateway.duration} (tag {@code operation})</li>
 *   <li>{@code onevault.session.transitions} (tag {@code state})</li>
 *   <li>{@code onevault.risk.signal.degraded} (tag {@code signal})</li>
 *   <li>{@code onevault.audit.delivery.failures}, {@code onevault.audit.dropped},
 *       {@code onevault.audit.retry.pending}</li>
 * </ul>
 * Registration is idempotent: asking twice for the same name and tags returns the same meter.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * @param tags additional tags as key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /** Registers a gauge that samples {@code value} whenever the registry is scraped. */
    public void gauge(String name, String description, Supplier<Number> value, String... tags) {
        Gauge.builder(name, value)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        if (extraTags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key-value pairs");
        }
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
