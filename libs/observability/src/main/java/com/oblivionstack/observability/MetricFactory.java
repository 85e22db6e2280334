package com.oblivionstack.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Factory for Micrometer meters with a consistent {@code oblivion.} name prefix and a
 * {@code component} tag.
 * <p>
 * Meters are looked up by name and tags on every call, so callers can request a counter with
 * per-call tag values (resource, operation, outcome) without caching meter instances themselves.
 */
public final class MetricFactory {

    /** Prefix applied to every meter name. */
    public static final String PREFIX = "oblivion.";

    /** Tag key naming the library component that owns the meter. */
    public static final String TAG_COMPONENT = "component";

    private final MeterRegistry registry;
    private final String component;

    /**
     * Creates a MetricFactory bound to the given registry and component name.
     *
     * @param registry  the Micrometer meter registry
     * @param component logical component name included as a default tag (e.g. "authz")
     */
    public MetricFactory(MeterRegistry registry, String component) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("component must not be null or blank");
        }
        this.registry = registry;
        this.component = component;
    }

    /**
     * Returns the counter registered under {@code oblivion.<name>} with the given extra tags,
     * creating it on first use.
     *
     * @param name        metric name without prefix (e.g. "authz.decisions")
     * @param description human-readable description
     * @param tags        additional tags as key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(PREFIX + name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the timer registered under {@code oblivion.<name>} with the given extra tags.
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(PREFIX + name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge backed by a fresh {@link AtomicLong} and returns that holder.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(PREFIX + name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
        return value;
    }

    /**
     * Times {@code work} with the named timer and returns its result.
     */
    public <T> T record(String name, String description, Supplier<T> work) {
        return timer(name, description).record(work);
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    /** Returns the component name used as a default tag. */
    public String component() {
        return component;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_COMPONENT, component);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
