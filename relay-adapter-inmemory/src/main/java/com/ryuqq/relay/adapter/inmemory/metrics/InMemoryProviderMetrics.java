package com.ryuqq.relay.adapter.inmemory.metrics;

import com.ryuqq.relay.core.spi.ProviderMetrics;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory implementation of {@link ProviderMetrics} for testing and local runs.
 *
 * <p>Each counter name maps to a {@link LongAdder}, created on first increment via
 * {@link ConcurrentHashMap#computeIfAbsent}. Counters are never removed except by {@link #reset()}.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link #increment(String)} is lock-free and safe from any thread</li>
 *   <li>{@link #snapshot()} is weakly consistent with concurrent increments</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryProviderMetrics metrics = new InMemoryProviderMetrics();
 * ProviderOperations operations = new ProviderOperations(factory, contextSupplier, metrics);
 *
 * operations.complete(CompletionRequest.of("hello"));
 *
 * long failures = metrics.count(ProviderOperations.COMPLETE);
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InMemoryProviderMetrics implements ProviderMetrics {

    /**
     * Counter name → accumulated count.
     */
    private final ConcurrentHashMap<String, LongAdder> counters = new ConcurrentHashMap<>();

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if counter is null or blank
     */
    @Override
    public void increment(String counter) {
        if (counter == null || counter.isBlank()) {
            throw new IllegalArgumentException("counter cannot be null or blank");
        }
        counters.computeIfAbsent(counter, key -> new LongAdder()).increment();
    }

    /**
     * Returns the current value of a counter.
     *
     * @param counter counter name
     * @return accumulated count, 0 if the counter was never incremented
     */
    public long count(String counter) {
        LongAdder adder = counters.get(counter);
        return adder == null ? 0L : adder.sum();
    }

    /**
     * Returns a sorted, immutable copy of all counters.
     *
     * @return counter name → count
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> copy = new TreeMap<>();
        counters.forEach((name, adder) -> copy.put(name, adder.sum()));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Clears all counters.
     */
    public void reset() {
        counters.clear();
    }

    @Override
    public String toString() {
        return "InMemoryProviderMetrics" + snapshot();
    }
}
