/**
 * In-memory metrics adapter.
 *
 * <p>{@link com.ryuqq.relay.adapter.inmemory.metrics.InMemoryProviderMetrics} implements the
 * {@link com.ryuqq.relay.core.spi.ProviderMetrics} SPI with named counters held in memory.
 * It is the reference sink for the {@code retry} counter incremented by network providers and the
 * {@code complete}/{@code acomplete}/{@code embed}/{@code aembed} failure counters incremented by
 * the operations facade.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory.metrics;
