package com.ryuqq.relay.core.spi.noop;

import com.ryuqq.relay.core.spi.ProviderMetrics;

/**
 * 아무것도 기록하지 않는 ProviderMetrics.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpProviderMetrics implements ProviderMetrics {

    public static final NoOpProviderMetrics INSTANCE = new NoOpProviderMetrics();

    private NoOpProviderMetrics() {
    }

    @Override
    public void increment(String counter) {
        // NoOp
    }
}
