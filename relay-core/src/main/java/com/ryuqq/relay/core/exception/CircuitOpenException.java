package com.ryuqq.relay.core.exception;

import java.time.Duration;

/**
 * Circuit Breaker가 호출을 거부함.
 *
 * <p>로컬에서 재시도하지 않으며, Fallback 루프는 다음 후보로 넘어갑니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class CircuitOpenException extends ProviderException {

    private final Duration remaining;

    /**
     * 생성자.
     *
     * @param providerName 차단된 Provider 이름
     * @param remaining 복구 시도까지 남은 시간
     */
    public CircuitOpenException(String providerName, Duration remaining) {
        super(providerName, "Circuit breaker for provider " + providerName + " is open");
        this.remaining = remaining;
    }

    public Duration getRemaining() {
        return remaining;
    }
}
