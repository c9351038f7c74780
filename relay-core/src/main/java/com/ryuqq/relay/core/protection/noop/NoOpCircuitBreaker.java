package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerState;

import java.time.Duration;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>{@code circuit_breaker.enabled = false}일 때 Fallback Provider가 사용합니다.
 * 모든 요청을 허용하며 상태를 추적하지 않습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(): 항상 true 반환</li>
 *   <li>recordSuccess() / recordFailure() / releasePermit(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;

    public NoOpCircuitBreaker(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public void recordSuccess() {
        // NoOp
    }

    @Override
    public void recordFailure(Throwable throwable) {
        // NoOp
    }

    @Override
    public void releasePermit() {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public int getConsecutiveFailures() {
        return 0;
    }

    @Override
    public Duration getRemainingOpenTime() {
        return Duration.ZERO;
    }

    @Override
    public void reset() {
        // NoOp
    }
}
