package com.ryuqq.relay.core.config;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * @author Relay Team
 * @since 1.0.0
 * @param enabled false면 Fallback Provider가 pass-through breaker를 사용
 * @param failureThreshold OPEN 전이까지의 연속 실패 횟수 (1 이상)
 * @param recoveryTimeout OPEN 이후 HALF_OPEN 시험 호출까지 대기 시간 (0 이상)
 */
public record CircuitBreakerConfig(
    boolean enabled,
    int failureThreshold,
    Duration recoveryTimeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: enabled=true, failureThreshold=5, recoveryTimeout=60s</p>
     */
    public CircuitBreakerConfig() {
        this(true, 5, Duration.ofSeconds(60));
    }

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "recoveryTimeout must be >= 0 (current: " + recoveryTimeout + ")"
            );
        }
    }

    public CircuitBreakerConfig withEnabled(boolean enabled) {
        return new CircuitBreakerConfig(enabled, failureThreshold, recoveryTimeout);
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(enabled, failureThreshold, recoveryTimeout);
    }

    public CircuitBreakerConfig withRecoveryTimeout(Duration recoveryTimeout) {
        return new CircuitBreakerConfig(enabled, failureThreshold, recoveryTimeout);
    }
}
