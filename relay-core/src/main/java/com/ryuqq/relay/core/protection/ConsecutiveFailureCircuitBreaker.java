package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.config.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p>실패율 윈도우 대신 "마지막 성공 이후 연속 실패 횟수"만 봅니다.
 * 시간은 주입된 {@link Clock}에서 읽으므로 테스트에서 수동으로 진행시킬 수 있습니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 모든 메서드는 synchronized이며,
 * 여러 호출자가 하나의 Fallback Provider를 공유해도 안전합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    /**
     * 시스템 시계로 생성.
     *
     * @param name 보호 대상 이름
     * @param config Circuit Breaker 설정
     */
    public ConsecutiveFailureCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param name 보호 대상 이름
     * @param config Circuit Breaker 설정 (failureThreshold, recoveryTimeout 사용)
     * @param clock 시간 공급자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ConsecutiveFailureCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.failureThreshold = config.failureThreshold();
        this.recoveryTimeout = config.recoveryTimeout();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized boolean tryAcquire() {
        if (state == CircuitBreakerState.CLOSED) {
            return true;
        }
        if (state == CircuitBreakerState.OPEN) {
            if (!recoveryElapsed()) {
                return false;
            }
            state = CircuitBreakerState.HALF_OPEN;
            log.info("Circuit breaker for {} is half-open, allowing a trial call", name);
        }
        if (trialInFlight) {
            return false;
        }
        trialInFlight = true;
        return true;
    }

    @Override
    public synchronized void recordSuccess() {
        if (state != CircuitBreakerState.CLOSED) {
            log.info("Circuit breaker for {} closed after successful trial", name);
        }
        state = CircuitBreakerState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
    }

    @Override
    public synchronized void recordFailure(Throwable throwable) {
        consecutiveFailures++;
        trialInFlight = false;
        if (state == CircuitBreakerState.HALF_OPEN || consecutiveFailures >= failureThreshold) {
            if (state != CircuitBreakerState.OPEN) {
                log.warn("Circuit breaker for {} opened after {} consecutive failures: {}",
                    name, consecutiveFailures, throwable == null ? null : throwable.getMessage());
            }
            state = CircuitBreakerState.OPEN;
            openedAt = clock.instant();
        } else {
            log.debug("Circuit breaker for {} recorded failure {}/{}", name, consecutiveFailures, failureThreshold);
        }
    }

    @Override
    public synchronized void releasePermit() {
        trialInFlight = false;
    }

    @Override
    public synchronized CircuitBreakerState getState() {
        if (state == CircuitBreakerState.OPEN && recoveryElapsed()) {
            return CircuitBreakerState.HALF_OPEN;
        }
        return state;
    }

    @Override
    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    @Override
    public synchronized Duration getRemainingOpenTime() {
        if (state != CircuitBreakerState.OPEN || openedAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = recoveryTimeout.minus(Duration.between(openedAt, clock.instant()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    @Override
    public synchronized void reset() {
        state = CircuitBreakerState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
    }

    /**
     * recoveryTimeout을 "넘긴" 경우에만 경과로 봅니다.
     * recoveryTimeout이 0이어도 OPEN 직후 같은 시각의 호출은 거부됩니다.
     */
    private boolean recoveryElapsed() {
        return openedAt != null
            && clock.instant().isAfter(openedAt.plus(recoveryTimeout));
    }

    @Override
    public String toString() {
        return "ConsecutiveFailureCircuitBreaker{name=" + name + ", state=" + getState()
            + ", consecutiveFailures=" + getConsecutiveFailures() + "}";
    }
}
