package com.ryuqq.relay.core.config;

import java.time.Duration;
import java.util.Set;

/**
 * 재시도 설정 (불변 record).
 *
 * <p>Provider 생성 시 고정되며 호출 시점에 {@code RetryExecutor}가 사용합니다.</p>
 *
 * <p><strong>지연 계산:</strong></p>
 * <pre>
 * delay(n) = min(initialDelay * exponentialBase^(n-1), maxDelay)   (n = 1, 2, ...)
 * jitter 활성화 시: [delay/2, delay] 구간에서 균등 분포로 선택
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param maxRetries 최대 재시도 횟수 (0 이상, 0이면 1회만 호출)
 * @param initialDelay 첫 재시도 전 대기 시간 (0 이상)
 * @param exponentialBase 지수 증가 배수 (1보다 커야 함)
 * @param maxDelay 최대 대기 시간 (0 이상)
 * @param jitter 무작위 지연 적용 여부
 * @param retryConditions 재시도 조건 이름 (비어 있으면 제한 없음)
 * @param trackMetrics 재시도 횟수를 metrics에 기록할지 여부
 */
public record RetryConfig(
    int maxRetries,
    Duration initialDelay,
    double exponentialBase,
    Duration maxDelay,
    boolean jitter,
    Set<String> retryConditions,
    boolean trackMetrics
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=3, initialDelay=1s, exponentialBase=2.0, maxDelay=60s,
     * jitter=true, retryConditions=없음, trackMetrics=true</p>
     */
    public RetryConfig() {
        this(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), true, Set.of(), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be >= 0 (current: " + maxRetries + ")"
            );
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException(
                "initialDelay must be >= 0 (current: " + initialDelay + ")"
            );
        }
        if (!(exponentialBase > 1.0)) {
            throw new IllegalArgumentException(
                "exponentialBase must be > 1 (current: " + exponentialBase + ")"
            );
        }
        if (maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException(
                "maxDelay must be >= 0 (current: " + maxDelay + ")"
            );
        }
        retryConditions = retryConditions == null ? Set.of() : Set.copyOf(retryConditions);
    }

    /**
     * 재시도 없는 설정 (1회 호출).
     *
     * @return maxRetries=0 설정
     */
    public static RetryConfig noRetry() {
        return new RetryConfig().withMaxRetries(0);
    }

    public RetryConfig withMaxRetries(int maxRetries) {
        return new RetryConfig(maxRetries, initialDelay, exponentialBase, maxDelay, jitter, retryConditions, trackMetrics);
    }

    public RetryConfig withInitialDelay(Duration initialDelay) {
        return new RetryConfig(maxRetries, initialDelay, exponentialBase, maxDelay, jitter, retryConditions, trackMetrics);
    }

    public RetryConfig withExponentialBase(double exponentialBase) {
        return new RetryConfig(maxRetries, initialDelay, exponentialBase, maxDelay, jitter, retryConditions, trackMetrics);
    }

    public RetryConfig withMaxDelay(Duration maxDelay) {
        return new RetryConfig(maxRetries, initialDelay, exponentialBase, maxDelay, jitter, retryConditions, trackMetrics);
    }

    public RetryConfig withJitter(boolean jitter) {
        return new RetryConfig(maxRetries, initialDelay, exponentialBase, maxDelay, jitter, retryConditions, trackMetrics);
    }

    public RetryConfig withRetryConditions(Set<String> retryConditions) {
        return new RetryConfig(maxRetries, initialDelay, exponentialBase, maxDelay, jitter, retryConditions, trackMetrics);
    }

    public RetryConfig withTrackMetrics(boolean trackMetrics) {
        return new RetryConfig(maxRetries, initialDelay, exponentialBase, maxDelay, jitter, retryConditions, trackMetrics);
    }
}
