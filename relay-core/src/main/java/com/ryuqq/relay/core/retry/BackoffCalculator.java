package com.ryuqq.relay.core.retry;

import com.ryuqq.relay.core.config.RetryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 적용하여
 * 동시에 실패한 다수의 호출자가 같은 시각에 재시도하는 것(Thundering Herd)을 방지합니다.
 * 동기/비동기 재시도가 같은 계산기를 공유합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * bound = min(initialDelay * exponentialBase^(attempt-1), maxDelay)
 * jitter 비활성: delay = bound
 * jitter 활성:   delay = bound/2 + random(0, bound/2)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=1s, exponentialBase=2, maxDelay=60s, jitter 비활성):</strong></p>
 * <ul>
 *   <li>attempt=1: 1s</li>
 *   <li>attempt=2: 2s</li>
 *   <li>attempt=3: 4s</li>
 *   <li>attempt=10: 60s (maxDelay로 제한)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    private final long initialDelayNanos;
    private final double exponentialBase;
    private final long maxDelayNanos;
    private final boolean jitter;
    private final DoubleSupplier random;

    /**
     * RetryConfig 기반 생성.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BackoffCalculator(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자 주입 생성 (테스트용).
     *
     * @param config 재시도 설정
     * @param random [0, 1) 난수 공급자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public BackoffCalculator(RetryConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.initialDelayNanos = config.initialDelay().toNanos();
        this.exponentialBase = config.exponentialBase();
        this.maxDelayNanos = config.maxDelay().toNanos();
        this.jitter = config.jitter();
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 재시도 번호 (1부터 시작)
     * @return 재시도 전 대기 시간
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public Duration calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }
        long bound = bound(attempt);
        if (!jitter || bound == 0) {
            return Duration.ofNanos(bound);
        }
        long half = bound / 2;
        return Duration.ofNanos(half + (long) ((bound - half) * random.getAsDouble()));
    }

    /**
     * jitter를 적용하기 전의 상한값.
     *
     * @param attempt 재시도 번호 (1부터 시작)
     * @return 상한 지연 시간 (나노초)
     */
    long bound(int attempt) {
        // double 연산으로 overflow를 피한 뒤 maxDelay로 제한
        double exponential = initialDelayNanos * Math.pow(exponentialBase, attempt - 1);
        if (Double.isInfinite(exponential) || exponential >= maxDelayNanos) {
            return maxDelayNanos;
        }
        return (long) exponential;
    }
}
