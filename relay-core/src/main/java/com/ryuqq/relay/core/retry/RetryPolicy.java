package com.ryuqq.relay.core.retry;

import java.util.List;
import java.util.function.Predicate;

/**
 * 어떤 예외를 재시도할지 결정하는 정책.
 *
 * @author Relay Team
 * @since 1.0.0
 * @param retryableExceptions 재시도 대상 예외 타입 (하위 타입 포함)
 * @param shouldRetry 예외별 추가 판단 (예: HTTP 4xx 제외)
 */
public record RetryPolicy(
    List<Class<? extends Throwable>> retryableExceptions,
    Predicate<Throwable> shouldRetry
) {

    public RetryPolicy {
        if (retryableExceptions == null || retryableExceptions.isEmpty()) {
            throw new IllegalArgumentException("retryableExceptions cannot be null or empty");
        }
        retryableExceptions = List.copyOf(retryableExceptions);
        shouldRetry = shouldRetry == null ? error -> true : shouldRetry;
    }

    /**
     * 모든 RuntimeException을 재시도.
     *
     * @return RetryPolicy
     */
    public static RetryPolicy onAnyFailure() {
        return new RetryPolicy(List.of(RuntimeException.class), null);
    }

    /**
     * 지정한 예외 타입만 재시도.
     *
     * @param retryableExceptions 재시도 대상 예외 타입
     * @return RetryPolicy
     */
    @SafeVarargs
    public static RetryPolicy on(Class<? extends Throwable>... retryableExceptions) {
        return new RetryPolicy(List.of(retryableExceptions), null);
    }

    public RetryPolicy withShouldRetry(Predicate<Throwable> shouldRetry) {
        return new RetryPolicy(retryableExceptions, shouldRetry);
    }

    /**
     * 예외가 이 정책상 재시도 대상인지 확인.
     *
     * @param error 발생한 예외
     * @return 재시도 대상이면 true
     */
    public boolean matches(Throwable error) {
        for (Class<? extends Throwable> type : retryableExceptions) {
            if (type.isInstance(error)) {
                return shouldRetry.test(error);
            }
        }
        return false;
    }
}
