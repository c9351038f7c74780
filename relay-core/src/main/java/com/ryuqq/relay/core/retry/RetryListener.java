package com.ryuqq.relay.core.retry;

import java.time.Duration;

/**
 * 재시도 직전에 동기적으로 호출되는 콜백 (telemetry 용도).
 *
 * <p>리스너에서 발생한 예외는 {@link RetryExecutor}가 WARN 로그로 남기고 무시합니다.
 * 계측 코드의 버그가 정상적인 재시도를 막지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * 아무 동작도 하지 않는 리스너.
     */
    RetryListener NONE = (error, attempt, delay) -> { };

    /**
     * 재시도 대기 직전 호출.
     *
     * @param error 재시도를 유발한 예외
     * @param attempt 재시도 번호 (1부터 시작)
     * @param delay 이번 대기 시간
     */
    void onRetry(Throwable error, int attempt, Duration delay);
}
