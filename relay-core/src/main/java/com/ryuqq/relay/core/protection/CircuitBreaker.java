package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.exception.CircuitOpenException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Circuit Breaker.
 *
 * <p>Provider 하나의 연속 실패를 추적하고, 임계값에 도달하면 빠르게 실패(Fail-Fast)하여
 * Fallback 체인이 다음 후보로 넘어가도록 합니다.
 * Fallback Provider 하나가 감싸는 Provider마다 하나씩 존재합니다.</p>
 *
 * <p><strong>사용 예시 (수동 시퀀스, 비동기 경로):</strong></p>
 * <pre>{@code
 * if (!cb.tryAcquire()) {
 *     // OPEN: Provider를 호출하지 않고 다음 후보로
 *     return skip();
 * }
 *
 * provider.completeAsync(request).whenComplete((result, error) -> {
 *     if (error == null) {
 *         cb.recordSuccess();
 *     } else if (error instanceof CancellationException) {
 *         cb.releasePermit();
 *     } else {
 *         cb.recordFailure(error);
 *     }
 * });
 * }</pre>
 *
 * <p>동기 경로는 {@link #call(Supplier)}을 사용합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 보호 대상 이름 (Provider 이름).
     *
     * @return 이름
     */
    String getName();

    /**
     * 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN (recoveryTimeout 미경과): false</li>
     *   <li>HALF_OPEN: 시험 호출 1건만 true</li>
     * </ul>
     *
     * @return true: 통과 허용, false: 차단
     */
    boolean tryAcquire();

    /**
     * 실행 성공 기록 (CLOSED로 리셋).
     */
    void recordSuccess();

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 횟수 증가, 임계값 도달 시 OPEN</li>
     *   <li>HALF_OPEN: 즉시 OPEN (recoveryTimeout 다시 시작)</li>
     * </ul>
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 성공/실패를 기록하지 않고 획득한 통과 권한을 반환.
     *
     * <p>취소된 호출은 Provider 상태에 대해 아무것도 알려주지 않으므로 카운터를 건드리지 않습니다.
     * HALF_OPEN 시험 슬롯만 다시 비웁니다.</p>
     */
    void releasePermit();

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 연속 실패 횟수.
     *
     * @return 마지막 성공 이후 연속 실패 횟수
     */
    int getConsecutiveFailures();

    /**
     * OPEN 상태에서 시험 호출이 허용되기까지 남은 시간.
     *
     * <p>시험 호출은 남은 시간이 0이 된 뒤 시계가 한 번 더 흘러야 허용됩니다.</p>
     *
     * @return 남은 시간, OPEN이 아니면 {@link Duration#ZERO}
     */
    Duration getRemainingOpenTime();

    /**
     * CLOSED 상태로 강제 리셋 (수동 복구/테스트용).
     */
    void reset();

    /**
     * Circuit Breaker를 거쳐 작업 실행.
     *
     * @param <T> 결과 타입
     * @param supplier 보호 대상 작업
     * @return 작업 결과
     * @throws CircuitOpenException 차단 상태라 작업을 호출하지 않은 경우
     * @throws RuntimeException 작업이 던진 예외 (실패로 기록한 뒤 그대로 전파)
     */
    default <T> T call(Supplier<T> supplier) {
        if (!tryAcquire()) {
            throw new CircuitOpenException(getName(), getRemainingOpenTime());
        }
        T result;
        try {
            result = supplier.get();
        } catch (RuntimeException | Error e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }
}
