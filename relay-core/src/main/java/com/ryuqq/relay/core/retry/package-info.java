/**
 * 재시도 패키지.
 *
 * <p>모든 Provider 호출을 감싸는 지수 백오프 재시도를 제공합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.retry.BackoffCalculator}: 지연 시간 계산 (jitter 포함)</li>
 *   <li>{@link com.ryuqq.relay.core.retry.RetryPolicy}: 재시도 대상 예외 판단</li>
 *   <li>{@link com.ryuqq.relay.core.retry.RetryExecutor}: 동기/비동기 재시도 루프</li>
 *   <li>{@link com.ryuqq.relay.core.retry.RetryWaiter}: 대기 방식 (테스트에서 교체 가능)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.retry;
