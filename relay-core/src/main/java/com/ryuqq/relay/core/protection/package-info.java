/**
 * Protection 패키지.
 *
 * <p>Fallback Provider가 감싸는 Provider마다 하나씩 두는 Circuit Breaker를 정의합니다.
 * 장애가 난 백엔드를 빠르게 건너뛰어 호출자가 재시도 지연을 모두 기다리지 않게 합니다.</p>
 *
 * <h2>구현</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.protection.ConsecutiveFailureCircuitBreaker}: 연속 실패 횟수 기반 (기본)</li>
 *   <li>{@link com.ryuqq.relay.core.protection.noop.NoOpCircuitBreaker}: Circuit Breaker 비활성화 시 통과 구현</li>
 * </ul>
 *
 * <h2>동기/비동기 사용</h2>
 * <pre>{@code
 * // 동기: call()이 tryAcquire/recordSuccess/recordFailure를 대신 호출
 * String text = breaker.call(() -> provider.complete(request));
 *
 * // 비동기: 수동 시퀀스, 취소 시 releasePermit()
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 * @see com.ryuqq.relay.core.protection.CircuitBreaker
 * @see com.ryuqq.relay.core.protection.noop
 */
package com.ryuqq.relay.core.protection;
