package com.ryuqq.relay.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 횟수가 failureThreshold 도달)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과)
 * HALF_OPEN (시험 호출 1회)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN (recoveryTimeout 다시 시작)
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과, 연속 실패 횟수 추적).
     */
    CLOSED,

    /**
     * 차단 상태 (Provider를 호출하지 않고 즉시 거부).
     */
    OPEN,

    /**
     * 반개방 상태.
     *
     * <p>recoveryTimeout이 지나 단 한 번의 시험 호출을 허용합니다.
     * 시험 호출이 성공하면 CLOSED, 실패하면 다시 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN
}
