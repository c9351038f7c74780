/**
 * Provider 작업 진입점 패키지.
 *
 * <p>{@link com.ryuqq.relay.application.operations.ProviderOperations}는 호출마다 Provider를 해석하고
 * 실패를 작업별 카운터로 기록합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.application.operations;
