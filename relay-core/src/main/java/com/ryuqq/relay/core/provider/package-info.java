/**
 * Provider 패키지.
 *
 * <p>텍스트 생성/임베딩 능력을 추상화하는 sealed {@link com.ryuqq.relay.core.provider.Provider}와
 * 그 구현 네 가지를 정의합니다.</p>
 *
 * <h2>호출 흐름</h2>
 * <pre>
 * FallbackProvider
 *   └─ for each (Provider, CircuitBreaker)
 *        CircuitBreaker.tryAcquire()
 *          └─ NetworkProvider.complete()
 *               └─ RetryExecutor (지수 백오프)
 *                    └─ doComplete() (단일 HTTP 호출)
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.provider;
