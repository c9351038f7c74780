/**
 * SPI (Service Provider Interface) 패키지.
 *
 * <p>Core가 외부에 요구하는 확장점을 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.spi.NetworkProviderBuilder}: 벤더 전송 계층 (adapter-http)</li>
 *   <li>{@link com.ryuqq.relay.core.spi.ProviderResolver}: 식별자 → Provider (application Factory)</li>
 *   <li>{@link com.ryuqq.relay.core.spi.ProviderMetrics}: 카운터 싱크 (adapter-inmemory, noop)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.spi;
