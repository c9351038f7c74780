/**
 * Provider Factory 패키지.
 *
 * <p>설정({@link com.ryuqq.relay.core.config.ProviderSettings})과 환경 스냅샷
 * ({@link com.ryuqq.relay.application.factory.EnvironmentSnapshot})을 묶은
 * {@link com.ryuqq.relay.application.factory.ResolutionContext}로부터 구체 Provider를 선택합니다.</p>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>명시적 입력:</strong> 전역 환경을 숨은 상태로 읽지 않고 스냅샷을 전달받음</li>
 *   <li><strong>의존성 역전:</strong> 네트워크 Provider는 {@link com.ryuqq.relay.core.spi.NetworkProviderBuilder} SPI로 생성</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.application.factory;
