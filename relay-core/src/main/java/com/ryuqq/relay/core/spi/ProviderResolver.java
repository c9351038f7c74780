package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.provider.Provider;

/**
 * Provider 식별자를 Provider 인스턴스로 해석하는 SPI.
 *
 * <p>Fallback Provider는 구성된 순서의 식별자를 이 SPI로 해석합니다.
 * 애플리케이션 계층의 Factory가 구현합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProviderResolver {

    /**
     * 식별자에 해당하는 Provider 생성.
     *
     * @param providerId Provider 식별자 (예: openai, lmstudio)
     * @return Provider
     * @throws com.ryuqq.relay.core.exception.ProviderException 생성할 수 없는 경우
     */
    Provider resolve(String providerId);
}
