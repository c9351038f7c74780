package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.model.ProviderType;
import com.ryuqq.relay.core.provider.NetworkProvider;

/**
 * 네트워크 Provider 생성 SPI.
 *
 * <p>벤더 전송 계층(HTTP 클라이언트, 직렬화)은 어댑터 모듈이 제공합니다.
 * Factory는 이 SPI만 알고 구체 전송 구현에 의존하지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface NetworkProviderBuilder {

    /**
     * 네트워크 Provider 생성.
     *
     * <p>생성 중 네트워크 호출을 하지 않습니다.</p>
     *
     * @param type 네트워크 백엔드 유형 ({@link ProviderType#isNetwork()}가 true)
     * @param spec 생성 재료
     * @return NetworkProvider
     * @throws com.ryuqq.relay.core.exception.ConfigurationException 필수 전송 계층을 만들 수 없는 경우
     */
    NetworkProvider build(ProviderType type, NetworkProviderSpec spec);
}
