package com.ryuqq.relay.core.exception;

/**
 * 구성 오류.
 *
 * <p>필수 전송 계층(TLS 컨텍스트, 키 자료, HTTP 클라이언트)을 만들 수 없거나
 * Fallback 체인이 비어 있는 경우 생성 시점에 즉시 발생합니다. 재시도하지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ConfigurationException extends ProviderException {

    public ConfigurationException(String providerName, String message) {
        super(providerName, message);
    }

    public ConfigurationException(String providerName, String message, Throwable cause) {
        super(providerName, message, cause);
    }
}
