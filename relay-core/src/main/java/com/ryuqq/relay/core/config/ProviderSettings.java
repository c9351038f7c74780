package com.ryuqq.relay.core.config;

import com.ryuqq.relay.core.model.ProviderType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Provider 구성 스냅샷 (불변 record).
 *
 * <p>Factory가 Provider를 결정할 때 한 번 읽습니다. 파일/환경 변수에서 읽어 오는 일은
 * 이 타입의 책임이 아니며, 중첩 Map 형태는 {@link ProviderSettingsMapper}로 변환합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param defaultProvider 명시적 요청이 없을 때 사용할 Provider 식별자
 * @param backends 백엔드별 설정 (없는 항목은 {@link BackendConfig#defaultsFor}로 채움)
 * @param retry 재시도 설정
 * @param fallback Fallback 체인 설정
 * @param circuitBreaker Circuit Breaker 설정
 * @param tls 원시 TLS 설정
 */
public record ProviderSettings(
    String defaultProvider,
    Map<ProviderType, BackendConfig> backends,
    RetryConfig retry,
    FallbackConfig fallback,
    CircuitBreakerConfig circuitBreaker,
    TlsSettings tls
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultProvider=openai, 백엔드 기본값, 기본 retry/fallback/circuit breaker, TLS 미지정</p>
     */
    public ProviderSettings() {
        this("openai", Map.of(), new RetryConfig(), new FallbackConfig(), new CircuitBreakerConfig(), new TlsSettings());
    }

    public ProviderSettings {
        if (defaultProvider == null || defaultProvider.isBlank()) {
            throw new IllegalArgumentException("defaultProvider cannot be null or blank");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (tls == null) {
            throw new IllegalArgumentException("tls cannot be null");
        }
        Map<ProviderType, BackendConfig> merged = new EnumMap<>(ProviderType.class);
        for (ProviderType type : ProviderType.values()) {
            merged.put(type, BackendConfig.defaultsFor(type));
        }
        if (backends != null) {
            merged.putAll(backends);
        }
        backends = Map.copyOf(merged);
    }

    /**
     * 백엔드 설정 조회.
     *
     * @param type Provider 유형
     * @return BackendConfig (항상 존재)
     */
    public BackendConfig backend(ProviderType type) {
        return backends.get(type);
    }

    public ProviderSettings withDefaultProvider(String defaultProvider) {
        return new ProviderSettings(defaultProvider, backends, retry, fallback, circuitBreaker, tls);
    }

    /**
     * 백엔드 하나만 변경한 새 인스턴스 생성.
     */
    public ProviderSettings withBackend(ProviderType type, BackendConfig backend) {
        Map<ProviderType, BackendConfig> updated = new EnumMap<>(backends);
        updated.put(type, backend);
        return new ProviderSettings(defaultProvider, updated, retry, fallback, circuitBreaker, tls);
    }

    public ProviderSettings withRetry(RetryConfig retry) {
        return new ProviderSettings(defaultProvider, backends, retry, fallback, circuitBreaker, tls);
    }

    public ProviderSettings withFallback(FallbackConfig fallback) {
        return new ProviderSettings(defaultProvider, backends, retry, fallback, circuitBreaker, tls);
    }

    public ProviderSettings withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new ProviderSettings(defaultProvider, backends, retry, fallback, circuitBreaker, tls);
    }

    public ProviderSettings withTls(TlsSettings tls) {
        return new ProviderSettings(defaultProvider, backends, retry, fallback, circuitBreaker, tls);
    }
}
