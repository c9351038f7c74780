package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.config.BackendConfig;
import com.ryuqq.relay.core.config.RetryConfig;
import com.ryuqq.relay.core.tls.TlsConfig;

/**
 * 네트워크 Provider 생성 재료.
 *
 * <p>생성 시점에 고정되며 Provider 수명 동안 바뀌지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param backend 백엔드 설정 (endpoint, 모델, API key, 타임아웃)
 * @param tls TLS 설정
 * @param retry 재시도 설정
 * @param metrics 재시도 지표 싱크
 */
public record NetworkProviderSpec(
    BackendConfig backend,
    TlsConfig tls,
    RetryConfig retry,
    ProviderMetrics metrics
) {

    public NetworkProviderSpec {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (tls == null) {
            throw new IllegalArgumentException("tls cannot be null");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
    }
}
