package com.ryuqq.relay.core.tls;

import com.ryuqq.relay.core.config.TlsSettings;

/**
 * 구성값으로부터 {@link TlsConfig}를 만드는 순수 함수.
 *
 * <p>지정되지 않은 값은 안전한 기본값(verify=true, 추가 인증서 없음)으로 채우고,
 * 지정된 값은 그대로 전달합니다. 파일 존재 여부는 확인하지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class TlsConfigResolver {

    private TlsConfigResolver() {
    }

    /**
     * TLS 설정 결정.
     *
     * @param settings 원시 TLS 설정 (null이면 기본값)
     * @return TlsConfig
     */
    public static TlsConfig resolve(TlsSettings settings) {
        if (settings == null) {
            return new TlsConfig();
        }
        return new TlsConfig(
            settings.verify() == null || settings.verify(),
            settings.certFile(),
            settings.keyFile(),
            settings.caFile()
        );
    }
}
