package com.ryuqq.relay.core.config;

/**
 * 구성에서 읽은 원시 TLS 설정.
 *
 * <p>모든 필드는 null 허용이며, 설정되지 않은 값은
 * {@link com.ryuqq.relay.core.tls.TlsConfigResolver}가 안전한 기본값으로 채웁니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param verify 서버 인증서 검증 여부
 * @param certFile 클라이언트 인증서 (PEM)
 * @param keyFile 클라이언트 개인 키 (PKCS#8 PEM)
 * @param caFile 신뢰할 CA 인증서 (PEM)
 */
public record TlsSettings(
    Boolean verify,
    String certFile,
    String keyFile,
    String caFile
) {

    /**
     * 아무 것도 지정하지 않은 설정.
     */
    public TlsSettings() {
        this(null, null, null, null);
    }
}
