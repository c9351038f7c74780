package com.ryuqq.relay.core.tls;

/**
 * Provider가 사용하는 TLS 설정 (불변 record).
 *
 * @author Relay Team
 * @since 1.0.0
 * @param verify 서버 인증서 검증 여부 (기본 true)
 * @param certFile 클라이언트 인증서 경로 (null 허용)
 * @param keyFile 클라이언트 개인 키 경로 (null 허용)
 * @param caFile 신뢰할 CA 인증서 경로 (null 허용)
 */
public record TlsConfig(
    boolean verify,
    String certFile,
    String keyFile,
    String caFile
) {

    /**
     * 기본 설정 생성자 (검증 활성화, 추가 인증서 없음).
     */
    public TlsConfig() {
        this(true, null, null, null);
    }

    /**
     * 클라이언트 인증서(mTLS)를 사용하는지 여부.
     *
     * @return certFile이 지정되어 있으면 true
     */
    public boolean hasClientCertificate() {
        return certFile != null;
    }
}
