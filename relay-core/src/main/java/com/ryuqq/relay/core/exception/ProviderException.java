package com.ryuqq.relay.core.exception;

/**
 * Provider 계층의 최상위 예외.
 *
 * <p>호출자는 어떤 백엔드가 실패했는지와 무관하게 이 타입 하나만 처리하면 됩니다.
 * 원인 예외는 {@link #getCause()} 체인으로 보존됩니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link ConfigurationException}: 구성 오류 (재시도 불가, 즉시 실패)</li>
 *   <li>{@link CredentialException}: 자격 증명 누락</li>
 *   <li>{@link ProviderDisabledException}: 비활성화된 Provider 호출</li>
 *   <li>{@link TransientProviderException}: 일시적 실패 (재시도 대상)</li>
 *   <li>{@link CircuitOpenException}: Circuit Breaker 차단</li>
 *   <li>{@link ProvidersExhaustedException}: Fallback 후보 전부 실패</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ProviderException extends RuntimeException {

    private final String providerName;

    /**
     * 생성자.
     *
     * @param providerName 실패를 보고한 Provider 이름 (null 허용)
     * @param message 오류 메시지
     */
    public ProviderException(String providerName, String message) {
        super(message);
        this.providerName = providerName;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param providerName 실패를 보고한 Provider 이름 (null 허용)
     * @param message 오류 메시지
     * @param cause 원인 예외
     */
    public ProviderException(String providerName, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    /**
     * 실패를 보고한 Provider 이름.
     *
     * @return Provider 이름, 특정 Provider와 무관한 실패면 null
     */
    public String getProviderName() {
        return providerName;
    }
}
