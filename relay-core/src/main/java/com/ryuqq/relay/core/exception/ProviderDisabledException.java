package com.ryuqq.relay.core.exception;

/**
 * 비활성화된 Provider에 대한 호출.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ProviderDisabledException extends ProviderException {

    private final String reason;

    public ProviderDisabledException(String providerName, String message, String reason, Throwable cause) {
        super(providerName, message, cause);
        this.reason = reason;
    }

    /**
     * 비활성화 사유.
     *
     * @return 사유 문자열
     */
    public String getReason() {
        return reason;
    }
}
