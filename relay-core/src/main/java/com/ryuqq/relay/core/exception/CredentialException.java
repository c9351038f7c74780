package com.ryuqq.relay.core.exception;

/**
 * 필수 자격 증명(API key 등) 누락.
 *
 * <p>Factory는 이 예외를 던지지 않고, {@code NullProvider}의 원인으로 담아
 * 호출 시점에 soft failure로 드러냅니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class CredentialException extends ProviderException {

    private final String credentialName;

    /**
     * 생성자.
     *
     * @param providerName Provider 이름
     * @param credentialName 누락된 자격 증명 이름 (예: OPENAI_API_KEY)
     */
    public CredentialException(String providerName, String credentialName) {
        super(providerName, "Missing " + credentialName + " for " + providerName + " provider");
        this.credentialName = credentialName;
    }

    public String getCredentialName() {
        return credentialName;
    }
}
