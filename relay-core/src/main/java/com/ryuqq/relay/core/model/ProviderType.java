package com.ryuqq.relay.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 지원하는 Provider 유형.
 *
 * <p>구성과 환경 변수에서는 소문자 식별자({@link #id()})로 참조합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum ProviderType {

    OPENAI("openai", true),
    LMSTUDIO("lmstudio", false),
    OPENROUTER("openrouter", true),

    /**
     * 네트워크를 사용하지 않는 결정적 Provider.
     */
    STUB("stub", false);

    private final String id;
    private final boolean requiresApiKey;

    ProviderType(String id, boolean requiresApiKey) {
        this.id = id;
        this.requiresApiKey = requiresApiKey;
    }

    public String id() {
        return id;
    }

    /**
     * API key가 있어야 생성할 수 있는지 여부.
     *
     * @return API key 필수 여부
     */
    public boolean requiresApiKey() {
        return requiresApiKey;
    }

    /**
     * 네트워크 호출을 수행하는 유형인지 여부.
     *
     * @return STUB이 아니면 true
     */
    public boolean isNetwork() {
        return this != STUB;
    }

    /**
     * 식별자로 조회 (대소문자, 앞뒤 공백 무시).
     *
     * @param value 식별자
     * @return ProviderType, 알 수 없는 값이면 empty
     */
    public static Optional<ProviderType> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
