package com.ryuqq.relay.core.config;

import java.util.List;

/**
 * Fallback 체인 설정 (불변 record).
 *
 * @author Relay Team
 * @since 1.0.0
 * @param enabled false면 체인의 첫 번째 Provider만 사용
 * @param order 시도 순서 (Provider 식별자 목록)
 */
public record FallbackConfig(
    boolean enabled,
    List<String> order
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: enabled=true, order=[openai, lmstudio]</p>
     */
    public FallbackConfig() {
        this(true, List.of("openai", "lmstudio"));
    }

    public FallbackConfig {
        order = order == null ? List.of() : List.copyOf(order);
    }

    public FallbackConfig withEnabled(boolean enabled) {
        return new FallbackConfig(enabled, order);
    }

    public FallbackConfig withOrder(List<String> order) {
        return new FallbackConfig(enabled, order);
    }
}
