package com.ryuqq.relay.application.factory;

import com.ryuqq.relay.core.config.ProviderSettings;

/**
 * Provider 선택 입력값 (설정 + 환경 스냅샷).
 *
 * <p>호출마다 새로 만들어 Factory에 전달합니다. 전역 상태를 캐시하지 않으므로
 * 환경 변수 변경은 다음 해석부터 반영됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param settings Provider 설정
 * @param environment 환경 변수 스냅샷
 */
public record ResolutionContext(ProviderSettings settings, EnvironmentSnapshot environment) {

    public ResolutionContext {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
    }

    /**
     * 현재 프로세스 환경으로 생성.
     *
     * @param settings Provider 설정
     * @return ResolutionContext
     */
    public static ResolutionContext capture(ProviderSettings settings) {
        return new ResolutionContext(settings, EnvironmentSnapshot.capture());
    }
}
