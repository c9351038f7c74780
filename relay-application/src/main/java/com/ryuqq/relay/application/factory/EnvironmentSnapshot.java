package com.ryuqq.relay.application.factory;

import com.ryuqq.relay.core.model.ProviderType;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Provider 선택에 영향을 주는 환경 변수 스냅샷 (불변 record).
 *
 * <p>Factory는 전역 환경을 직접 읽지 않고 이 스냅샷만 봅니다.
 * 같은 스냅샷과 같은 설정이면 항상 같은 Provider가 선택됩니다.</p>
 *
 * <p><strong>환경 변수:</strong></p>
 * <ul>
 *   <li>{@code RELAY_DISABLE_PROVIDERS}: 모든 Provider 비활성화</li>
 *   <li>{@code RELAY_OFFLINE}: 네트워크 Provider 대신 안전한 기본 Provider 사용</li>
 *   <li>{@code RELAY_SAFE_DEFAULT_PROVIDER}: 안전한 기본 Provider ({@code stub} 또는 {@code null}, 기본 stub)</li>
 *   <li>{@code RELAY_RESOURCE_<TYPE>_AVAILABLE}: 로컬 백엔드(예: LMSTUDIO) 사용 가능 표시</li>
 * </ul>
 *
 * <p>참(truthy) 값: {@code 1, true, yes, on} (대소문자 무시, 앞뒤 공백 무시)</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param variables 환경 변수
 */
public record EnvironmentSnapshot(Map<String, String> variables) {

    public static final String DISABLE_PROVIDERS = "RELAY_DISABLE_PROVIDERS";
    public static final String OFFLINE = "RELAY_OFFLINE";
    public static final String SAFE_DEFAULT_PROVIDER = "RELAY_SAFE_DEFAULT_PROVIDER";

    private static final String DEFAULT_SAFE_PROVIDER = "stub";
    private static final Set<String> TRUTHY = Set.of("1", "true", "yes", "on");

    public EnvironmentSnapshot {
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }

    /**
     * 현재 프로세스 환경 변수로 생성.
     *
     * @return EnvironmentSnapshot
     */
    public static EnvironmentSnapshot capture() {
        return new EnvironmentSnapshot(System.getenv());
    }

    public static EnvironmentSnapshot empty() {
        return new EnvironmentSnapshot(Map.of());
    }

    public static EnvironmentSnapshot of(Map<String, String> variables) {
        return new EnvironmentSnapshot(variables);
    }

    /**
     * 변수 하나를 추가/변경한 새 스냅샷.
     *
     * @param name 변수 이름
     * @param value 값
     * @return 새 EnvironmentSnapshot
     */
    public EnvironmentSnapshot with(String name, String value) {
        Map<String, String> updated = new HashMap<>(variables);
        updated.put(name, value);
        return new EnvironmentSnapshot(updated);
    }

    public boolean providersDisabled() {
        return isTruthy(DISABLE_PROVIDERS);
    }

    public boolean offline() {
        return isTruthy(OFFLINE);
    }

    /**
     * 안전한 기본 Provider 이름.
     *
     * @return 소문자 이름 (기본 stub)
     */
    public String safeDefaultProvider() {
        String value = variables.get(SAFE_DEFAULT_PROVIDER);
        if (value == null || value.isBlank()) {
            return DEFAULT_SAFE_PROVIDER;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 백엔드 사용 가능 표시 여부 ({@code RELAY_RESOURCE_<TYPE>_AVAILABLE}).
     *
     * @param type Provider 유형
     * @return 사용 가능으로 표시되어 있으면 true
     */
    public boolean resourceAvailable(ProviderType type) {
        return isTruthy(resourceFlag(type));
    }

    public static String resourceFlag(ProviderType type) {
        return "RELAY_RESOURCE_" + type.name() + "_AVAILABLE";
    }

    private boolean isTruthy(String name) {
        String value = variables.get(name);
        return value != null && TRUTHY.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        // API key 등 민감한 값이 섞일 수 있으므로 관련 변수만 출력
        Map<String, String> relevant = new HashMap<>();
        variables.forEach((name, value) -> {
            if (name.startsWith("RELAY_")) {
                relevant.put(name, value);
            }
        });
        return "EnvironmentSnapshot" + relevant;
    }
}
