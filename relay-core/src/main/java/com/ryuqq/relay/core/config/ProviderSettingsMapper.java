package com.ryuqq.relay.core.config;

import com.ryuqq.relay.core.exception.ConfigurationException;
import com.ryuqq.relay.core.model.ProviderType;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 중첩 Map 형태의 구성을 {@link ProviderSettings}로 변환합니다.
 *
 * <p><strong>지원 키:</strong></p>
 * <pre>
 * default_provider: openai
 * openai / lmstudio / openrouter:
 *   api_key, model, embedding_model, base_url (또는 endpoint), connect_timeout, request_timeout
 * retry:
 *   max_retries, initial_delay, exponential_base, max_delay, jitter, track_metrics, conditions
 * fallback:
 *   enabled, order
 * circuit_breaker:
 *   enabled, failure_threshold, recovery_timeout
 * tls:
 *   verify, cert_file, key_file, ca_file
 * </pre>
 *
 * <p>시간 값은 초 단위 숫자, 목록 값은 List 또는 쉼표로 구분한 문자열입니다.
 * 없는 키는 각 record의 기본값을 사용합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ProviderSettingsMapper {

    private ProviderSettingsMapper() {
    }

    /**
     * 중첩 Map을 ProviderSettings로 변환.
     *
     * @param source 구성 Map (null이면 기본 설정)
     * @return ProviderSettings
     * @throws ConfigurationException 값의 타입이나 범위가 잘못된 경우
     */
    public static ProviderSettings fromMap(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return new ProviderSettings();
        }
        ProviderSettings defaults = new ProviderSettings();
        try {
            String defaultProvider = string(source, "default_provider", defaults.defaultProvider());

            Map<ProviderType, BackendConfig> backends = new EnumMap<>(ProviderType.class);
            for (ProviderType type : ProviderType.values()) {
                if (type.isNetwork()) {
                    backends.put(type, backend(section(source, type.id()), BackendConfig.defaultsFor(type)));
                }
            }

            return new ProviderSettings(
                defaultProvider,
                backends,
                retry(section(source, "retry"), defaults.retry()),
                fallback(section(source, "fallback"), defaults.fallback()),
                circuitBreaker(section(source, "circuit_breaker"), defaults.circuitBreaker()),
                tls(section(source, "tls"))
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(null, "Invalid provider configuration: " + e.getMessage(), e);
        }
    }

    private static BackendConfig backend(Map<String, ?> section, BackendConfig defaults) {
        String endpoint = string(section, "base_url", string(section, "endpoint", defaults.endpoint().toString()));
        return new BackendConfig(
            string(section, "api_key", defaults.apiKey()),
            string(section, "model", defaults.model()),
            string(section, "embedding_model", defaults.embeddingModel()),
            URI.create(stripTrailingSlash(endpoint)),
            seconds(section, "connect_timeout", defaults.connectTimeout()),
            seconds(section, "request_timeout", defaults.requestTimeout())
        );
    }

    private static RetryConfig retry(Map<String, ?> section, RetryConfig defaults) {
        return new RetryConfig(
            integer(section, "max_retries", defaults.maxRetries()),
            seconds(section, "initial_delay", defaults.initialDelay()),
            number(section, "exponential_base", defaults.exponentialBase()),
            seconds(section, "max_delay", defaults.maxDelay()),
            bool(section, "jitter", defaults.jitter()),
            new LinkedHashSet<>(list(section, "conditions", List.copyOf(defaults.retryConditions()))),
            bool(section, "track_metrics", defaults.trackMetrics())
        );
    }

    private static FallbackConfig fallback(Map<String, ?> section, FallbackConfig defaults) {
        return new FallbackConfig(
            bool(section, "enabled", defaults.enabled()),
            list(section, "order", defaults.order())
        );
    }

    private static CircuitBreakerConfig circuitBreaker(Map<String, ?> section, CircuitBreakerConfig defaults) {
        return new CircuitBreakerConfig(
            bool(section, "enabled", defaults.enabled()),
            integer(section, "failure_threshold", defaults.failureThreshold()),
            seconds(section, "recovery_timeout", defaults.recoveryTimeout())
        );
    }

    private static TlsSettings tls(Map<String, ?> section) {
        Object verify = section.get("verify");
        return new TlsSettings(
            verify == null ? null : toBoolean("tls.verify", verify),
            string(section, "cert_file", null),
            string(section, "key_file", null),
            string(section, "ca_file", null)
        );
    }

    private static Map<String, ?> section(Map<String, ?> source, String key) {
        Object value = source.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(key + " must be a mapping (current: " + value + ")");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }

    private static String string(Map<String, ?> section, String key, String defaultValue) {
        Object value = section.get(key);
        if (value == null) {
            return defaultValue;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? defaultValue : text;
    }

    private static int integer(Map<String, ?> section, String key, int defaultValue) {
        Object value = section.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static double number(Map<String, ?> section, String key, double defaultValue) {
        Object value = section.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number (current: " + value + ")", e);
        }
    }

    private static Duration seconds(Map<String, ?> section, String key, Duration defaultValue) {
        if (section.get(key) == null) {
            return defaultValue;
        }
        double seconds = number(section, key, 0.0);
        if (seconds < 0) {
            throw new IllegalArgumentException(key + " must be >= 0 (current: " + seconds + ")");
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }

    private static boolean bool(Map<String, ?> section, String key, boolean defaultValue) {
        Object value = section.get(key);
        return value == null ? defaultValue : toBoolean(key, value);
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if (Set.of("1", "true", "yes", "on").contains(text)) {
            return true;
        }
        if (Set.of("0", "false", "no", "off").contains(text)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be a boolean (current: " + value + ")");
    }

    private static List<String> list(Map<String, ?> section, String key, List<String> defaultValue) {
        Object value = section.get(key);
        if (value == null) {
            return defaultValue;
        }
        Collection<?> items = value instanceof Collection
            ? (Collection<?>) value
            : Arrays.asList(value.toString().split(","));
        List<String> result = new ArrayList<>();
        for (Object item : items) {
            String text = item == null ? "" : item.toString().trim();
            if (!text.isEmpty()) {
                result.add(text);
            }
        }
        return result;
    }

    private static String stripTrailingSlash(String endpoint) {
        String result = endpoint;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
