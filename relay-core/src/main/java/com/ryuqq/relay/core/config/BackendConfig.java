package com.ryuqq.relay.core.config;

import com.ryuqq.relay.core.model.ProviderType;

import java.net.URI;
import java.time.Duration;

/**
 * 백엔드별 설정 (불변 record).
 *
 * <p>Provider 생성 시 한 번 읽고 이후 변경하지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param apiKey API key (null 허용)
 * @param model 기본 생성 모델 ID
 * @param embeddingModel 임베딩 모델 ID
 * @param endpoint API base URL
 * @param connectTimeout 연결 타임아웃
 * @param requestTimeout 요청 타임아웃
 */
public record BackendConfig(
    String apiKey,
    String model,
    String embeddingModel,
    URI endpoint,
    Duration connectTimeout,
    Duration requestTimeout
) {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

    public BackendConfig {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model cannot be null or blank");
        }
        if (embeddingModel == null || embeddingModel.isBlank()) {
            throw new IllegalArgumentException("embeddingModel cannot be null or blank");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException(
                "connectTimeout must be positive (current: " + connectTimeout + ")"
            );
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException(
                "requestTimeout must be positive (current: " + requestTimeout + ")"
            );
        }
    }

    /**
     * Provider 유형별 기본 설정.
     *
     * @param type Provider 유형
     * @return 기본 BackendConfig (API key 없음)
     */
    public static BackendConfig defaultsFor(ProviderType type) {
        return switch (type) {
            case OPENAI -> new BackendConfig(null, "gpt-4", "text-embedding-3-small",
                URI.create("https://api.openai.com/v1"), DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
            case LMSTUDIO -> new BackendConfig(null, "default", "default",
                URI.create("http://127.0.0.1:1234/v1"), DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
            case OPENROUTER -> new BackendConfig(null, "openrouter/auto", "openai/text-embedding-3-small",
                URI.create("https://openrouter.ai/api/v1"), DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
            case STUB -> new BackendConfig(null, "stub-llm", "stub-embedding",
                URI.create("stub:local"), DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
        };
    }

    /**
     * API key 설정 여부.
     *
     * @return 공백이 아닌 API key가 있으면 true
     */
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public BackendConfig withApiKey(String apiKey) {
        return new BackendConfig(apiKey, model, embeddingModel, endpoint, connectTimeout, requestTimeout);
    }

    public BackendConfig withModel(String model) {
        return new BackendConfig(apiKey, model, embeddingModel, endpoint, connectTimeout, requestTimeout);
    }

    public BackendConfig withEmbeddingModel(String embeddingModel) {
        return new BackendConfig(apiKey, model, embeddingModel, endpoint, connectTimeout, requestTimeout);
    }

    public BackendConfig withEndpoint(URI endpoint) {
        return new BackendConfig(apiKey, model, embeddingModel, endpoint, connectTimeout, requestTimeout);
    }

    public BackendConfig withConnectTimeout(Duration connectTimeout) {
        return new BackendConfig(apiKey, model, embeddingModel, endpoint, connectTimeout, requestTimeout);
    }

    public BackendConfig withRequestTimeout(Duration requestTimeout) {
        return new BackendConfig(apiKey, model, embeddingModel, endpoint, connectTimeout, requestTimeout);
    }

    /**
     * API key를 가린 문자열 표현.
     */
    @Override
    public String toString() {
        return "BackendConfig[apiKey=" + (hasApiKey() ? "****" : "none")
            + ", model=" + model
            + ", embeddingModel=" + embeddingModel
            + ", endpoint=" + endpoint
            + ", connectTimeout=" + connectTimeout
            + ", requestTimeout=" + requestTimeout + "]";
    }
}
