package com.ryuqq.relay.core.provider;

import com.ryuqq.relay.core.exception.ProviderDisabledException;
import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.Embedding;
import com.ryuqq.relay.core.model.EmbeddingRequest;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 모든 호출을 즉시 거부하는 Provider.
 *
 * <p>원격 Provider가 비활성화되었거나 구성되지 않았을 때 Factory가 반환합니다.
 * 네트워크 대기 없이 사유를 담은 {@link ProviderDisabledException}으로 빠르게 실패합니다.
 * 생성 시점에는 절대 실패하지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NullProvider implements Provider {

    public static final String NAME = "null";

    private final String reason;
    private final Throwable cause;

    public NullProvider(String reason) {
        this(reason, null);
    }

    /**
     * 생성자.
     *
     * @param reason 비활성화 사유 (null이면 "Provider disabled")
     * @param cause 원인 예외 (예: CredentialException, null 허용)
     */
    public NullProvider(String reason, Throwable cause) {
        this.reason = reason == null || reason.isBlank() ? "Provider disabled" : reason;
        this.cause = cause;
    }

    public String reason() {
        return reason;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String complete(CompletionRequest request) {
        throw completionDisabled();
    }

    @Override
    public CompletableFuture<String> completeAsync(CompletionRequest request) {
        return CompletableFuture.failedFuture(completionDisabled());
    }

    @Override
    public List<Embedding> embed(EmbeddingRequest request) {
        throw embeddingDisabled();
    }

    @Override
    public CompletableFuture<List<Embedding>> embedAsync(EmbeddingRequest request) {
        return CompletableFuture.failedFuture(embeddingDisabled());
    }

    private ProviderDisabledException completionDisabled() {
        return new ProviderDisabledException(NAME,
            "LLM provider is disabled: " + reason + ". Configure an API key or start LM Studio.",
            reason, cause);
    }

    private ProviderDisabledException embeddingDisabled() {
        return new ProviderDisabledException(NAME,
            "Embeddings unavailable because provider is disabled: " + reason + ".",
            reason, cause);
    }

    @Override
    public String toString() {
        return "NullProvider{reason=" + reason + "}";
    }
}
