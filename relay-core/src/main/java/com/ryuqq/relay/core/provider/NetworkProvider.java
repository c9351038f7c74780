package com.ryuqq.relay.core.provider;

import com.ryuqq.relay.core.config.BackendConfig;
import com.ryuqq.relay.core.config.RetryConfig;
import com.ryuqq.relay.core.exception.TransientProviderException;
import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.Embedding;
import com.ryuqq.relay.core.model.EmbeddingRequest;
import com.ryuqq.relay.core.retry.BackoffCalculator;
import com.ryuqq.relay.core.retry.RetryExecutor;
import com.ryuqq.relay.core.retry.RetryPolicy;
import com.ryuqq.relay.core.retry.RetryWaiter;
import com.ryuqq.relay.core.retry.SystemRetryWaiter;
import com.ryuqq.relay.core.spi.NetworkProviderSpec;
import com.ryuqq.relay.core.tls.TlsConfig;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 원격 백엔드 Provider의 공통 기반.
 *
 * <p>모든 공개 호출을 {@link RetryExecutor}로 감쌉니다. 하위 클래스는 재시도 없는
 * 단일 호출({@code doComplete}, {@code doEmbed} 등)만 구현합니다.</p>
 *
 * <p><strong>재시도 대상:</strong> {@link TransientProviderException}
 * (타임아웃, 연결 실패, Rate Limit, 서버 오류). 그 외 예외는 즉시 전파됩니다.</p>
 *
 * <p>백엔드/TLS/재시도 설정은 생성 시 고정되며 이후 바뀌지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public abstract non-sealed class NetworkProvider implements Provider {

    private static final RetryPolicy TRANSIENT_ONLY = RetryPolicy.on(TransientProviderException.class);

    /**
     * 재시도 1회를 기록하는 카운터 이름.
     */
    public static final String RETRY_COUNTER = "retry";

    private final String name;
    private final NetworkProviderSpec spec;
    private final RetryExecutor retry;

    /**
     * 생성자.
     *
     * @param name Provider 이름
     * @param spec 생성 재료
     */
    protected NetworkProvider(String name, NetworkProviderSpec spec) {
        this(name, spec, SystemRetryWaiter.INSTANCE);
    }

    /**
     * 대기 방식 주입 생성자 (테스트용).
     *
     * @param name Provider 이름
     * @param spec 생성 재료
     * @param waiter 재시도 대기 방식
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    protected NetworkProvider(String name, NetworkProviderSpec spec, RetryWaiter waiter) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        this.name = name;
        this.spec = spec;
        this.retry = new RetryExecutor(spec.retry(), this::onRetry, waiter, new BackoffCalculator(spec.retry()));
    }

    @Override
    public final String name() {
        return name;
    }

    public final BackendConfig backend() {
        return spec.backend();
    }

    public final TlsConfig tls() {
        return spec.tls();
    }

    public final RetryConfig retryConfig() {
        return spec.retry();
    }

    @Override
    public final String complete(CompletionRequest request) {
        requireRequest(request);
        return retry.call(() -> doComplete(request), retryPolicy());
    }

    @Override
    public final CompletableFuture<String> completeAsync(CompletionRequest request) {
        requireRequest(request);
        return retry.callAsync(() -> doCompleteAsync(request), retryPolicy());
    }

    @Override
    public final List<Embedding> embed(EmbeddingRequest request) {
        requireRequest(request);
        return retry.call(() -> doEmbed(request), retryPolicy());
    }

    @Override
    public final CompletableFuture<List<Embedding>> embedAsync(EmbeddingRequest request) {
        requireRequest(request);
        return retry.callAsync(() -> doEmbedAsync(request), retryPolicy());
    }

    /**
     * 재시도 정책.
     *
     * @return 기본값: TransientProviderException만 재시도
     */
    protected RetryPolicy retryPolicy() {
        return TRANSIENT_ONLY;
    }

    protected abstract String doComplete(CompletionRequest request);

    protected abstract CompletableFuture<String> doCompleteAsync(CompletionRequest request);

    protected abstract List<Embedding> doEmbed(EmbeddingRequest request);

    protected abstract CompletableFuture<List<Embedding>> doEmbedAsync(EmbeddingRequest request);

    private void onRetry(Throwable error, int attempt, Duration delay) {
        if (spec.retry().trackMetrics()) {
            spec.metrics().increment(RETRY_COUNTER);
        }
    }

    private static void requireRequest(Object request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", endpoint=" + spec.backend().endpoint() + "}";
    }
}
