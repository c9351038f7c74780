package com.ryuqq.relay.application.operations;

import com.ryuqq.relay.application.factory.ProviderFactory;
import com.ryuqq.relay.application.factory.ResolutionContext;
import com.ryuqq.relay.core.exception.ProviderException;
import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.Embedding;
import com.ryuqq.relay.core.model.EmbeddingRequest;
import com.ryuqq.relay.core.provider.Provider;
import com.ryuqq.relay.core.spi.ProviderMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Provider 계층의 진입점 (complete / acomplete / embed / aembed).
 *
 * <p>호출마다 새 {@link ResolutionContext}를 받아 Factory로 Provider를 만들고 호출합니다.
 * 실패하면 작업 이름의 카운터를 정확히 한 번 증가시킨 뒤 예외를 다시 던집니다.</p>
 *
 * <p><strong>카운터:</strong> {@code complete}, {@code acomplete}, {@code embed}, {@code aembed}</p>
 *
 * <p>호출자는 {@link ProviderException} 하위 타입만 받습니다. 그 외 예외는
 * {@code "<Operation> call failed: <cause>"} 메시지의 ProviderException으로 감쌉니다.
 * 취소는 실패로 세지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ProviderOperations {

    private static final Logger log = LoggerFactory.getLogger(ProviderOperations.class);

    public static final String COMPLETE = "complete";
    public static final String ACOMPLETE = "acomplete";
    public static final String EMBED = "embed";
    public static final String AEMBED = "aembed";

    private final ProviderFactory factory;
    private final Supplier<ResolutionContext> contextSupplier;
    private final ProviderMetrics metrics;

    /**
     * 생성자.
     *
     * @param factory Provider Factory
     * @param contextSupplier 호출마다 해석 입력값을 공급 (예: {@code () -> ResolutionContext.capture(settings)})
     * @param metrics 실패 카운터 싱크
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ProviderOperations(ProviderFactory factory, Supplier<ResolutionContext> contextSupplier, ProviderMetrics metrics) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (contextSupplier == null) {
            throw new IllegalArgumentException("contextSupplier cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        this.factory = factory;
        this.contextSupplier = contextSupplier;
        this.metrics = metrics;
    }

    public String complete(CompletionRequest request) {
        return complete(request, null, true);
    }

    /**
     * 텍스트 생성.
     *
     * @param request 생성 요청
     * @param providerType 요청할 Provider 유형 (null이면 기본 Provider)
     * @param fallback true면 설정된 순서의 Fallback Provider 사용 (providerType 무시)
     * @return 생성된 텍스트
     * @throws ProviderException 실패 시
     */
    public String complete(CompletionRequest request, String providerType, boolean fallback) {
        return invoke(COMPLETE, providerType, fallback, provider -> provider.complete(request));
    }

    public CompletableFuture<String> completeAsync(CompletionRequest request) {
        return completeAsync(request, null, true);
    }

    /**
     * 텍스트 생성 (비동기).
     *
     * @param request 생성 요청
     * @param providerType 요청할 Provider 유형 (null이면 기본 Provider)
     * @param fallback true면 Fallback Provider 사용
     * @return 생성된 텍스트 Future (실패 시 ProviderException으로 완료)
     */
    public CompletableFuture<String> completeAsync(CompletionRequest request, String providerType, boolean fallback) {
        return invokeAsync(ACOMPLETE, providerType, fallback, provider -> provider.completeAsync(request));
    }

    public List<Embedding> embed(EmbeddingRequest request) {
        return embed(request, null, true);
    }

    /**
     * 임베딩 생성.
     *
     * @param request 임베딩 요청
     * @param providerType 요청할 Provider 유형 (null이면 기본 Provider)
     * @param fallback true면 Fallback Provider 사용
     * @return 임베딩 목록
     * @throws ProviderException 실패 시
     */
    public List<Embedding> embed(EmbeddingRequest request, String providerType, boolean fallback) {
        return invoke(EMBED, providerType, fallback, provider -> provider.embed(request));
    }

    public CompletableFuture<List<Embedding>> embedAsync(EmbeddingRequest request) {
        return embedAsync(request, null, true);
    }

    /**
     * 임베딩 생성 (비동기).
     *
     * @param request 임베딩 요청
     * @param providerType 요청할 Provider 유형 (null이면 기본 Provider)
     * @param fallback true면 Fallback Provider 사용
     * @return 임베딩 목록 Future (실패 시 ProviderException으로 완료)
     */
    public CompletableFuture<List<Embedding>> embedAsync(EmbeddingRequest request, String providerType, boolean fallback) {
        return invokeAsync(AEMBED, providerType, fallback, provider -> provider.embedAsync(request));
    }

    private <T> T invoke(String operation, String providerType, boolean fallback, Function<Provider, T> call) {
        try {
            return call.apply(resolve(providerType, fallback));
        } catch (RuntimeException e) {
            throw recordFailure(operation, e);
        }
    }

    private <T> CompletableFuture<T> invokeAsync(
        String operation,
        String providerType,
        boolean fallback,
        Function<Provider, CompletableFuture<T>> call
    ) {
        CompletableFuture<T> inFlight;
        try {
            inFlight = call.apply(resolve(providerType, fallback));
        } catch (RuntimeException e) {
            inFlight = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> attempt = inFlight;
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) {
                result.completeExceptionally(cause);
                return;
            }
            result.completeExceptionally(recordFailure(operation, cause));
        });
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                attempt.cancel(true);
            }
        });
        return result;
    }

    private Provider resolve(String providerType, boolean fallback) {
        ResolutionContext context = contextSupplier.get();
        return fallback
            ? factory.createFallback(context)
            : factory.create(context, providerType, null);
    }

    private ProviderException recordFailure(String operation, Throwable error) {
        metrics.increment(operation);
        log.warn("{} call failed: {}", operation, error.getMessage());
        if (error instanceof ProviderException) {
            return (ProviderException) error;
        }
        return new ProviderException(null, capitalize(operation) + " call failed: " + error.getMessage(), error);
    }

    private static String capitalize(String operation) {
        return Character.toUpperCase(operation.charAt(0)) + operation.substring(1);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
