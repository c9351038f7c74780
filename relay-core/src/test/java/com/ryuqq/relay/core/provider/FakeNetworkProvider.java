package com.ryuqq.relay.core.provider;

import com.ryuqq.relay.core.config.BackendConfig;
import com.ryuqq.relay.core.config.RetryConfig;
import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.Embedding;
import com.ryuqq.relay.core.model.EmbeddingRequest;
import com.ryuqq.relay.core.model.ProviderType;
import com.ryuqq.relay.core.retry.RecordingRetryWaiter;
import com.ryuqq.relay.core.spi.NetworkProviderSpec;
import com.ryuqq.relay.core.spi.ProviderMetrics;
import com.ryuqq.relay.core.spi.noop.NoOpProviderMetrics;
import com.ryuqq.relay.core.tls.TlsConfig;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 미리 정한 결과를 순서대로 돌려주는 NetworkProvider (core 테스트 전용).
 *
 * <p>스크립트가 소진되면 마지막 결과를 반복합니다.
 * {@link #hanging()} 모드에서는 비동기 호출이 완료되지 않는 Future를 반환합니다.</p>
 */
final class FakeNetworkProvider extends NetworkProvider {

    private final Deque<Object> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final List<CompletableFuture<?>> pending = new CopyOnWriteArrayList<>();
    private final List<CompletionRequest> requests = new CopyOnWriteArrayList<>();
    private Object last = "ok";
    private boolean hanging;

    FakeNetworkProvider(String name) {
        this(name, RetryConfig.noRetry(), NoOpProviderMetrics.INSTANCE);
    }

    FakeNetworkProvider(String name, RetryConfig retry, ProviderMetrics metrics) {
        super(name, new NetworkProviderSpec(
            BackendConfig.defaultsFor(ProviderType.STUB), new TlsConfig(), retry, metrics
        ), new RecordingRetryWaiter());
    }

    FakeNetworkProvider thenReturn(String text) {
        script.add(text);
        last = text;
        return this;
    }

    FakeNetworkProvider thenThrow(RuntimeException error) {
        script.add(error);
        last = error;
        return this;
    }

    FakeNetworkProvider thenCrash(Error error) {
        script.add(error);
        last = error;
        return this;
    }

    FakeNetworkProvider hanging() {
        this.hanging = true;
        return this;
    }

    int calls() {
        return calls.get();
    }

    List<CompletionRequest> requests() {
        return requests;
    }

    List<CompletableFuture<?>> pending() {
        return pending;
    }

    private Object next() {
        calls.incrementAndGet();
        Object outcome = script.isEmpty() ? last : script.poll();
        if (outcome instanceof RuntimeException) {
            throw (RuntimeException) outcome;
        }
        if (outcome instanceof Error) {
            throw (Error) outcome;
        }
        return outcome;
    }

    private <T> CompletableFuture<T> nextAsync(Supplier<T> supplier) {
        if (hanging) {
            calls.incrementAndGet();
            CompletableFuture<T> future = new CompletableFuture<>();
            pending.add(future);
            return future;
        }
        try {
            return CompletableFuture.completedFuture(supplier.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    protected String doComplete(CompletionRequest request) {
        requests.add(request);
        return (String) next();
    }

    @Override
    protected CompletableFuture<String> doCompleteAsync(CompletionRequest request) {
        return nextAsync(() -> doComplete(request));
    }

    @Override
    protected List<Embedding> doEmbed(EmbeddingRequest request) {
        String text = (String) next();
        return List.of(new Embedding(List.of((double) text.length())));
    }

    @Override
    protected CompletableFuture<List<Embedding>> doEmbedAsync(EmbeddingRequest request) {
        return nextAsync(() -> doEmbed(request));
    }
}
