package com.ryuqq.relay.testkit.provider;

import com.ryuqq.relay.core.config.BackendConfig;
import com.ryuqq.relay.core.config.RetryConfig;
import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.Embedding;
import com.ryuqq.relay.core.model.EmbeddingRequest;
import com.ryuqq.relay.core.model.ProviderType;
import com.ryuqq.relay.core.provider.NetworkProvider;
import com.ryuqq.relay.core.spi.NetworkProviderSpec;
import com.ryuqq.relay.core.spi.noop.NoOpProviderMetrics;
import com.ryuqq.relay.core.tls.TlsConfig;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 미리 정한 결과를 순서대로 돌려주는 {@link NetworkProvider}.
 *
 * <p>실제 NetworkProvider와 같은 재시도 경로를 타므로 재시도/Fallback/Circuit Breaker를
 * 네트워크 없이 검증할 수 있습니다. 대기는 {@link RecordingRetryWaiter}가 기록만 합니다.</p>
 *
 * <p><strong>스크립트 규칙:</strong></p>
 * <ul>
 *   <li>{@link #thenReturn(String)}, {@link #thenThrow(RuntimeException)} 순서대로 소비</li>
 *   <li>스크립트가 소진되면 마지막 결과를 반복 (초기값: {@code "ok"})</li>
 *   <li>임베딩은 입력마다 결과 문자열 길이를 값으로 하는 1차원 벡터</li>
 *   <li>{@link #hanging()}: 비동기 호출이 완료되지 않는 Future를 반환 (취소 검증용)</li>
 * </ul>
 *
 * <pre>
 * ScriptedProvider flaky = new ScriptedProvider("flaky")
 *     .thenThrow(new TransientProviderException("flaky", Kind.TIMEOUT, "timeout"))
 *     .thenReturn("recovered");
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ScriptedProvider extends NetworkProvider {

    private final Deque<Object> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final List<Object> requests = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<?>> pending = new CopyOnWriteArrayList<>();
    private final RecordingRetryWaiter waiter;
    private volatile Object last = "ok";
    private volatile boolean hanging;

    /**
     * 재시도 없는 Provider 생성.
     *
     * @param name Provider 이름
     */
    public ScriptedProvider(String name) {
        this(name, specOf(RetryConfig.noRetry()));
    }

    public ScriptedProvider(String name, RetryConfig retry) {
        this(name, specOf(retry));
    }

    public ScriptedProvider(String name, NetworkProviderSpec spec) {
        this(name, spec, new RecordingRetryWaiter());
    }

    private ScriptedProvider(String name, NetworkProviderSpec spec, RecordingRetryWaiter waiter) {
        super(name, spec, waiter);
        this.waiter = waiter;
    }

    private static NetworkProviderSpec specOf(RetryConfig retry) {
        return new NetworkProviderSpec(
            BackendConfig.defaultsFor(ProviderType.STUB), new TlsConfig(), retry, NoOpProviderMetrics.INSTANCE
        );
    }

    public synchronized ScriptedProvider thenReturn(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        script.add(text);
        last = text;
        return this;
    }

    public synchronized ScriptedProvider thenThrow(RuntimeException error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        script.add(error);
        last = error;
        return this;
    }

    public ScriptedProvider hanging() {
        this.hanging = true;
        return this;
    }

    /**
     * 실제로 수행된 단일 호출 수 (재시도 포함).
     */
    public int calls() {
        return calls.get();
    }

    /**
     * 받은 요청 ({@link CompletionRequest} 또는 {@link EmbeddingRequest}), 호출 순서.
     */
    public List<Object> requests() {
        return List.copyOf(requests);
    }

    /**
     * hanging 모드에서 반환된 미완료 Future.
     */
    public List<CompletableFuture<?>> pending() {
        return List.copyOf(pending);
    }

    public RecordingRetryWaiter waiter() {
        return waiter;
    }

    private synchronized Object next() {
        calls.incrementAndGet();
        Object outcome = script.isEmpty() ? last : script.poll();
        if (outcome instanceof RuntimeException) {
            throw (RuntimeException) outcome;
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
        if (hanging) {
            requests.add(request);
        }
        return nextAsync(() -> doComplete(request));
    }

    @Override
    protected List<Embedding> doEmbed(EmbeddingRequest request) {
        requests.add(request);
        String text = (String) next();
        return request.inputs().stream()
            .map(input -> new Embedding(List.of((double) text.length())))
            .collect(Collectors.toList());
    }

    @Override
    protected CompletableFuture<List<Embedding>> doEmbedAsync(EmbeddingRequest request) {
        if (hanging) {
            requests.add(request);
        }
        return nextAsync(() -> doEmbed(request));
    }
}
