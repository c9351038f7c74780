package com.ryuqq.relay.application.operations;

import com.ryuqq.relay.application.factory.EchoNetworkProvider;
import com.ryuqq.relay.application.factory.EnvironmentSnapshot;
import com.ryuqq.relay.application.factory.ProviderFactory;
import com.ryuqq.relay.application.factory.ResolutionContext;
import com.ryuqq.relay.core.config.BackendConfig;
import com.ryuqq.relay.core.config.FallbackConfig;
import com.ryuqq.relay.core.config.ProviderSettings;
import com.ryuqq.relay.core.exception.ProviderDisabledException;
import com.ryuqq.relay.core.exception.ProviderException;
import com.ryuqq.relay.core.exception.ProvidersExhaustedException;
import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.EmbeddingRequest;
import com.ryuqq.relay.core.model.ProviderType;
import com.ryuqq.relay.core.spi.NetworkProviderBuilder;
import com.ryuqq.relay.core.spi.ProviderMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * ProviderOperations 테스트.
 *
 * <ul>
 *   <li>성공 시 카운터 변화 없음</li>
 *   <li>실패 시 작업 이름 카운터를 정확히 1회 증가</li>
 *   <li>호출자는 ProviderException만 받음</li>
 *   <li>호출마다 환경을 새로 읽음</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ProviderOperationsTest {

    private static final CompletionRequest REQUEST = CompletionRequest.of("hello");

    @Mock
    private ProviderMetrics metrics;

    private final NetworkProviderBuilder echo = EchoNetworkProvider::new;

    private ProviderOperations operations(ProviderSettings settings, Map<String, String> env, NetworkProviderBuilder builder) {
        ProviderFactory factory = new ProviderFactory(builder, metrics);
        return new ProviderOperations(factory,
            () -> new ResolutionContext(settings, EnvironmentSnapshot.of(env)), metrics);
    }

    private static ProviderSettings stubDefault() {
        return new ProviderSettings().withDefaultProvider("stub");
    }

    private static ProviderSettings openAiWithKey() {
        return new ProviderSettings().withBackend(ProviderType.OPENAI,
            BackendConfig.defaultsFor(ProviderType.OPENAI).withApiKey("sk-test"));
    }

    private static Map<String, String> disabled() {
        return Map.of(EnvironmentSnapshot.DISABLE_PROVIDERS, "1");
    }

    // ============================================================
    // 1. 성공
    // ============================================================

    @Test
    void 성공하면_카운터를_기록하지_않음() throws Exception {
        // given
        ProviderOperations operations = operations(stubDefault(), Map.of(), echo);

        // when
        String sync = operations.complete(REQUEST, null, false);
        String async = operations.completeAsync(REQUEST, null, false).get();
        int vectors = operations.embed(EmbeddingRequest.of("x"), null, false).size();

        // then
        assertThat(sync).isEqualTo("[stub:stub-llm] hello");
        assertThat(async).isEqualTo(sync);
        assertThat(vectors).isEqualTo(1);
        verifyNoInteractions(metrics);
    }

    @Test
    void providerType을_명시하면_해당_Provider로_호출() {
        ProviderOperations operations = operations(stubDefault(), Map.of(), echo);

        assertThat(operations.complete(REQUEST, "lmstudio", false)).isEqualTo("[lmstudio] hello");
    }

    @Test
    @DisplayName("유형과 fallback 여부를 생략하면 설정된 Fallback 순서로 호출")
    void 짧은_호출은_기본적으로_Fallback_사용() throws Exception {
        // given: openai는 key가 없어 NullProvider, 다음 순서인 lmstudio가 응답
        ProviderOperations operations = operations(stubDefault(), Map.of(), echo);

        // when
        String sync = operations.complete(REQUEST);
        String async = operations.completeAsync(REQUEST).get();

        // then
        assertThat(sync).isEqualTo("[lmstudio] hello");
        assertThat(async).isEqualTo(sync);
        assertThat(operations.embedAsync(EmbeddingRequest.of("x")).get()).hasSize(1);
        verifyNoInteractions(metrics);
    }

    // ============================================================
    // 2. 실패 카운터
    // ============================================================

    @Test
    void complete_실패시_complete_카운터_1회() {
        // given
        ProviderOperations operations = operations(openAiWithKey(), disabled(), echo);

        // when & then
        assertThatThrownBy(() -> operations.complete(REQUEST, null, false))
            .isInstanceOf(ProviderDisabledException.class);
        verify(metrics, times(1)).increment(ProviderOperations.COMPLETE);
        verify(metrics, times(1)).increment(anyString());
    }

    @Test
    void acomplete_실패시_acomplete_카운터_1회() {
        // given
        ProviderOperations operations = operations(openAiWithKey(), disabled(), echo);

        // when
        CompletableFuture<String> future = operations.completeAsync(REQUEST);

        // then
        assertThatThrownBy(future::get)
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(ProvidersExhaustedException.class)
            .hasRootCauseInstanceOf(ProviderDisabledException.class);
        verify(metrics, times(1)).increment(ProviderOperations.ACOMPLETE);
        verify(metrics, times(1)).increment(anyString());
    }

    @Test
    void embed_실패시_embed_카운터_1회() {
        ProviderOperations operations = operations(openAiWithKey(), disabled(), echo);

        assertThatThrownBy(() -> operations.embed(EmbeddingRequest.of("x")))
            .isInstanceOf(ProvidersExhaustedException.class)
            .hasMessageContaining("Last provider: null")
            .hasCauseInstanceOf(ProviderDisabledException.class);
        verify(metrics, times(1)).increment(ProviderOperations.EMBED);
    }

    @Test
    void aembed_Fallback_전체실패시_aembed_카운터_1회() {
        // given
        ProviderSettings settings = new ProviderSettings()
            .withFallback(new FallbackConfig(true, List.of("openai", "openrouter")));
        ProviderOperations operations = operations(settings, Map.of(), echo);

        // when
        CompletableFuture<?> future = operations.embedAsync(EmbeddingRequest.of("x"), null, true);

        // then
        assertThatThrownBy(future::get)
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(ProvidersExhaustedException.class);
        verify(metrics, times(1)).increment(ProviderOperations.AEMBED);
        verify(metrics, times(1)).increment(anyString());
    }

    @Test
    void ProviderException이_아닌_실패는_감싸서_전파() {
        // given
        NetworkProviderBuilder broken = (type, spec) -> {
            throw new IllegalStateException("socket factory missing");
        };
        ProviderOperations operations = operations(openAiWithKey(), Map.of(), broken);

        // when & then
        assertThatThrownBy(() -> operations.complete(REQUEST, null, false))
            .isInstanceOf(ProviderException.class)
            .hasMessage("Complete call failed: socket factory missing")
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(operations.completeAsync(REQUEST, null, false))
            .failsWithin(Duration.ofSeconds(1))
            .withThrowableOfType(ExecutionException.class)
            .withMessageContaining("Acomplete call failed: socket factory missing");
    }

    // ============================================================
    // 3. 취소 / 환경 재해석
    // ============================================================

    @Test
    void 취소는_실패로_세지_않음() {
        // given
        AtomicReference<EchoNetworkProvider> built = new AtomicReference<>();
        NetworkProviderBuilder hanging = (type, spec) -> {
            EchoNetworkProvider provider = new EchoNetworkProvider(type, spec, true);
            built.set(provider);
            return provider;
        };
        ProviderOperations operations = operations(openAiWithKey(), Map.of(), hanging);

        // when
        CompletableFuture<String> future = operations.completeAsync(REQUEST, null, false);
        future.cancel(true);

        // then
        assertThat(built.get().pending()).hasSize(1).allMatch(CompletableFuture::isCancelled);
        verify(metrics, never()).increment(anyString());
    }

    @Test
    void 호출마다_환경을_새로_읽음() {
        // given
        AtomicReference<Map<String, String>> env = new AtomicReference<>(Map.of());
        ProviderOperations operations = new ProviderOperations(
            new ProviderFactory(echo, metrics),
            () -> new ResolutionContext(stubDefault(), EnvironmentSnapshot.of(env.get())),
            metrics);

        // when
        String before = operations.complete(REQUEST, null, false);
        env.set(disabled());

        // then
        assertThat(before).startsWith("[stub:");
        assertThatThrownBy(() -> operations.complete(REQUEST, null, false))
            .isInstanceOf(ProviderDisabledException.class)
            .hasMessageContaining("Disabled by RELAY_DISABLE_PROVIDERS");
    }
}
