package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.adapter.inmemory.metrics.InMemoryProviderMetrics;
import com.ryuqq.relay.application.factory.EnvironmentSnapshot;
import com.ryuqq.relay.application.factory.ProviderFactory;
import com.ryuqq.relay.application.factory.ResolutionContext;
import com.ryuqq.relay.application.operations.ProviderOperations;
import com.ryuqq.relay.core.config.CircuitBreakerConfig;
import com.ryuqq.relay.core.config.FallbackConfig;
import com.ryuqq.relay.core.config.ProviderSettings;
import com.ryuqq.relay.core.config.RetryConfig;
import com.ryuqq.relay.core.exception.ProviderDisabledException;
import com.ryuqq.relay.core.exception.ProvidersExhaustedException;
import com.ryuqq.relay.core.exception.TransientProviderException;
import com.ryuqq.relay.core.exception.TransientProviderException.Kind;
import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.EmbeddingRequest;
import com.ryuqq.relay.core.model.ProviderType;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.provider.FallbackProvider;
import com.ryuqq.relay.core.provider.NetworkProvider;
import com.ryuqq.relay.testkit.provider.ManualClock;
import com.ryuqq.relay.testkit.provider.ScriptedNetworkProviderBuilder;
import com.ryuqq.relay.testkit.provider.ScriptedProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Factory → Fallback → Retry → Metrics 전체 경로 시나리오 테스트.
 *
 * <p>{@link ScriptedNetworkProviderBuilder}로 네트워크 없이 실제 해석/재시도/Circuit Breaker 경로를 통과합니다.</p>
 */
class ProviderResilienceScenarioTest {

    private InMemoryProviderMetrics metrics;
    private ScriptedNetworkProviderBuilder builder;
    private ManualClock clock;
    private ProviderSettings settings;
    private EnvironmentSnapshot environment;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryProviderMetrics();
        builder = new ScriptedNetworkProviderBuilder();
        clock = new ManualClock();
        settings = new ProviderSettings()
            .withBackend(ProviderType.OPENAI, new ProviderSettings().backend(ProviderType.OPENAI).withApiKey("sk-test"))
            .withRetry(new RetryConfig().withMaxRetries(2))
            .withFallback(new FallbackConfig(true, List.of("openai", "lmstudio")))
            .withCircuitBreaker(new CircuitBreakerConfig(true, 1, Duration.ofSeconds(30)));
        environment = EnvironmentSnapshot.empty();
    }

    private ProviderFactory factory() {
        return new ProviderFactory(builder, metrics, clock);
    }

    private ProviderOperations operations() {
        return new ProviderOperations(factory(), () -> new ResolutionContext(settings, environment), metrics);
    }

    private static TransientProviderException outage(String provider) {
        return new TransientProviderException(provider, Kind.SERVER_ERROR, 503, "HTTP 503 from " + provider, null);
    }

    // ==================== Fallback ====================

    @Test
    @DisplayName("기본 Provider가 계속 실패하면 재시도 후 다음 Provider로 성공")
    void 재시도_소진_후_Fallback_성공() {
        // given
        builder.script(ProviderType.OPENAI, provider -> provider.thenThrow(outage("openai")))
            .script(ProviderType.LMSTUDIO, provider -> provider.thenReturn("local answer"));

        // when
        String result = operations().complete(CompletionRequest.of("hi"), null, true);

        // then
        assertThat(result).isEqualTo("local answer");
        ScriptedProvider openai = builder.built().get(0);
        assertThat(openai.name()).isEqualTo("openai");
        assertThat(openai.calls()).isEqualTo(3);
        assertThat(openai.waiter().delays()).hasSize(2);
        assertThat(metrics.count(NetworkProvider.RETRY_COUNTER)).isEqualTo(2);
        assertThat(metrics.count(ProviderOperations.COMPLETE)).isZero();
    }

    @Test
    void 모든_Provider가_실패하면_마지막_Provider를_담아_한_번만_집계() {
        // given
        builder.script(ProviderType.OPENAI, provider -> provider.thenThrow(outage("openai")))
            .script(ProviderType.LMSTUDIO, provider -> provider.thenThrow(outage("lmstudio")));

        // when & then
        assertThatThrownBy(() -> operations().complete(CompletionRequest.of("hi"), null, true))
            .isInstanceOf(ProvidersExhaustedException.class)
            .hasMessageContaining("Last provider: lmstudio")
            .satisfies(e -> assertThat(((ProvidersExhaustedException) e).getAttempted()).isEqualTo(2));
        assertThat(metrics.count(ProviderOperations.COMPLETE)).isEqualTo(1);
    }

    @Test
    void 비동기_임베딩_실패도_한_번만_집계() {
        // given
        builder.script(ProviderType.OPENAI, provider -> provider.thenThrow(outage("openai")))
            .script(ProviderType.LMSTUDIO, provider -> provider.thenThrow(outage("lmstudio")));

        // when & then
        assertThatThrownBy(() -> operations().embedAsync(EmbeddingRequest.of("text"), null, true).get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(ProvidersExhaustedException.class);
        assertThat(metrics.count(ProviderOperations.AEMBED)).isEqualTo(1);
        assertThat(metrics.count(ProviderOperations.EMBED)).isZero();
    }

    // ==================== Circuit Breaker ====================

    @Test
    @DisplayName("열린 Circuit은 복구 시간 전까지 호출하지 않고, 경과 후 한 번 시험 호출")
    void Circuit_열림과_복구() {
        // given
        builder.script(ProviderType.OPENAI, provider -> provider
                .thenThrow(outage("openai")).thenThrow(outage("openai")).thenThrow(outage("openai"))
                .thenReturn("primary answer"))
            .script(ProviderType.LMSTUDIO, provider -> provider.thenReturn("local answer"));
        FallbackProvider fallback = factory().createFallback(new ResolutionContext(settings, environment));
        ScriptedProvider openai = builder.built().get(0);

        // when: 첫 호출에서 openai 실패 → Circuit OPEN
        String first = fallback.complete(CompletionRequest.of("hi"));

        // then
        assertThat(first).isEqualTo("local answer");
        assertThat(fallback.circuitBreakers().get(0).getState()).isEqualTo(CircuitBreakerState.OPEN);

        // when: 복구 시간 전에는 openai를 호출하지 않음
        String second = fallback.complete(CompletionRequest.of("hi"));

        // then
        assertThat(second).isEqualTo("local answer");
        assertThat(openai.calls()).isEqualTo(3);

        // when: 복구 시간 경과 후 시험 호출 성공 → CLOSED
        clock.advance(Duration.ofSeconds(31));
        String third = fallback.complete(CompletionRequest.of("hi"));

        // then
        assertThat(third).isEqualTo("primary answer");
        assertThat(fallback.circuitBreakers().get(0).getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    // ==================== Environment ====================

    @Test
    void 비활성화_플래그는_요청_유형과_무관하게_NullProvider() {
        // given
        environment = environment.with(EnvironmentSnapshot.DISABLE_PROVIDERS, "true");

        // when & then
        assertThatThrownBy(() -> operations().complete(CompletionRequest.of("hi"), "openai", false))
            .isInstanceOf(ProviderDisabledException.class)
            .hasMessageStartingWith("LLM provider is disabled: Disabled by RELAY_DISABLE_PROVIDERS");
        assertThat(metrics.count(ProviderOperations.COMPLETE)).isEqualTo(1);
        assertThat(builder.built()).isEmpty();
    }

    @Test
    void 오프라인_모드는_stub으로_응답() {
        // given
        environment = environment.with(EnvironmentSnapshot.OFFLINE, "1");

        // when
        String result = operations().complete(CompletionRequest.of("hi"));

        // then
        assertThat(result).isEqualTo("[stub:stub-llm] hi");
        assertThat(builder.built()).isEmpty();
    }

    @Test
    void 환경_변경은_다음_호출부터_반영() {
        // given
        builder.script(ProviderType.OPENAI, provider -> provider.thenReturn("remote answer"));
        ProviderOperations operations = operations();

        // when
        String online = operations.complete(CompletionRequest.of("hi"));
        environment = environment.with(EnvironmentSnapshot.OFFLINE, "yes");
        String offline = operations.complete(CompletionRequest.of("hi"));

        // then
        assertThat(online).isEqualTo("remote answer");
        assertThat(offline).isEqualTo("[stub:stub-llm] hi");
    }
}
