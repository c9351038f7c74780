package com.ryuqq.relay.core.provider;

import com.ryuqq.relay.core.config.CircuitBreakerConfig;
import com.ryuqq.relay.core.config.FallbackConfig;
import com.ryuqq.relay.core.exception.ConfigurationException;
import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.Embedding;
import com.ryuqq.relay.core.model.EmbeddingRequest;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.relay.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.relay.core.spi.ProviderResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 여러 Provider를 구성된 순서대로 시도하는 Provider.
 *
 * <p>감싸는 Provider마다 전용 {@link CircuitBreaker}를 두어, 장애가 난 백엔드는
 * 재시도 지연 없이 바로 건너뜁니다. 첫 성공 결과를 반환하며, 모두 실패하면
 * 마지막으로 시도한 Provider와 그 오류를 담은
 * {@link com.ryuqq.relay.core.exception.ProvidersExhaustedException} 하나를 던집니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>{@code fallback.enabled = false}: 첫 번째 Provider만 사용</li>
 *   <li>{@code circuit_breaker.enabled = false}: {@link NoOpCircuitBreaker} 사용</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> 인스턴스를 공유하는 호출자는 Circuit Breaker 상태도 공유합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class FallbackProvider implements Provider {

    private static final Logger log = LoggerFactory.getLogger(FallbackProvider.class);

    public static final String NAME = "fallback";

    static final String COMPLETION = "completion";
    static final String EMBEDDINGS = "embeddings";

    private final FallbackChain chain;

    /**
     * 이미 생성된 Provider 목록으로 생성.
     *
     * @param providers 시도 순서대로 정렬된 Provider
     * @param fallback Fallback 설정
     * @param breakerConfig Circuit Breaker 설정
     * @throws ConfigurationException providers가 비어 있는 경우
     */
    public FallbackProvider(List<? extends Provider> providers, FallbackConfig fallback, CircuitBreakerConfig breakerConfig) {
        this(providers, fallback, breakerConfig, Clock.systemUTC());
    }

    /**
     * 시계 주입 생성자 (테스트용).
     *
     * @param providers 시도 순서대로 정렬된 Provider
     * @param fallback Fallback 설정
     * @param breakerConfig Circuit Breaker 설정
     * @param clock Circuit Breaker 시간 공급자
     * @throws ConfigurationException providers가 비어 있는 경우
     */
    public FallbackProvider(
        List<? extends Provider> providers,
        FallbackConfig fallback,
        CircuitBreakerConfig breakerConfig,
        Clock clock
    ) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        if (breakerConfig == null) {
            throw new IllegalArgumentException("breakerConfig cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (providers == null || providers.isEmpty()) {
            throw new ConfigurationException(NAME, "No valid providers available for fallback");
        }

        List<? extends Provider> selected = fallback.enabled() ? providers : providers.subList(0, 1);
        List<FallbackChain.Member> members = new ArrayList<>(selected.size());
        for (Provider provider : selected) {
            if (provider == null) {
                throw new IllegalArgumentException("providers cannot contain null");
            }
            CircuitBreaker breaker = breakerConfig.enabled()
                ? new ConsecutiveFailureCircuitBreaker(provider.name(), breakerConfig, clock)
                : new NoOpCircuitBreaker(provider.name());
            members.add(new FallbackChain.Member(provider, breaker));
        }
        this.chain = new FallbackChain(members);

        log.info("Initialized fallback provider order: {}",
            selected.stream().map(Provider::name).collect(Collectors.joining(", ")));
    }

    /**
     * 구성된 식별자 순서({@link FallbackConfig#order()})를 해석하여 생성.
     *
     * <p>해석에 실패한 식별자는 WARN 로그를 남기고 건너뜁니다.</p>
     *
     * @param fallback Fallback 설정 (순서 포함)
     * @param breakerConfig Circuit Breaker 설정
     * @param resolver 식별자 해석기
     * @return FallbackProvider
     * @throws ConfigurationException 해석된 Provider가 하나도 없는 경우
     */
    public static FallbackProvider fromConfig(FallbackConfig fallback, CircuitBreakerConfig breakerConfig, ProviderResolver resolver) {
        return fromConfig(fallback, breakerConfig, resolver, Clock.systemUTC());
    }

    public static FallbackProvider fromConfig(
        FallbackConfig fallback,
        CircuitBreakerConfig breakerConfig,
        ProviderResolver resolver,
        Clock clock
    ) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        List<Provider> providers = new ArrayList<>();
        for (String providerId : fallback.order()) {
            try {
                providers.add(resolver.resolve(providerId));
            } catch (RuntimeException e) {
                log.warn("Failed to initialize provider {} for fallback: {}", providerId, e.getMessage());
                continue;
            }
            if (!fallback.enabled()) {
                break;
            }
        }
        return new FallbackProvider(providers, fallback, breakerConfig, clock);
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * 시도 순서대로 정렬된 Provider 목록.
     *
     * @return 불변 목록
     */
    public List<Provider> providers() {
        return chain.members().stream().map(FallbackChain.Member::provider).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Provider별 Circuit Breaker (providers()와 같은 순서).
     *
     * @return 불변 목록
     */
    public List<CircuitBreaker> circuitBreakers() {
        return chain.members().stream().map(FallbackChain.Member::breaker).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String complete(CompletionRequest request) {
        return chain.call(COMPLETION, provider -> provider.complete(request));
    }

    @Override
    public CompletableFuture<String> completeAsync(CompletionRequest request) {
        return chain.callAsync(COMPLETION, provider -> provider.completeAsync(request));
    }

    @Override
    public List<Embedding> embed(EmbeddingRequest request) {
        return chain.call(EMBEDDINGS, provider -> provider.embed(request));
    }

    @Override
    public CompletableFuture<List<Embedding>> embedAsync(EmbeddingRequest request) {
        return chain.callAsync(EMBEDDINGS, provider -> provider.embedAsync(request));
    }

    @Override
    public String toString() {
        return "FallbackProvider{providers=" + providers().stream().map(Provider::name).collect(Collectors.toList()) + "}";
    }
}
