package com.ryuqq.relay.application.factory;

import com.ryuqq.relay.core.config.ProviderSettings;
import com.ryuqq.relay.core.config.RetryConfig;
import com.ryuqq.relay.core.exception.CredentialException;
import com.ryuqq.relay.core.model.ProviderType;
import com.ryuqq.relay.core.provider.FallbackProvider;
import com.ryuqq.relay.core.provider.NullProvider;
import com.ryuqq.relay.core.provider.Provider;
import com.ryuqq.relay.core.provider.StubProvider;
import com.ryuqq.relay.core.spi.NetworkProviderBuilder;
import com.ryuqq.relay.core.spi.NetworkProviderSpec;
import com.ryuqq.relay.core.spi.ProviderMetrics;
import com.ryuqq.relay.core.spi.ProviderResolver;
import com.ryuqq.relay.core.tls.TlsConfigResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * 설정과 환경 스냅샷으로 구체 Provider를 선택/생성하는 Factory.
 *
 * <p><strong>해석 순서 (먼저 일치하는 규칙 적용):</strong></p>
 * <ol>
 *   <li>{@code RELAY_DISABLE_PROVIDERS} → NullProvider</li>
 *   <li>{@code RELAY_OFFLINE} → 안전한 기본 Provider</li>
 *   <li>유효 유형 = 요청한 유형 또는 {@code settings.defaultProvider}
 *       (알 수 없는 유형: 명시 요청이면 NullProvider, 기본값이면 안전한 기본 Provider)</li>
 *   <li>{@code stub} → StubProvider</li>
 *   <li>자격 증명 누락: 명시 요청이면 NullProvider(원인: CredentialException),
 *       기본값이면 LM Studio(사용 가능 표시된 경우) 또는 안전한 기본 Provider</li>
 *   <li>기본값으로 선택된 LM Studio는 사용 가능 표시가 필요</li>
 *   <li>그 외: {@link NetworkProviderBuilder}로 네트워크 Provider 생성</li>
 * </ol>
 *
 * <p>명시적으로 요청한 백엔드를 조용히 다른 백엔드로 바꾸지 않습니다.
 * 해석 자체는 네트워크 호출이나 난수 없이 입력값만으로 결정됩니다.
 * 네트워크 Provider 생성 중 발생한 {@link com.ryuqq.relay.core.exception.ConfigurationException}은 그대로 전파됩니다.</p>
 *
 * <p>호출마다 새 인스턴스를 만들며 전역 Provider 싱글톤을 두지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    static final String DISABLED_REASON = "Disabled by " + EnvironmentSnapshot.DISABLE_PROVIDERS;

    private final NetworkProviderBuilder networkProviderBuilder;
    private final ProviderMetrics metrics;
    private final Clock clock;

    public ProviderFactory(NetworkProviderBuilder networkProviderBuilder, ProviderMetrics metrics) {
        this(networkProviderBuilder, metrics, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param networkProviderBuilder 네트워크 Provider 생성 SPI
     * @param metrics 재시도 지표 싱크
     * @param clock Fallback Provider의 Circuit Breaker 시간 공급자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ProviderFactory(NetworkProviderBuilder networkProviderBuilder, ProviderMetrics metrics, Clock clock) {
        if (networkProviderBuilder == null) {
            throw new IllegalArgumentException("networkProviderBuilder cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.networkProviderBuilder = networkProviderBuilder;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * 기본 Provider 생성.
     *
     * @param context 해석 입력값
     * @return Provider
     */
    public Provider create(ResolutionContext context) {
        return create(context, null, null);
    }

    /**
     * Provider 생성.
     *
     * @param context 해석 입력값
     * @param requestedType 요청한 Provider 유형 (null이면 설정의 기본 Provider)
     * @param retryOverride 재시도 설정 재정의 (null이면 설정값)
     * @return Provider
     * @throws com.ryuqq.relay.core.exception.ConfigurationException 네트워크 Provider의 전송 계층을 만들 수 없는 경우
     */
    public Provider create(ResolutionContext context, String requestedType, RetryConfig retryOverride) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        EnvironmentSnapshot env = context.environment();
        ProviderSettings settings = context.settings();

        if (env.providersDisabled()) {
            log.warn("Providers disabled via {}", EnvironmentSnapshot.DISABLE_PROVIDERS);
            return new NullProvider(DISABLED_REASON);
        }

        boolean explicit = requestedType != null && !requestedType.isBlank();
        String effective = explicit ? requestedType : settings.defaultProvider();
        Optional<ProviderType> resolved = ProviderType.fromId(effective);

        if (env.offline() && !resolved.equals(Optional.of(ProviderType.STUB))) {
            return safeDefault(env, EnvironmentSnapshot.OFFLINE + " active; using safe provider");
        }

        if (resolved.isEmpty()) {
            if (explicit) {
                log.error("Unknown provider type '{}' requested", effective);
                return new NullProvider("Unknown provider type: " + effective);
            }
            log.warn("Unknown default provider type '{}', falling back to safe default", effective);
            return safeDefault(env, "Unknown provider type: " + effective);
        }

        ProviderType type = resolved.get();
        RetryConfig retry = retryOverride != null ? retryOverride : settings.retry();

        if (type == ProviderType.STUB) {
            log.info("Using stub provider (deterministic, offline)");
            return new StubProvider();
        }

        if (type.requiresApiKey() && !settings.backend(type).hasApiKey()) {
            CredentialException missing = new CredentialException(type.id(), credentialName(type));
            if (explicit) {
                log.error("{} for explicitly requested provider", missing.getMessage());
                return new NullProvider(missing.getMessage(), missing);
            }
            if (env.resourceAvailable(ProviderType.LMSTUDIO)) {
                log.warn("{}; attempting LM Studio instead", missing.getMessage());
                return build(ProviderType.LMSTUDIO, settings, retry);
            }
            return safeDefault(env, missing.getMessage() + "; LM Studio not marked available ("
                + EnvironmentSnapshot.resourceFlag(ProviderType.LMSTUDIO) + ")");
        }

        if (type == ProviderType.LMSTUDIO && !explicit && !env.resourceAvailable(ProviderType.LMSTUDIO)) {
            return safeDefault(env, "LM Studio not marked available");
        }

        return build(type, settings, retry);
    }

    /**
     * 설정된 순서의 Fallback Provider 생성.
     *
     * <p>각 식별자는 {@link #create(ResolutionContext, String, RetryConfig)}로 해석하며,
     * 해석에 실패한 식별자는 건너뜁니다.</p>
     *
     * @param context 해석 입력값
     * @return FallbackProvider
     * @throws com.ryuqq.relay.core.exception.ConfigurationException 해석된 Provider가 없는 경우
     */
    public FallbackProvider createFallback(ResolutionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        ProviderSettings settings = context.settings();
        return FallbackProvider.fromConfig(
            settings.fallback(),
            settings.circuitBreaker(),
            resolverFor(context),
            clock
        );
    }

    /**
     * 해석 입력값에 묶인 ProviderResolver.
     *
     * @param context 해석 입력값
     * @return 식별자를 명시 요청으로 해석하는 Resolver
     */
    public ProviderResolver resolverFor(ResolutionContext context) {
        return providerId -> create(context, providerId, null);
    }

    private Provider build(ProviderType type, ProviderSettings settings, RetryConfig retry) {
        NetworkProviderSpec spec = new NetworkProviderSpec(
            settings.backend(type),
            TlsConfigResolver.resolve(settings.tls()),
            retry,
            metrics
        );
        Provider provider = networkProviderBuilder.build(type, spec);
        log.info("Using {} provider", type.id());
        return provider;
    }

    private static Provider safeDefault(EnvironmentSnapshot env, String reason) {
        if (ProviderType.STUB.id().equals(env.safeDefaultProvider())) {
            log.info("Falling back to stub provider: {}", reason);
            return new StubProvider();
        }
        log.info("Falling back to null provider: {}", reason);
        return new NullProvider(reason);
    }

    private static String credentialName(ProviderType type) {
        return type.id().toUpperCase(Locale.ROOT) + "_API_KEY";
    }
}
