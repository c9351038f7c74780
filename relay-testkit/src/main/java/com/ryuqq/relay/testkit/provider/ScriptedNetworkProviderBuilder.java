package com.ryuqq.relay.testkit.provider;

import com.ryuqq.relay.core.model.ProviderType;
import com.ryuqq.relay.core.provider.NetworkProvider;
import com.ryuqq.relay.core.spi.NetworkProviderBuilder;
import com.ryuqq.relay.core.spi.NetworkProviderSpec;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * {@link ScriptedProvider}를 만드는 {@link NetworkProviderBuilder}.
 *
 * <p>ProviderFactory에 주입해 네트워크 없이 해석/Fallback 경로 전체를 검증합니다.
 * 유형별 스크립트는 {@link #script(ProviderType, Consumer)}로 등록하며,
 * 생성될 때마다 새 ScriptedProvider에 적용됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ScriptedNetworkProviderBuilder implements NetworkProviderBuilder {

    private final Map<ProviderType, Consumer<ScriptedProvider>> scripts = new ConcurrentHashMap<>();
    private final List<ScriptedProvider> built = new CopyOnWriteArrayList<>();

    /**
     * 유형별 스크립트 등록.
     *
     * @param type Provider 유형
     * @param script 생성된 Provider에 적용할 스크립트
     * @return this
     */
    public ScriptedNetworkProviderBuilder script(ProviderType type, Consumer<ScriptedProvider> script) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (script == null) {
            throw new IllegalArgumentException("script cannot be null");
        }
        scripts.put(type, script);
        return this;
    }

    @Override
    public NetworkProvider build(ProviderType type, NetworkProviderSpec spec) {
        if (!type.isNetwork()) {
            throw new IllegalArgumentException(type.id() + " is not a network provider type");
        }
        ScriptedProvider provider = new ScriptedProvider(type.id(), spec);
        scripts.getOrDefault(type, ignored -> { }).accept(provider);
        built.add(provider);
        return provider;
    }

    /**
     * 지금까지 생성한 Provider (생성 순서).
     *
     * @return 불변 목록
     */
    public List<ScriptedProvider> built() {
        return List.copyOf(built);
    }
}
