package com.ryuqq.relay.adapter.http;

import com.ryuqq.relay.core.model.ProviderType;
import com.ryuqq.relay.core.provider.NetworkProvider;
import com.ryuqq.relay.core.spi.NetworkProviderBuilder;
import com.ryuqq.relay.core.spi.NetworkProviderSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link java.net.http.HttpClient} 기반 {@link NetworkProviderBuilder} 구현체.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class HttpNetworkProviderBuilder implements NetworkProviderBuilder {

    private static final Logger log = LoggerFactory.getLogger(HttpNetworkProviderBuilder.class);

    @Override
    public NetworkProvider build(ProviderType type, NetworkProviderSpec spec) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        NetworkProvider provider = switch (type) {
            case OPENAI -> new OpenAiProvider(spec);
            case OPENROUTER -> new OpenRouterProvider(spec);
            case LMSTUDIO -> new LmStudioProvider(spec);
            case STUB -> throw new IllegalArgumentException("stub is not a network provider type");
        };
        log.debug("Built {} for endpoint {}", provider.name(), spec.backend().endpoint());
        return provider;
    }
}
