package com.ryuqq.relay.adapter.http;

import com.ryuqq.relay.core.retry.RetryWaiter;
import com.ryuqq.relay.core.spi.NetworkProviderSpec;

import java.net.http.HttpRequest;

/**
 * OpenRouter Provider.
 *
 * <p>OpenRouter 대시보드의 앱 식별용으로 {@code X-Title} 헤더를 함께 보냅니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class OpenRouterProvider extends OpenAiCompatibleProvider {

    public static final String NAME = "openrouter";

    static final String TITLE_HEADER = "X-Title";
    static final String APP_TITLE = "Relay";

    public OpenRouterProvider(NetworkProviderSpec spec) {
        super(NAME, spec);
    }

    public OpenRouterProvider(NetworkProviderSpec spec, RetryWaiter waiter) {
        super(NAME, spec, waiter);
    }

    @Override
    protected void addHeaders(HttpRequest.Builder builder) {
        builder.header(TITLE_HEADER, APP_TITLE);
    }
}
