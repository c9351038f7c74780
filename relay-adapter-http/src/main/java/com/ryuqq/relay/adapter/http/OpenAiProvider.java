package com.ryuqq.relay.adapter.http;

import com.ryuqq.relay.core.retry.RetryWaiter;
import com.ryuqq.relay.core.spi.NetworkProviderSpec;

/**
 * OpenAI API Provider.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class OpenAiProvider extends OpenAiCompatibleProvider {

    public static final String NAME = "openai";

    public OpenAiProvider(NetworkProviderSpec spec) {
        super(NAME, spec);
    }

    public OpenAiProvider(NetworkProviderSpec spec, RetryWaiter waiter) {
        super(NAME, spec, waiter);
    }
}
