package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.config.RetryConfig;
import com.ryuqq.relay.core.exception.TransientProviderException;
import com.ryuqq.relay.core.exception.TransientProviderException.Kind;
import com.ryuqq.relay.core.provider.Provider;
import com.ryuqq.relay.testkit.provider.ScriptedProvider;

import java.time.Duration;

/**
 * ScriptedProvider 계약 테스트 (일시 실패 후 재시도로 성공).
 */
class ScriptedProviderContractTest extends AbstractProviderContractTest {

    @Override
    protected Provider createProvider() {
        return new ScriptedProvider("scripted", new RetryConfig().withMaxRetries(1).withInitialDelay(Duration.ZERO))
            .thenThrow(new TransientProviderException("scripted", Kind.TIMEOUT, "timed out"))
            .thenReturn("scripted answer");
    }
}
