package com.ryuqq.relay.adapter.http;

import com.ryuqq.relay.core.retry.RetryWaiter;
import com.ryuqq.relay.core.spi.NetworkProviderSpec;

/**
 * LM Studio 로컬 서버 Provider.
 *
 * <p>API key 없이 동작합니다. 설정된 경우에만 Authorization 헤더를 보냅니다.
 * 생성 시 서버 상태를 확인하지 않으므로 연결 실패는 첫 호출에서 CONNECTION 실패로 드러납니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class LmStudioProvider extends OpenAiCompatibleProvider {

    public static final String NAME = "lmstudio";

    public LmStudioProvider(NetworkProviderSpec spec) {
        super(NAME, spec);
    }

    public LmStudioProvider(NetworkProviderSpec spec, RetryWaiter waiter) {
        super(NAME, spec, waiter);
    }
}
