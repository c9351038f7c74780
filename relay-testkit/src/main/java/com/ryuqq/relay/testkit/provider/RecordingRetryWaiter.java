package com.ryuqq.relay.testkit.provider;

import com.ryuqq.relay.core.retry.RetryWaiter;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 실제로 대기하지 않고 요청된 대기 시간만 기록하는 {@link RetryWaiter}.
 *
 * <p>재시도 간격을 검증하거나 테스트 시간을 줄일 때 사용합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RecordingRetryWaiter implements RetryWaiter {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration delay) {
        delays.add(delay);
    }

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        delays.add(delay);
        return CompletableFuture.completedFuture(null);
    }

    /**
     * 지금까지 요청된 대기 시간 (요청 순서).
     *
     * @return 불변 목록
     */
    public List<Duration> delays() {
        return List.copyOf(delays);
    }
}
