package com.ryuqq.relay.core.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link Thread#sleep}과 {@link CompletableFuture#delayedExecutor}를 사용하는 기본 구현.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class SystemRetryWaiter implements RetryWaiter {

    public static final SystemRetryWaiter INSTANCE = new SystemRetryWaiter();

    private SystemRetryWaiter() {
    }

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        long millis = delay.toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        long nanos = delay.toNanos();
        if (nanos <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> { },
            CompletableFuture.delayedExecutor(nanos, TimeUnit.NANOSECONDS));
    }
}
