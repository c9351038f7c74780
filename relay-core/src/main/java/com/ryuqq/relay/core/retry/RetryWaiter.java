package com.ryuqq.relay.core.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 재시도 간 대기 방식.
 *
 * <p>동기 경로는 스레드를 블로킹하고, 비동기 경로는 스레드를 점유하지 않고
 * 지정 시간 후 완료되는 Future를 반환합니다. 재시도 루프에서 실행이 중단되는 지점은 이 두 메서드뿐입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface RetryWaiter {

    /**
     * 현재 스레드를 지정 시간 동안 블로킹.
     *
     * @param delay 대기 시간
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration delay) throws InterruptedException;

    /**
     * 지정 시간 후 완료되는 Future.
     *
     * @param delay 대기 시간
     * @return 대기 완료 Future
     */
    CompletableFuture<Void> delay(Duration delay);
}
