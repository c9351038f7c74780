package com.ryuqq.relay.core.retry;

import com.ryuqq.relay.core.config.RetryConfig;
import com.ryuqq.relay.core.exception.ProviderException;
import com.ryuqq.relay.core.exception.TransientProviderException;
import com.ryuqq.relay.core.exception.TransientProviderException.Kind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * RetryExecutor 유닛 테스트.
 *
 * <ul>
 *   <li>maxRetries=n → 최대 n+1회 호출 (동기/비동기)</li>
 *   <li>재시도 불가 예외는 대기 없이 즉시 전파</li>
 *   <li>재시도 직전 리스너 호출, 리스너 실패는 무시</li>
 *   <li>retry condition 필터</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetryExecutorTest {

    private static final RetryPolicy TRANSIENT = RetryPolicy.on(TransientProviderException.class);

    @Mock
    private RetryListener listener;

    private final RecordingRetryWaiter waiter = new RecordingRetryWaiter();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private RetryExecutor executor(RetryConfig config) {
        return new RetryExecutor(config, listener, waiter, new BackoffCalculator(config));
    }

    private static RetryConfig config(int maxRetries) {
        return new RetryConfig()
            .withMaxRetries(maxRetries)
            .withInitialDelay(Duration.ofMillis(100))
            .withJitter(false);
    }

    private static TransientProviderException timeout() {
        return new TransientProviderException("openai", Kind.TIMEOUT, "Request timed out");
    }

    // ============================================================
    // 1. 동기 재시도
    // ============================================================

    @Test
    void call_항상_실패하면_maxRetries_더하기_1회_호출후_마지막_예외_전파() {
        // given
        RetryExecutor executor = executor(config(3));
        AtomicInteger calls = new AtomicInteger();
        TransientProviderException last = new TransientProviderException("openai", Kind.SERVER_ERROR, "last");

        // when & then
        assertThatThrownBy(() -> executor.call(() -> {
            calls.incrementAndGet();
            throw calls.get() == 4 ? last : timeout();
        }, TRANSIENT)).isSameAs(last);
        assertThat(calls).hasValue(4);
        assertThat(waiter.delays()).containsExactly(
            Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
    }

    @Test
    void call_maxRetries_0이면_정확히_1회_호출() {
        // given
        RetryExecutor executor = executor(config(0));
        AtomicInteger calls = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> executor.call(() -> {
            calls.incrementAndGet();
            throw timeout();
        }, TRANSIENT)).isInstanceOf(TransientProviderException.class);
        assertThat(calls).hasValue(1);
        assertThat(waiter.delays()).isEmpty();
        verify(listener, never()).onRetry(any(), anyInt(), any());
    }

    @Test
    void call_한번_실패후_성공하면_리스너_1회_attempt_1() {
        // given
        RetryConfig config = config(1).withInitialDelay(Duration.ZERO);
        RetryExecutor executor = executor(config);
        AtomicInteger calls = new AtomicInteger();
        TransientProviderException failure = timeout();

        // when
        String result = executor.call(() -> {
            if (calls.incrementAndGet() == 1) {
                throw failure;
            }
            return "ok";
        }, TRANSIENT);

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(2);
        verify(listener, times(1)).onRetry(failure, 1, Duration.ZERO);
    }

    @Test
    void call_재시도_불가_예외는_대기없이_즉시_전파() {
        // given
        RetryExecutor executor = executor(config(3));
        AtomicInteger calls = new AtomicInteger();
        ProviderException badRequest = new ProviderException("openai", "HTTP 400");

        // when & then
        assertThatThrownBy(() -> executor.call(() -> {
            calls.incrementAndGet();
            throw badRequest;
        }, TRANSIENT)).isSameAs(badRequest);
        assertThat(calls).hasValue(1);
        assertThat(waiter.delays()).isEmpty();
    }

    @Test
    void call_shouldRetry가_거부하면_재시도하지_않음() {
        // given
        RetryExecutor executor = executor(config(3));
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.onAnyFailure()
            .withShouldRetry(error -> !error.getMessage().contains("400"));

        // when & then
        assertThatThrownBy(() -> executor.call(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("HTTP 400");
        }, policy)).isInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void call_리스너가_실패해도_재시도는_계속됨() {
        // given
        RetryExecutor executor = executor(config(2));
        doThrow(new IllegalStateException("listener bug")).when(listener).onRetry(any(), anyInt(), any());
        AtomicInteger calls = new AtomicInteger();

        // when
        String result = executor.call(() -> {
            if (calls.incrementAndGet() < 3) {
                throw timeout();
            }
            return "ok";
        }, TRANSIENT);

        // then
        assertThat(result).isEqualTo("ok");
        verify(listener).onRetry(any(), eq(1), any());
        verify(listener).onRetry(any(), eq(2), any());
    }

    @Test
    void call_retry_condition이_일치하지_않으면_재시도하지_않음() {
        // given
        RetryExecutor executor = executor(config(3).withRetryConditions(Set.of("rate_limit")));
        AtomicInteger calls = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> executor.call(() -> {
            calls.incrementAndGet();
            throw timeout();
        }, TRANSIENT)).isInstanceOf(TransientProviderException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void call_retry_condition은_Kind_또는_메시지로_일치() {
        // given
        RetryExecutor executor = executor(config(1).withRetryConditions(Set.of("RATE_LIMIT", "overloaded")));
        AtomicInteger kindCalls = new AtomicInteger();
        AtomicInteger messageCalls = new AtomicInteger();

        // when
        assertThatThrownBy(() -> executor.call(() -> {
            kindCalls.incrementAndGet();
            throw new TransientProviderException("openai", Kind.RATE_LIMIT, "HTTP 429");
        }, TRANSIENT)).isInstanceOf(TransientProviderException.class);
        assertThatThrownBy(() -> executor.call(() -> {
            messageCalls.incrementAndGet();
            throw new IllegalStateException("Server Overloaded");
        }, RetryPolicy.onAnyFailure())).isInstanceOf(IllegalStateException.class);

        // then
        assertThat(kindCalls).hasValue(2);
        assertThat(messageCalls).hasValue(2);
    }

    @Test
    void call_대기중_인터럽트되면_플래그_복원후_ProviderException() throws InterruptedException {
        // given
        RetryWaiter interrupting = new RetryWaiter() {
            @Override
            public void sleep(Duration delay) throws InterruptedException {
                throw new InterruptedException("stop");
            }

            @Override
            public CompletableFuture<Void> delay(Duration delay) {
                return CompletableFuture.completedFuture(null);
            }
        };
        RetryConfig config = config(3);
        RetryExecutor executor = new RetryExecutor(config, listener, interrupting, new BackoffCalculator(config));

        // when & then
        assertThatThrownBy(() -> executor.call(() -> {
            throw timeout();
        }, TRANSIENT))
            .isInstanceOf(ProviderException.class)
            .hasMessage("Retry wait interrupted");
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    // ============================================================
    // 2. 비동기 재시도
    // ============================================================

    @Test
    void callAsync_항상_실패하면_maxRetries_더하기_1회_호출() {
        // given
        RetryExecutor executor = executor(config(2));
        AtomicInteger calls = new AtomicInteger();

        // when
        CompletableFuture<String> future = executor.callAsync(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(timeout());
        }, TRANSIENT);

        // then
        assertThatThrownBy(future::get)
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(TransientProviderException.class);
        assertThat(calls).hasValue(3);
        assertThat(waiter.delays()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void callAsync_한번_실패후_성공() throws Exception {
        // given
        RetryExecutor executor = executor(config(1).withInitialDelay(Duration.ZERO));
        AtomicInteger calls = new AtomicInteger();

        // when
        CompletableFuture<String> future = executor.callAsync(() -> calls.incrementAndGet() == 1
            ? CompletableFuture.failedFuture(timeout())
            : CompletableFuture.completedFuture("ok"), TRANSIENT);

        // then
        assertThat(future.get()).isEqualTo("ok");
        assertThat(calls).hasValue(2);
        verify(listener).onRetry(any(TransientProviderException.class), eq(1), eq(Duration.ZERO));
    }

    @Test
    void callAsync_공급자가_동기적으로_던져도_실패한_Future로_반환() {
        // given
        RetryExecutor executor = executor(config(0));

        // when
        CompletableFuture<String> future = executor.callAsync(() -> {
            throw new ProviderException("openai", "boom");
        }, TRANSIENT);

        // then
        assertThat(future).isCompletedExceptionally();
    }

    @Test
    void callAsync_취소하면_진행중인_시도도_취소됨() {
        // given
        RetryExecutor executor = executor(config(3));
        CompletableFuture<String> inFlight = new CompletableFuture<>();

        // when
        CompletableFuture<String> future = executor.callAsync(() -> inFlight, TRANSIENT);
        future.cancel(true);

        // then
        assertThat(inFlight).isCancelled();
        assertThat(waiter.delays()).isEmpty();
    }
}
