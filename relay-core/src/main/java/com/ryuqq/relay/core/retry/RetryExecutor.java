package com.ryuqq.relay.core.retry;

import com.ryuqq.relay.core.config.RetryConfig;
import com.ryuqq.relay.core.exception.ProviderException;
import com.ryuqq.relay.core.exception.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 지수 백오프 재시도 실행기.
 *
 * <p>모든 Provider 호출은 이 실행기를 거칩니다. 동기 호출({@link #call})과
 * 비동기 호출({@link #callAsync})은 같은 {@link BackoffCalculator}와 같은 재시도 판단을 공유하며,
 * 대기 방식만 다릅니다 (블로킹 sleep vs. 지연 Future).</p>
 *
 * <p><strong>재시도 판단:</strong></p>
 * <ol>
 *   <li>예외가 {@link RetryPolicy#matches(Throwable)}를 만족해야 함</li>
 *   <li>retry condition이 설정된 경우 하나 이상 일치해야 함</li>
 *   <li>재시도 횟수가 maxRetries 이하여야 함</li>
 * </ol>
 *
 * <p>재시도 불가 예외는 대기 없이 즉시 전파되며, 재시도를 모두 소진하면
 * 마지막 예외가 변형 없이 전파됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryConfig config;
    private final RetryListener listener;
    private final RetryWaiter waiter;
    private final BackoffCalculator backoff;
    private final Set<String> conditions;

    /**
     * 기본 대기 방식 ({@link SystemRetryWaiter})으로 생성.
     *
     * @param config 재시도 설정
     * @param listener 재시도 콜백 (null이면 {@link RetryListener#NONE})
     */
    public RetryExecutor(RetryConfig config, RetryListener listener) {
        this(config, listener, SystemRetryWaiter.INSTANCE, config == null ? null : new BackoffCalculator(config));
    }

    /**
     * 생성자.
     *
     * @param config 재시도 설정
     * @param listener 재시도 콜백 (null이면 {@link RetryListener#NONE})
     * @param waiter 대기 방식
     * @param backoff 지연 시간 계산기
     * @throws IllegalArgumentException config, waiter, backoff가 null인 경우
     */
    public RetryExecutor(RetryConfig config, RetryListener listener, RetryWaiter waiter, BackoffCalculator backoff) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (waiter == null) {
            throw new IllegalArgumentException("waiter cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        this.config = config;
        this.listener = listener == null ? RetryListener.NONE : listener;
        this.waiter = waiter;
        this.backoff = backoff;
        this.conditions = config.retryConditions().stream()
            .map(condition -> condition.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * 동기 호출 (재시도 포함).
     *
     * @param <T> 결과 타입
     * @param callable 실행할 작업
     * @param policy 재시도 정책
     * @return 작업 결과
     * @throws RuntimeException 재시도 불가 예외 또는 재시도 소진 후 마지막 예외
     */
    public <T> T call(Supplier<T> callable, RetryPolicy policy) {
        if (callable == null) {
            throw new IllegalArgumentException("callable cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }

        int retries = 0;
        while (true) {
            try {
                return callable.get();
            } catch (RuntimeException e) {
                if (!shouldRetry(e, retries, policy)) {
                    throw e;
                }
                retries++;
                Duration delay = backoff.calculate(retries);
                notifyListener(e, retries, delay);
                sleep(delay, e);
            }
        }
    }

    /**
     * 비동기 호출 (재시도 포함).
     *
     * <p>반환된 Future를 취소하면 진행 중인 시도도 취소되고 이후 재시도는 시작되지 않습니다.</p>
     *
     * @param <T> 결과 타입
     * @param callable 비동기 작업 공급자 (시도마다 새로 호출)
     * @param policy 재시도 정책
     * @return 작업 결과 Future
     */
    public <T> CompletableFuture<T> callAsync(Supplier<? extends CompletionStage<T>> callable, RetryPolicy policy) {
        if (callable == null) {
            throw new IllegalArgumentException("callable cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        attemptAsync(callable, policy, 0, result);
        return result;
    }

    private <T> void attemptAsync(
        Supplier<? extends CompletionStage<T>> callable,
        RetryPolicy policy,
        int retries,
        CompletableFuture<T> result
    ) {
        if (result.isDone()) {
            return;
        }

        CompletableFuture<T> inFlight;
        try {
            inFlight = callable.get().toCompletableFuture();
        } catch (RuntimeException e) {
            inFlight = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> attempt = inFlight;
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                attempt.cancel(true);
            }
        });

        attempt.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (result.isDone() || cause instanceof CancellationException) {
                result.completeExceptionally(cause);
                return;
            }
            if (!(cause instanceof RuntimeException) || !shouldRetry((RuntimeException) cause, retries, policy)) {
                result.completeExceptionally(cause);
                return;
            }

            int next = retries + 1;
            Duration delay = backoff.calculate(next);
            notifyListener(cause, next, delay);
            waiter.delay(delay).whenComplete((done, waitError) -> {
                if (waitError != null) {
                    result.completeExceptionally(unwrap(waitError));
                } else {
                    attemptAsync(callable, policy, next, result);
                }
            });
        });
    }

    private boolean shouldRetry(RuntimeException error, int retries, RetryPolicy policy) {
        if (!policy.matches(error) || !matchesConditions(error)) {
            log.debug("Not retrying {}: {}", error.getClass().getSimpleName(), error.getMessage());
            return false;
        }
        if (retries >= config.maxRetries()) {
            if (config.maxRetries() > 0) {
                log.warn("Maximum retry attempts ({}) exceeded: {}", config.maxRetries(), error.getMessage());
            }
            return false;
        }
        return true;
    }

    private boolean matchesConditions(Throwable error) {
        if (conditions.isEmpty()) {
            return true;
        }
        if (error instanceof TransientProviderException
                && conditions.contains(((TransientProviderException) error).getKind().conditionName())) {
            return true;
        }
        String message = error.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String condition : conditions) {
            if (lower.contains(condition)) {
                return true;
            }
        }
        return false;
    }

    private void notifyListener(Throwable error, int attempt, Duration delay) {
        log.warn("Retry attempt {}/{} after {}ms: {}",
            attempt, config.maxRetries(), delay.toMillis(), error.getMessage());
        try {
            listener.onRetry(error, attempt, delay);
        } catch (RuntimeException e) {
            log.warn("Retry listener failed on attempt {}: {}", attempt, e.getMessage(), e);
        }
    }

    private void sleep(Duration delay, RuntimeException lastError) {
        try {
            waiter.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProviderException interrupted = new ProviderException(
                lastError instanceof ProviderException ? ((ProviderException) lastError).getProviderName() : null,
                "Retry wait interrupted",
                e
            );
            interrupted.addSuppressed(lastError);
            throw interrupted;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
