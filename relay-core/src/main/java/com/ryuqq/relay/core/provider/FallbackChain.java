package com.ryuqq.relay.core.provider;

import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.ProvidersExhaustedException;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * 순서대로 Provider를 시도하는 Fallback 알고리즘.
 *
 * <p>한 번의 시도는 네 단계로만 이루어집니다:
 * admit (Circuit Breaker 통과 확인) → success / failure / neutral (결과 기록).
 * 블로킹 드라이버와 CompletableFuture 드라이버가 같은 단계를 사용하므로
 * 동기/비동기 결과가 같습니다.</p>
 *
 * <p>한 시점에 진행 중인 시도는 최대 하나이며, 첫 성공에서 멈춥니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
final class FallbackChain {

    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    /**
     * 체인 구성원 (Provider와 전용 Circuit Breaker).
     */
    record Member(Provider provider, CircuitBreaker breaker) {
    }

    private final List<Member> members;

    FallbackChain(List<Member> members) {
        this.members = List.copyOf(members);
    }

    List<Member> members() {
        return members;
    }

    /**
     * 블로킹 드라이버.
     *
     * <p>{@link Error}는 실패로 기록한 뒤 다음 후보로 넘어가지 않고 그대로 전파합니다.</p>
     */
    <T> T call(String operation, Function<Provider, T> invocation) {
        Attempts attempts = new Attempts(operation);
        for (Member member : members) {
            if (!attempts.admit(member)) {
                continue;
            }
            T result;
            try {
                result = invocation.apply(member.provider());
            } catch (RuntimeException e) {
                attempts.failure(member, e);
                continue;
            } catch (Error e) {
                attempts.failure(member, e);
                throw e;
            }
            attempts.success(member);
            return result;
        }
        throw attempts.exhausted();
    }

    /**
     * CompletableFuture 드라이버.
     *
     * <p>반환된 Future를 취소하면 진행 중인 시도를 취소하고, 이후 후보는 시도하지 않으며,
     * Circuit Breaker 카운터는 변경하지 않습니다.</p>
     */
    <T> CompletableFuture<T> callAsync(String operation, Function<Provider, CompletableFuture<T>> invocation) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attemptFrom(0, new Attempts(operation), invocation, result);
        return result;
    }

    private <T> void attemptFrom(
        int index,
        Attempts attempts,
        Function<Provider, CompletableFuture<T>> invocation,
        CompletableFuture<T> result
    ) {
        for (int i = index; i < members.size(); i++) {
            if (result.isDone()) {
                return;
            }
            Member member = members.get(i);
            if (!attempts.admit(member)) {
                continue;
            }

            CompletableFuture<T> inFlight;
            try {
                inFlight = invocation.apply(member.provider());
            } catch (RuntimeException | Error e) {
                inFlight = CompletableFuture.failedFuture(e);
            }

            CompletableFuture<T> attempt = inFlight;
            int next = i + 1;
            result.whenComplete((ignored, error) -> {
                if (result.isCancelled()) {
                    attempt.cancel(true);
                }
            });
            attempt.whenComplete((value, error) -> {
                Throwable cause = error == null ? null : unwrap(error);
                if (result.isDone() || cause instanceof CancellationException) {
                    attempts.neutral(member);
                    if (cause != null) {
                        result.completeExceptionally(cause);
                    }
                    return;
                }
                if (cause == null) {
                    attempts.success(member);
                    result.complete(value);
                    return;
                }
                attempts.failure(member, cause);
                if (cause instanceof Error) {
                    result.completeExceptionally(cause);
                    return;
                }
                attemptFrom(next, attempts, invocation, result);
            });
            return;
        }
        if (!result.isDone()) {
            result.completeExceptionally(attempts.exhausted());
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

    /**
     * 한 번의 Fallback 실행 상태 (마지막 Provider, 마지막 오류, 실제 호출 수).
     *
     * <p>시도는 순차적이므로 동기화가 필요 없습니다.</p>
     */
    private static final class Attempts {

        private final String operation;
        private String lastProvider;
        private Throwable lastError;
        private int attempted;

        Attempts(String operation) {
            this.operation = operation;
        }

        boolean admit(Member member) {
            CircuitBreaker breaker = member.breaker();
            if (breaker.tryAcquire()) {
                attempted++;
                lastProvider = member.provider().name();
                log.debug("Trying provider {} for {}", lastProvider, operation);
                return true;
            }
            lastProvider = member.provider().name();
            lastError = new CircuitOpenException(lastProvider, breaker.getRemainingOpenTime());
            log.warn("Skipping provider {} for {}: circuit breaker is open", lastProvider, operation);
            return false;
        }

        void success(Member member) {
            member.breaker().recordSuccess();
        }

        void failure(Member member, Throwable error) {
            member.breaker().recordFailure(error);
            lastProvider = member.provider().name();
            lastError = error;
            log.warn("Provider {} failed for {}, trying next provider: {}",
                lastProvider, operation, error.getMessage());
        }

        void neutral(Member member) {
            member.breaker().releasePermit();
            log.debug("Attempt on provider {} for {} cancelled", member.provider().name(), operation);
        }

        ProvidersExhaustedException exhausted() {
            log.error("All providers failed for {}. Last provider: {}", operation, lastProvider);
            return new ProvidersExhaustedException(operation, lastProvider, attempted, lastError);
        }
    }
}
