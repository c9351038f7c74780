package com.ryuqq.relay.core.exception;

/**
 * Fallback 체인의 모든 후보가 실패함.
 *
 * <p>{@link #getProviderName()}은 마지막으로 시도한 Provider이며,
 * {@link #getCause()}는 그 Provider의 마지막 오류입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ProvidersExhaustedException extends ProviderException {

    private final int attempted;

    /**
     * 생성자.
     *
     * @param operation 작업 이름 (예: completion, embeddings)
     * @param lastProvider 마지막으로 시도한 Provider 이름
     * @param attempted 실제로 호출된 Provider 수 (Circuit OPEN으로 건너뛴 후보 제외)
     * @param lastError 마지막 오류
     */
    public ProvidersExhaustedException(String operation, String lastProvider, int attempted, Throwable lastError) {
        super(lastProvider,
            "All providers failed for " + operation + ". Last provider: " + lastProvider
                + ". Last error: " + (lastError == null ? "none" : lastError.getMessage()),
            lastError);
        this.attempted = attempted;
    }

    public int getAttempted() {
        return attempted;
    }
}
