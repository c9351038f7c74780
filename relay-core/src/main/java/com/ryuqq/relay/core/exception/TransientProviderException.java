package com.ryuqq.relay.core.exception;

import java.util.Locale;

/**
 * 일시적 실패 (네트워크, 타임아웃, Rate Limit, 서버 오류).
 *
 * <p>RetryConfig에 따라 재시도 대상이며, Circuit Breaker 실패 카운트에 포함됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class TransientProviderException extends ProviderException {

    /**
     * 일시적 실패 유형.
     *
     * <p>{@link #conditionName()}은 RetryConfig의 retry condition 이름과 대응합니다.</p>
     */
    public enum Kind {
        TIMEOUT,
        RATE_LIMIT,
        CONNECTION,
        SERVER_ERROR;

        /**
         * retry condition 이름 (예: {@code rate_limit}).
         *
         * @return 소문자 condition 이름
         */
        public String conditionName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;
    private final Integer statusCode;

    public TransientProviderException(String providerName, Kind kind, String message) {
        this(providerName, kind, null, message, null);
    }

    public TransientProviderException(String providerName, Kind kind, Integer statusCode, String message, Throwable cause) {
        super(providerName, message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * HTTP 상태 코드.
     *
     * @return 상태 코드, 응답을 받지 못한 경우 null
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
