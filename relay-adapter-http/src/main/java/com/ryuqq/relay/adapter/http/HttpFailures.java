package com.ryuqq.relay.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.relay.core.exception.ProviderException;
import com.ryuqq.relay.core.exception.TransientProviderException;
import com.ryuqq.relay.core.exception.TransientProviderException.Kind;

import java.io.IOException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * HTTP 응답/전송 실패를 Provider 예외로 분류.
 *
 * <ul>
 *   <li>429 → RATE_LIMIT (재시도)</li>
 *   <li>408 → TIMEOUT (재시도)</li>
 *   <li>5xx → SERVER_ERROR (재시도)</li>
 *   <li>그 외 4xx → ProviderException (재시도하지 않음)</li>
 *   <li>타임아웃 → TIMEOUT, 그 외 IOException → CONNECTION</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
final class HttpFailures {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private HttpFailures() {
    }

    static ProviderException fromStatus(String providerName, int status, String body, ObjectMapper mapper) {
        String message = "HTTP " + status + " from " + providerName + ": " + errorMessage(body, mapper);
        if (status == 429) {
            return new TransientProviderException(providerName, Kind.RATE_LIMIT, status, message, null);
        }
        if (status == 408) {
            return new TransientProviderException(providerName, Kind.TIMEOUT, status, message, null);
        }
        if (status >= 500) {
            return new TransientProviderException(providerName, Kind.SERVER_ERROR, status, message, null);
        }
        return new ProviderException(providerName, message);
    }

    static RuntimeException fromTransport(String providerName, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof ProviderException) {
            return (ProviderException) cause;
        }
        if (cause instanceof HttpConnectTimeoutException) {
            return new TransientProviderException(providerName, Kind.CONNECTION, null,
                "Connection to " + providerName + " timed out", cause);
        }
        if (cause instanceof HttpTimeoutException) {
            return new TransientProviderException(providerName, Kind.TIMEOUT, null,
                "Request to " + providerName + " timed out", cause);
        }
        if (cause instanceof IOException) {
            return new TransientProviderException(providerName, Kind.CONNECTION, null,
                "Connection to " + providerName + " failed: " + cause.getMessage(), cause);
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new ProviderException(providerName, providerName + " request failed: " + cause.getMessage(), cause);
    }

    private static String errorMessage(String body, ObjectMapper mapper) {
        if (body == null || body.isBlank()) {
            return "<empty body>";
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            return truncate(body);
        }
        JsonNode message = root.path("error").path("message");
        return message.isTextual() ? message.asText() : truncate(body);
    }

    private static String truncate(String body) {
        return body.length() > MAX_BODY_IN_MESSAGE ? body.substring(0, MAX_BODY_IN_MESSAGE) + "..." : body;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
