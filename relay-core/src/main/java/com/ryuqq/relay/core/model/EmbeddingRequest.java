package com.ryuqq.relay.core.model;

import java.util.List;

/**
 * 임베딩 생성 요청.
 *
 * @param inputs 임베딩할 텍스트 목록 (1개 이상)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record EmbeddingRequest(List<String> inputs) {

    public EmbeddingRequest {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("inputs cannot be null or empty");
        }
        inputs = List.copyOf(inputs);
    }

    public static EmbeddingRequest of(String text) {
        return new EmbeddingRequest(List.of(text));
    }

    public static EmbeddingRequest of(List<String> texts) {
        return new EmbeddingRequest(texts);
    }
}
