package com.ryuqq.relay.core.model;

import java.util.List;

/**
 * 단일 입력에 대한 임베딩 벡터.
 *
 * @param vector 벡터 값
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Embedding(List<Double> vector) {

    public Embedding {
        if (vector == null) {
            throw new IllegalArgumentException("vector cannot be null");
        }
        vector = List.copyOf(vector);
    }

    public int dimension() {
        return vector.size();
    }
}
