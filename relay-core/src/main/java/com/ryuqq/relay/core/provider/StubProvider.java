package com.ryuqq.relay.core.provider;

import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.Embedding;
import com.ryuqq.relay.core.model.EmbeddingRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 결정적 로컬 Provider (테스트, 오프라인 개발용).
 *
 * <ul>
 *   <li>네트워크 호출 없음</li>
 *   <li>complete: {@code [sys:<system>] [ctx:<이력 수>] [stub:<name>] <prompt>}, maxTokens 글자로 자름</li>
 *   <li>embed: 입력의 SHA-256 앞 8바이트를 [0, 1] 실수로 변환</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class StubProvider implements Provider {

    public static final String DEFAULT_NAME = "stub-llm";
    public static final int EMBEDDING_DIMENSION = 8;

    private final String name;

    public StubProvider() {
        this(DEFAULT_NAME);
    }

    public StubProvider(String name) {
        this.name = name == null || name.isBlank() ? DEFAULT_NAME : name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(CompletionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        String system = request.systemPrompt() == null || request.systemPrompt().isEmpty()
            ? ""
            : "[sys:" + request.systemPrompt() + "] ";
        String context = request.context().isEmpty() ? "" : "[ctx:" + request.context().size() + "] ";
        String text = system + context + "[stub:" + name + "] " + request.prompt();
        return text.length() > request.maxTokens() ? text.substring(0, request.maxTokens()) : text;
    }

    @Override
    public CompletableFuture<String> completeAsync(CompletionRequest request) {
        try {
            return CompletableFuture.completedFuture(complete(request));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public List<Embedding> embed(EmbeddingRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        List<Embedding> embeddings = new ArrayList<>(request.inputs().size());
        for (String input : request.inputs()) {
            embeddings.add(new Embedding(digest(input)));
        }
        return embeddings;
    }

    @Override
    public CompletableFuture<List<Embedding>> embedAsync(EmbeddingRequest request) {
        try {
            return CompletableFuture.completedFuture(embed(request));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static List<Double> digest(String input) {
        byte[] hash;
        try {
            hash = MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // 모든 JRE가 SHA-256을 제공해야 함
            throw new IllegalStateException("SHA-256 not available", e);
        }
        List<Double> vector = new ArrayList<>(EMBEDDING_DIMENSION);
        for (int i = 0; i < EMBEDDING_DIMENSION; i++) {
            vector.add((hash[i] & 0xFF) / 255.0);
        }
        return vector;
    }

    @Override
    public String toString() {
        return "StubProvider{name=" + name + "}";
    }
}
