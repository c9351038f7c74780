package com.ryuqq.relay.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 텍스트 생성 요청.
 *
 * <p>{@code context}는 시스템 프롬프트와 사용자 프롬프트 사이에 들어가는 대화 이력입니다.
 * 비어 있으면 단일 프롬프트 완료와 같습니다.</p>
 *
 * @param prompt 사용자 프롬프트
 * @param systemPrompt 시스템 프롬프트 (null 허용)
 * @param context 이전 대화 메시지 (순서 유지)
 * @param temperature 샘플링 온도 (0.0 ~ 2.0)
 * @param maxTokens 최대 생성 토큰 수 (양수)
 * @param parameters 백엔드별 추가 파라미터 (예: top_p), null 값 허용
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record CompletionRequest(
    String prompt,
    String systemPrompt,
    List<ChatMessage> context,
    double temperature,
    int maxTokens,
    Map<String, Object> parameters
) {

    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 2000;

    public CompletionRequest {
        if (prompt == null) {
            throw new IllegalArgumentException("prompt cannot be null");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException(
                "temperature must be between 0 and 2 (current: " + temperature + ")"
            );
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException(
                "maxTokens must be positive (current: " + maxTokens + ")"
            );
        }
        context = context == null ? List.of() : List.copyOf(context);
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * 프롬프트만으로 생성 (기본 temperature, maxTokens).
     *
     * @param prompt 사용자 프롬프트
     * @return CompletionRequest
     */
    public static CompletionRequest of(String prompt) {
        return of(prompt, null);
    }

    /**
     * 시스템 프롬프트 포함 생성.
     *
     * @param prompt 사용자 프롬프트
     * @param systemPrompt 시스템 프롬프트
     * @return CompletionRequest
     */
    public static CompletionRequest of(String prompt, String systemPrompt) {
        return new CompletionRequest(
            prompt, systemPrompt, List.of(), DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, Map.of()
        );
    }

    /**
     * 대화 이력에 이어지는 완료 요청 생성.
     *
     * <p>이력의 첫 메시지가 system 역할이면 시스템 프롬프트로 옮기고 나머지만 이력으로 남깁니다.</p>
     *
     * @param context 이전 대화 메시지
     * @param prompt 이번 사용자 프롬프트
     * @return CompletionRequest
     * @throws IllegalArgumentException context가 null인 경우
     */
    public static CompletionRequest ofConversation(List<ChatMessage> context, String prompt) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (!context.isEmpty() && context.get(0).isSystem()) {
            return of(prompt, context.get(0).content()).withContext(context.subList(1, context.size()));
        }
        return of(prompt).withContext(context);
    }

    public CompletionRequest withContext(List<ChatMessage> context) {
        return new CompletionRequest(prompt, systemPrompt, context, temperature, maxTokens, parameters);
    }

    public CompletionRequest withTemperature(double temperature) {
        return new CompletionRequest(prompt, systemPrompt, context, temperature, maxTokens, parameters);
    }

    public CompletionRequest withMaxTokens(int maxTokens) {
        return new CompletionRequest(prompt, systemPrompt, context, temperature, maxTokens, parameters);
    }

    public CompletionRequest withParameters(Map<String, Object> parameters) {
        return new CompletionRequest(prompt, systemPrompt, context, temperature, maxTokens, parameters);
    }
}
