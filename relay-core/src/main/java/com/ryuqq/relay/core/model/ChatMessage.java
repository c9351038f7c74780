package com.ryuqq.relay.core.model;

/**
 * 대화 이력의 메시지 하나.
 *
 * @param role 역할 (system, user, assistant 등)
 * @param content 메시지 본문
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record ChatMessage(String role, String content) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public ChatMessage {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content);
    }

    public boolean isSystem() {
        return SYSTEM.equals(role);
    }
}
