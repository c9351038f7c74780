/**
 * Provider 요청/응답 모델 패키지.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.model.ProviderType} - 지원 Provider 유형</li>
 *   <li>{@link com.ryuqq.relay.core.model.CompletionRequest} - 텍스트 생성 요청</li>
 *   <li>{@link com.ryuqq.relay.core.model.EmbeddingRequest} - 임베딩 요청</li>
 *   <li>{@link com.ryuqq.relay.core.model.Embedding} - 임베딩 벡터</li>
 * </ul>
 *
 * <p>모든 타입은 불변이며 생성자에서 유효성을 검증합니다.</p>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.model;
