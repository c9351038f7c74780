package com.ryuqq.relay.core.provider;

import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.Embedding;
import com.ryuqq.relay.core.model.EmbeddingRequest;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 텍스트 생성/임베딩 Provider.
 *
 * <p>호출자는 어떤 백엔드가 응답하는지 알 필요 없이 이 인터페이스만 사용합니다.
 * 모든 실패는 {@link com.ryuqq.relay.core.exception.ProviderException} 하위 타입으로 드러납니다.</p>
 *
 * <p><strong>구현 (sealed):</strong></p>
 * <ul>
 *   <li>{@link NetworkProvider}: 원격 백엔드 (재시도 포함), 백엔드마다 하위 클래스</li>
 *   <li>{@link NullProvider}: 모든 호출을 명확한 사유와 함께 거부</li>
 *   <li>{@link StubProvider}: 결정적 로컬 응답 (네트워크 없음)</li>
 *   <li>{@link FallbackProvider}: 여러 Provider를 순서대로 시도</li>
 * </ul>
 *
 * <p>동기 메서드와 비동기 메서드는 같은 결과와 같은 재시도/Circuit Breaker 동작을 가집니다.
 * 비동기 메서드는 실패를 예외로 던지지 않고 실패한 Future로 반환합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public sealed interface Provider permits NetworkProvider, NullProvider, StubProvider, FallbackProvider {

    /**
     * Provider 이름 (로그, Circuit Breaker, 오류 메시지에 사용).
     *
     * @return 이름
     */
    String name();

    /**
     * 텍스트 생성.
     *
     * @param request 생성 요청
     * @return 생성된 텍스트
     * @throws com.ryuqq.relay.core.exception.ProviderException 생성 실패 시
     */
    String complete(CompletionRequest request);

    /**
     * 텍스트 생성 (비동기).
     *
     * @param request 생성 요청
     * @return 생성된 텍스트 Future
     */
    CompletableFuture<String> completeAsync(CompletionRequest request);

    /**
     * 임베딩 생성 (입력 하나당 벡터 하나, 입력 순서 유지).
     *
     * @param request 임베딩 요청
     * @return 임베딩 목록
     * @throws com.ryuqq.relay.core.exception.ProviderException 생성 실패 시
     */
    List<Embedding> embed(EmbeddingRequest request);

    /**
     * 임베딩 생성 (비동기).
     *
     * @param request 임베딩 요청
     * @return 임베딩 목록 Future
     */
    CompletableFuture<List<Embedding>> embedAsync(EmbeddingRequest request);
}
