package com.ryuqq.relay.core.provider;

import com.ryuqq.relay.core.model.ChatMessage;
import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.Embedding;
import com.ryuqq.relay.core.model.EmbeddingRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * StubProvider 유닛 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("StubProvider 테스트")
class StubProviderTest {

    private final StubProvider provider = new StubProvider();

    @Test
    void complete_이름과_프롬프트를_결정적으로_반환() {
        assertThat(provider.complete(CompletionRequest.of("hello")))
            .isEqualTo("[stub:stub-llm] hello");
        assertThat(provider.complete(CompletionRequest.of("hello", "be brief")))
            .isEqualTo("[sys:be brief] [stub:stub-llm] hello");
    }

    @Test
    void complete_대화_이력_수를_표시() {
        // given
        CompletionRequest request = CompletionRequest.ofConversation(List.of(
            ChatMessage.system("be brief"),
            ChatMessage.user("hi"),
            ChatMessage.assistant("hello")
        ), "again");

        // when
        String result = provider.complete(request);

        // then
        assertThat(result).isEqualTo("[sys:be brief] [ctx:2] [stub:stub-llm] again");
    }

    @Test
    void complete_maxTokens_글자수로_자름() {
        // given
        CompletionRequest request = CompletionRequest.of("hello world").withMaxTokens(10);

        // when
        String result = provider.complete(request);

        // then
        assertThat(result).isEqualTo("[stub:stub");
    }

    @Test
    void embed_SHA256_기반_8차원_벡터() {
        // when
        List<Embedding> first = provider.embed(EmbeddingRequest.of(List.of("abc", "def")));
        List<Embedding> second = provider.embed(EmbeddingRequest.of("abc"));

        // then
        assertThat(first).hasSize(2);
        assertThat(first.get(0).dimension()).isEqualTo(StubProvider.EMBEDDING_DIMENSION);
        assertThat(first.get(0)).isEqualTo(second.get(0));
        assertThat(first.get(0)).isNotEqualTo(first.get(1));
        // SHA-256("abc")의 첫 바이트는 0xba
        assertThat(first.get(0).vector().get(0)).isEqualTo(0xba / 255.0);
        assertThat(first.get(0).vector()).allSatisfy(value -> assertThat(value).isBetween(0.0, 1.0));
    }

    @Test
    void 비동기_호출은_동기와_같은_결과() throws Exception {
        CompletionRequest request = CompletionRequest.of("hello");

        assertThat(provider.completeAsync(request).get()).isEqualTo(provider.complete(request));
        assertThat(provider.embedAsync(EmbeddingRequest.of("x")).get())
            .isEqualTo(provider.embed(EmbeddingRequest.of("x")));
    }
}
