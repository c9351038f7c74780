package com.ryuqq.relay.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.relay.core.exception.ProviderException;
import com.ryuqq.relay.core.model.ChatMessage;
import com.ryuqq.relay.core.model.CompletionRequest;
import com.ryuqq.relay.core.model.Embedding;
import com.ryuqq.relay.core.model.EmbeddingRequest;
import com.ryuqq.relay.core.provider.NetworkProvider;
import com.ryuqq.relay.core.retry.RetryWaiter;
import com.ryuqq.relay.core.retry.SystemRetryWaiter;
import com.ryuqq.relay.core.spi.NetworkProviderSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * OpenAI 호환 HTTP API({@code /chat/completions}, {@code /embeddings})를 호출하는 Provider 기반 클래스.
 *
 * <p>호출 1회 = HTTP 요청 1회이며, 재시도는 {@link NetworkProvider}가 담당합니다.
 * 응답 상태와 전송 실패는 {@link HttpFailures}로 분류되어 재시도 여부가 결정됩니다.</p>
 *
 * <p><strong>요청 형식:</strong></p>
 * <pre>
 * POST {endpoint}/chat/completions
 * {"model": ..., "messages": [{"role": "system", ...}, {"role": "user", ...}],
 *  "temperature": ..., "max_tokens": ..., ...parameters}
 *
 * POST {endpoint}/embeddings
 * {"model": embeddingModel, "input": [...]}
 * </pre>
 *
 * <p>하위 클래스는 {@link #addHeaders(HttpRequest.Builder)}로 백엔드별 헤더를 추가할 수 있습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public abstract class OpenAiCompatibleProvider extends NetworkProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);

    static final String COMPLETIONS_PATH = "/chat/completions";
    static final String EMBEDDINGS_PATH = "/embeddings";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client;

    /**
     * 생성자.
     *
     * @param name Provider 이름
     * @param spec 생성 재료
     * @throws com.ryuqq.relay.core.exception.ConfigurationException TLS 설정을 적용할 수 없는 경우
     */
    protected OpenAiCompatibleProvider(String name, NetworkProviderSpec spec) {
        this(name, spec, SystemRetryWaiter.INSTANCE);
    }

    protected OpenAiCompatibleProvider(String name, NetworkProviderSpec spec, RetryWaiter waiter) {
        super(name, spec, waiter);
        HttpClient.Builder builder = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(spec.backend().connectTimeout());
        SslContextFactory.create(name, spec.tls()).ifPresent(builder::sslContext);
        this.client = builder.build();
    }

    /**
     * 백엔드별 추가 헤더.
     *
     * @param builder 요청 빌더
     */
    protected void addHeaders(HttpRequest.Builder builder) {
    }

    @Override
    protected String doComplete(CompletionRequest request) {
        return parseCompletion(send(post(COMPLETIONS_PATH, completionBody(request))));
    }

    @Override
    protected CompletableFuture<String> doCompleteAsync(CompletionRequest request) {
        return sendAsync(post(COMPLETIONS_PATH, completionBody(request)), this::parseCompletion);
    }

    @Override
    protected List<Embedding> doEmbed(EmbeddingRequest request) {
        return parseEmbeddings(send(post(EMBEDDINGS_PATH, embeddingBody(request))), request.inputs().size());
    }

    @Override
    protected CompletableFuture<List<Embedding>> doEmbedAsync(EmbeddingRequest request) {
        int expected = request.inputs().size();
        return sendAsync(post(EMBEDDINGS_PATH, embeddingBody(request)), response -> parseEmbeddings(response, expected));
    }

    // ==================== Request ====================

    private ObjectNode completionBody(CompletionRequest request) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", backend().model());
        ArrayNode messages = body.putArray("messages");
        if (request.systemPrompt() != null) {
            messages.addObject().put("role", "system").put("content", request.systemPrompt());
        }
        for (ChatMessage message : request.context()) {
            messages.addObject().put("role", message.role()).put("content", message.content());
        }
        messages.addObject().put("role", "user").put("content", request.prompt());
        body.put("temperature", request.temperature());
        body.put("max_tokens", request.maxTokens());
        // 추가 파라미터는 기본 필드(model 포함)를 덮어쓸 수 있음
        request.parameters().forEach((key, value) -> body.set(key, MAPPER.valueToTree(value)));
        return body;
    }

    private ObjectNode embeddingBody(EmbeddingRequest request) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", backend().embeddingModel());
        ArrayNode input = body.putArray("input");
        request.inputs().forEach(input::add);
        return body;
    }

    private HttpRequest post(String path, ObjectNode body) {
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(name(), "Failed to serialize request for " + name() + ": " + e.getOriginalMessage(), e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint(path))
            .timeout(backend().requestTimeout())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json));
        if (backend().hasApiKey()) {
            builder.header("Authorization", "Bearer " + backend().apiKey());
        }
        addHeaders(builder);
        return builder.build();
    }

    private URI endpoint(String path) {
        String base = backend().endpoint().toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    // ==================== Transport ====================

    private HttpResponse<String> send(HttpRequest request) {
        log.debug("{} POST {}", name(), request.uri());
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(name(), "Request to " + name() + " interrupted", e);
        } catch (IOException e) {
            throw HttpFailures.fromTransport(name(), e);
        }
    }

    private <T> CompletableFuture<T> sendAsync(HttpRequest request, Function<HttpResponse<String>, T> parser) {
        log.debug("{} POST {} (async)", name(), request.uri());
        CompletableFuture<HttpResponse<String>> exchange =
            client.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        CompletableFuture<T> result = exchange.handle((response, error) -> {
            if (error != null) {
                throw HttpFailures.fromTransport(name(), error);
            }
            return parser.apply(response);
        });
        result.whenComplete((value, error) -> {
            if (error instanceof CancellationException) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    // ==================== Response ====================

    private String parseCompletion(HttpResponse<String> response) {
        JsonNode root = readSuccessBody(response);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw malformed("missing choices[0].message.content");
        }
        return content.asText();
    }

    private List<Embedding> parseEmbeddings(HttpResponse<String> response, int expected) {
        JsonNode data = readSuccessBody(response).path("data");
        if (!data.isArray()) {
            throw malformed("missing data array");
        }
        if (data.size() != expected) {
            throw malformed("expected " + expected + " embeddings but received " + data.size());
        }
        List<JsonNode> items = new ArrayList<>();
        data.forEach(items::add);
        items.sort(Comparator.comparingInt(item -> item.path("index").asInt(0)));

        List<Embedding> embeddings = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            JsonNode vector = item.path("embedding");
            if (!vector.isArray()) {
                throw malformed("missing embedding vector");
            }
            List<Double> values = new ArrayList<>(vector.size());
            for (JsonNode value : vector) {
                if (!value.isNumber()) {
                    throw malformed("non-numeric embedding value: " + value);
                }
                values.add(value.asDouble());
            }
            embeddings.add(new Embedding(values));
        }
        return embeddings;
    }

    private JsonNode readSuccessBody(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw HttpFailures.fromStatus(name(), status, response.body(), MAPPER);
        }
        try {
            return MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ProviderException(name(),
                "Malformed response from " + name() + ": " + e.getOriginalMessage(), e);
        }
    }

    private ProviderException malformed(String detail) {
        return new ProviderException(name(), "Malformed response from " + name() + ": " + detail);
    }
}
