package com.graphrecall.gateway;

import com.graphrecall.exception.GatewayException;
import com.graphrecall.model.graph.ExtractedTriple;
import com.graphrecall.model.graph.ParsedQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway backed by an OpenAI-compatible HTTP API ({@code /chat/completions}, {@code /embeddings}).
 */
@Slf4j
@Service
public class OpenAiLanguageModelGateway implements LanguageModelGateway {

    private final WebClient webClient;
    private final GatewayResponseParser parser;
    private final String chatModel;
    private final String embeddingModel;
    private final double temperature;

    public OpenAiLanguageModelGateway(WebClient.Builder webClientBuilder,
                                      GatewayResponseParser parser,
                                      @Value("${graphrecall.llm.api-url}") String apiUrl,
                                      @Value("${graphrecall.llm.api-key}") String apiKey,
                                      @Value("${graphrecall.llm.chat-model}") String chatModel,
                                      @Value("${graphrecall.llm.embedding-model}") String embeddingModel,
                                      @Value("${graphrecall.llm.temperature:0}") double temperature) {
        this.webClient = webClientBuilder
                .baseUrl(apiUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
        this.parser = parser;
        this.chatModel = chatModel;
        this.embeddingModel = embeddingModel;
        this.temperature = temperature;
    }

    @Override
    public Mono<float[]> embed(String text) {
        Map<String, Object> requestBody = Map.of(
                "model", embeddingModel,
                "input", text,
                "encoding_format", "float"
        );

        return webClient.post()
                .uri("/embeddings")
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(Map.class)
                .map(this::toEmbedding)
                .onErrorMap(error -> !(error instanceof GatewayException),
                        error -> new GatewayException("embed", describe(error), error))
                .doOnError(error -> log.error("Failed to generate embedding", error));
    }

    @Override
    public Mono<List<ExtractedTriple>> extractTriples(String text, String username) {
        return chat("extractTriples", PromptTemplates.EXTRACTION_SYSTEM,
                PromptTemplates.extraction(text, username), true, 1000)
                .map(content -> parser.parseTriples(content, username))
                .doOnNext(triples -> log.debug("Extracted {} fragments from '{}'", triples.size(), text));
    }

    @Override
    public Mono<ParsedQuery> parseQuery(String question, String username) {
        return chat("parseQuery", PromptTemplates.QUERY_SYSTEM,
                PromptTemplates.query(question, username), true, 300)
                .map(content -> parser.parseQuery(content, username));
    }

    @Override
    public Mono<String> synthesize(String question, List<String> passages) {
        return chat("synthesize", PromptTemplates.ANSWER_SYSTEM,
                PromptTemplates.answer(question, passages), false, 300);
    }

    @Override
    public Mono<String> describeEntity(String name, String username, String context) {
        return chat("describeEntity", PromptTemplates.ENTITY_SYSTEM,
                PromptTemplates.entity(name, username, context), false, 60);
    }

    @Override
    public Mono<String> describeRelationship(String label) {
        return chat("describeRelationship", PromptTemplates.RELATIONSHIP_SYSTEM,
                PromptTemplates.relationship(label), false, 60);
    }

    @Override
    public Mono<String> summarizeDescription(String name, String description, int maxLength) {
        return chat("summarizeDescription", PromptTemplates.SUMMARY_SYSTEM,
                PromptTemplates.summary(name, description, maxLength), false, Math.max(100, maxLength / 3));
    }

    private Mono<String> chat(String operation, String system, String prompt, boolean jsonMode, int maxTokens) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", chatModel);
        requestBody.put("temperature", temperature);
        requestBody.put("max_tokens", maxTokens);
        requestBody.put("messages", List.of(
                Map.of("role", "system", "content", system),
                Map.of("role", "user", "content", prompt)
        ));
        if (jsonMode) {
            requestBody.put("response_format", Map.of("type", "json_object"));
        }

        return webClient.post()
                .uri("/chat/completions")
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(Map.class)
                .map(response -> toContent(operation, response))
                .onErrorMap(error -> !(error instanceof GatewayException),
                        error -> new GatewayException(operation, describe(error), error))
                .doOnError(error -> log.error("Chat completion failed during {}", operation, error));
    }

    private float[] toEmbedding(Map<?, ?> response) {
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> data = (List<Map<String, Object>>) response.get("data");
        if (data != null && !data.isEmpty()) {
            @SuppressWarnings("unchecked")
            List<Number> embedding = (List<Number>) data.get(0).get("embedding");
            if (embedding != null && !embedding.isEmpty()) {
                float[] vector = new float[embedding.size()];
                for (int i = 0; i < vector.length; i++) {
                    vector[i] = embedding.get(i).floatValue();
                }
                return vector;
            }
        }
        throw new GatewayException("embed", "Invalid embedding response");
    }

    private String toContent(String operation, Map<?, ?> response) {
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices != null && !choices.isEmpty()) {
            @SuppressWarnings("unchecked")
            Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
            Object content = message != null ? message.get("content") : null;
            if (content != null && !content.toString().isBlank()) {
                return content.toString().trim();
            }
        }
        throw new GatewayException(operation, "No content in completion response");
    }

    private static String describe(Throwable error) {
        if (error instanceof WebClientResponseException) {
            WebClientResponseException responseError = (WebClientResponseException) error;
            return responseError.getStatusCode() + " " + responseError.getResponseBodyAsString();
        }
        return error.getMessage();
    }
}
