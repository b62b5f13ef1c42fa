package com.researchmatch.embedding;

import com.researchmatch.exception.EmbeddingGenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Embedding generator for OpenAI-compatible /embeddings endpoints.
 */
@Slf4j
@Service
public class OpenAiEmbeddingGenerator implements EmbeddingGenerator {

    private final WebClient webClient;
    private final String model;

    public OpenAiEmbeddingGenerator(WebClient.Builder webClientBuilder,
                                    @Value("${researchmatch.embedding.api-url}") String apiUrl,
                                    @Value("${researchmatch.embedding.api-key}") String apiKey,
                                    @Value("${researchmatch.embedding.model:text-embedding-ada-002}") String model) {
        this.webClient = webClientBuilder
                .baseUrl(apiUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .build();
        this.model = model;
    }

    @Override
    public Mono<double[]> embed(String text) {
        Map<String, Object> requestBody = Map.of(
                "model", model,
                "input", text,
                "encoding_format", "float"
        );

        return webClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(Map.class)
                .map(this::extractEmbedding)
                .switchIfEmpty(Mono.error(() -> new EmbeddingGenerationException("Empty embedding response")))
                .onErrorMap(error -> !(error instanceof EmbeddingGenerationException),
                        error -> new EmbeddingGenerationException("Failed to generate embedding", error))
                .doOnError(error -> log.error("Failed to generate embedding with model {}", model, error));
    }

    private double[] extractEmbedding(Map<?, ?> response) {
        try {
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> data = (List<Map<String, Object>>) response.get("data");
            if (data != null && !data.isEmpty()) {
                @SuppressWarnings("unchecked")
                List<Number> embedding = (List<Number>) data.get(0).get("embedding");
                if (embedding != null && !embedding.isEmpty()) {
                    return embedding.stream()
                            .mapToDouble(Number::doubleValue)
                            .toArray();
                }
            }
        } catch (ClassCastException e) {
            throw new EmbeddingGenerationException("Malformed embedding response", e);
        }
        throw new EmbeddingGenerationException("Invalid embedding response");
    }
}
