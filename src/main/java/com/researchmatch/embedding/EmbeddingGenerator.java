package com.researchmatch.embedding;

import reactor.core.publisher.Mono;

/**
 * Converts text to a fixed-length embedding vector.
 */
public interface EmbeddingGenerator {

    /**
     * Generate the embedding vector for a piece of text.
     *
     * @param text input text
     * @return the vector; errors with EmbeddingGenerationException on any provider failure
     */
    Mono<double[]> embed(String text);
}
