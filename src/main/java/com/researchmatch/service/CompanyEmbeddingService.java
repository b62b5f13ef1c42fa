package com.researchmatch.service;

import com.researchmatch.config.SimilarityProperties;
import com.researchmatch.embedding.EmbeddingGenerator;
import com.researchmatch.model.EmbeddingRecord;
import com.researchmatch.model.dto.EmbeddingPage;
import com.researchmatch.model.dto.EmbeddingSummary;
import com.researchmatch.similarity.ProfileVectors;
import com.researchmatch.store.EmbeddingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Service for storing, updating and looking up embedded company research.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompanyEmbeddingService {

    private final EmbeddingStore embeddingStore;
    private final EmbeddingGenerator embeddingGenerator;
    private final SimilarityProperties properties;

    /**
     * Embed research text and store it as a new record.
     *
     * @param companyName Display name of the company
     * @param sourceText Research text to embed
     * @param ownerId User creating the record
     * @param metadata Optional tags, passed through unchanged
     * @return The stored record
     */
    public Mono<EmbeddingRecord> storeEmbedding(String companyName, String sourceText, String ownerId,
                                                Map<String, Object> metadata) {
        if (!StringUtils.hasText(companyName)) {
            return Mono.error(new IllegalArgumentException("Company name is required"));
        }
        if (!StringUtils.hasText(sourceText)) {
            return Mono.error(new IllegalArgumentException("Source text is required"));
        }
        if (!StringUtils.hasText(ownerId)) {
            return Mono.error(new IllegalArgumentException("Owner ID is required"));
        }

        return embeddingGenerator.embed(sourceText)
                .map(vector -> ProfileVectors.requireDimension(vector, properties.getDimension()))
                .flatMap(vector -> embeddingStore.put(companyName, sourceText, vector, ownerId, metadata))
                .doOnNext(saved -> log.info("Stored embedding {} for company '{}'", saved.getId(), companyName));
    }

    /**
     * Replace a record's source text and regenerate its vector.
     *
     * @param id Record ID
     * @param newSourceText Updated research text
     * @return The updated record, or empty if no such record exists
     */
    public Mono<EmbeddingRecord> updateEmbedding(UUID id, String newSourceText) {
        if (!StringUtils.hasText(newSourceText)) {
            return Mono.error(new IllegalArgumentException("Source text is required"));
        }

        return embeddingStore.findById(id)
                .flatMap(existing -> embeddingGenerator.embed(newSourceText))
                .map(vector -> ProfileVectors.requireDimension(vector, properties.getDimension()))
                .flatMap(vector -> embeddingStore.update(id, newSourceText, vector))
                .doOnNext(updated -> log.info("Updated embedding {}", id))
                .switchIfEmpty(Mono.fromRunnable(() -> log.warn("Embedding {} not found for update", id)));
    }

    /**
     * Delete a record.
     *
     * @param id Record ID
     * @return true if the record existed and was removed
     */
    public Mono<Boolean> deleteEmbedding(UUID id) {
        return embeddingStore.delete(id)
                .doOnNext(deleted -> {
                    if (deleted) {
                        log.info("Deleted embedding {}", id);
                    } else {
                        log.warn("Embedding {} not found for delete", id);
                    }
                });
    }

    /**
     * Look up a single record, vector included.
     */
    public Mono<EmbeddingRecord> getEmbedding(UUID id) {
        return embeddingStore.findById(id);
    }

    /**
     * List an owner's records without vectors, newest first.
     *
     * @param ownerId Owner ID
     * @param limit Page size
     * @param page 1-based page number
     * @return Records and pagination info
     */
    public Mono<EmbeddingPage> listByOwner(String ownerId, int limit, int page) {
        if (!StringUtils.hasText(ownerId)) {
            return Mono.error(new IllegalArgumentException("Owner ID is required"));
        }
        if (limit < 1) {
            return Mono.error(new IllegalArgumentException("Limit must be at least 1"));
        }
        if (page < 1) {
            return Mono.error(new IllegalArgumentException("Page must be at least 1"));
        }
        return embeddingStore.listByOwner(ownerId, limit, page);
    }

    public Mono<EmbeddingPage> listByOwner(String ownerId) {
        return listByOwner(ownerId, properties.getDefaultPageSize(), 1);
    }

    /**
     * Case-insensitive substring search on company name.
     *
     * @param pattern Text the company name must contain
     * @param ownerId Restrict to this owner, or null for all owners
     */
    public Flux<EmbeddingSummary> searchByName(String pattern, @Nullable String ownerId) {
        if (!StringUtils.hasText(pattern)) {
            return Flux.error(new IllegalArgumentException("Name pattern is required"));
        }
        return embeddingStore.findByNameSubstring(pattern, ownerId);
    }
}
