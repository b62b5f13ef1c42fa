package com.researchmatch.store;

import com.researchmatch.model.EmbeddingRecord;
import com.researchmatch.model.dto.EmbeddingPage;
import com.researchmatch.model.dto.EmbeddingSummary;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Keyed storage for embedding records with owner-scoped and name-based retrieval.
 *
 * <p>Each operation is atomic for a single record. Listing and name search
 * never load vectors; {@link #scanCandidates} and {@link #recentByOwner} do.
 */
public interface EmbeddingStore {

    /**
     * Create a new record. No deduplication is performed.
     */
    Mono<EmbeddingRecord> put(String companyName, String sourceText, double[] vector,
                              String ownerId, Map<String, Object> metadata);

    /**
     * Replace the source text and the whole vector of a record.
     *
     * @return the updated record, or empty if no record has this id
     */
    Mono<EmbeddingRecord> update(UUID id, String newSourceText, double[] newVector);

    /**
     * @return true if a record existed and was removed
     */
    Mono<Boolean> delete(UUID id);

    Mono<EmbeddingRecord> findById(UUID id);

    /**
     * One page of an owner's records, newest first.
     *
     * @param limit page size, at least 1
     * @param page 1-based page number
     */
    Mono<EmbeddingPage> listByOwner(String ownerId, int limit, int page);

    /**
     * Case-insensitive substring match on company name, newest first.
     */
    Flux<EmbeddingSummary> findByNameSubstring(String pattern, @Nullable String ownerId);

    /**
     * The owner's {@code count} most recent records, vectors included.
     */
    Flux<EmbeddingRecord> recentByOwner(String ownerId, int count);

    /**
     * Up to {@code cap} records with vectors, newest first, optionally
     * leaving out one owner's records.
     */
    Flux<EmbeddingRecord> scanCandidates(@Nullable String excludeOwnerId, int cap);
}
