package com.researchmatch.repository;

import com.researchmatch.model.entity.CompanyEmbedding;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Repository for CompanyEmbedding entities.
 *
 * Listing and name queries leave out the embedding column; only
 * the candidate scans and the recent-history query load vectors.
 */
@Repository
public interface CompanyEmbeddingRepository extends ReactiveCrudRepository<CompanyEmbedding, UUID> {

    /**
     * Replace source text and vector of one record in a single statement.
     */
    @Modifying
    @Query("UPDATE company_embeddings SET source_text = :sourceText, embedding = :embedding, " +
            "updated_at = :updatedAt WHERE id = :id")
    Mono<Integer> updateContent(UUID id, String sourceText, Double[] embedding, LocalDateTime updatedAt);

    @Modifying
    @Query("DELETE FROM company_embeddings WHERE id = :id")
    Mono<Integer> removeById(UUID id);

    /**
     * Page of an owner's records without vectors, newest first.
     */
    @Query("SELECT id, company_name, source_text, owner_id, metadata, created_at, updated_at " +
            "FROM company_embeddings WHERE owner_id = :ownerId " +
            "ORDER BY created_at DESC, id ASC LIMIT :limit OFFSET :offset")
    Flux<CompanyEmbedding> findSummariesByOwner(String ownerId, int limit, long offset);

    Mono<Long> countByOwnerId(String ownerId);

    @Query("SELECT id, company_name, source_text, owner_id, metadata, created_at, updated_at " +
            "FROM company_embeddings WHERE company_name ILIKE :pattern ESCAPE '\\' " +
            "ORDER BY created_at DESC, id ASC")
    Flux<CompanyEmbedding> findSummariesByNameLike(String pattern);

    @Query("SELECT id, company_name, source_text, owner_id, metadata, created_at, updated_at " +
            "FROM company_embeddings WHERE company_name ILIKE :pattern ESCAPE '\\' AND owner_id = :ownerId " +
            "ORDER BY created_at DESC, id ASC")
    Flux<CompanyEmbedding> findSummariesByNameLikeAndOwner(String pattern, String ownerId);

    /**
     * Owner's most recent records with vectors.
     */
    @Query("SELECT * FROM company_embeddings WHERE owner_id = :ownerId " +
            "ORDER BY created_at DESC, id ASC LIMIT :count")
    Flux<CompanyEmbedding> findRecentByOwner(String ownerId, int count);

    @Query("SELECT * FROM company_embeddings ORDER BY created_at DESC, id ASC LIMIT :cap")
    Flux<CompanyEmbedding> scan(int cap);

    @Query("SELECT * FROM company_embeddings WHERE owner_id <> :excludeOwnerId " +
            "ORDER BY created_at DESC, id ASC LIMIT :cap")
    Flux<CompanyEmbedding> scanExcludingOwner(String excludeOwnerId, int cap);
}
