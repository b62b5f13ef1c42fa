package com.researchmatch.service;

import com.researchmatch.config.SimilarityProperties;
import com.researchmatch.embedding.EmbeddingGenerator;
import com.researchmatch.model.EmbeddingRecord;
import com.researchmatch.model.dto.SearchResult;
import com.researchmatch.similarity.ProfileVectors;
import com.researchmatch.similarity.SimilarityRanker;
import com.researchmatch.store.CandidateRetriever;
import com.researchmatch.store.EmbeddingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;

/**
 * Semantic search and recommendations over stored company research.
 *
 * <p>Both operations score a bounded window of candidates (see
 * {@link SimilarityProperties}), so results are exact only among the
 * candidates retrieved, not across the whole store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimilaritySearchService {

    private final EmbeddingStore embeddingStore;
    private final CandidateRetriever candidateRetriever;
    private final EmbeddingGenerator embeddingGenerator;
    private final SimilarityProperties properties;

    /**
     * Find the records most similar to a query text.
     *
     * @param queryText Text to embed and compare against
     * @param limit Maximum number of results
     * @param threshold Minimum similarity score (inclusive)
     * @param excludeOwnerId Leave out this owner's records, or null
     * @return Results ordered by score descending
     */
    public Mono<List<SearchResult>> search(String queryText, int limit, double threshold,
                                           @Nullable String excludeOwnerId) {
        if (!StringUtils.hasText(queryText)) {
            return Mono.error(new IllegalArgumentException("Query is required"));
        }
        if (limit < 1) {
            return Mono.error(new IllegalArgumentException("Limit must be at least 1"));
        }

        int cap = properties.getSearchCandidateCap();
        return embeddingGenerator.embed(queryText)
                .map(vector -> ProfileVectors.requireDimension(vector, properties.getDimension()))
                .zipWhen(queryVector -> candidateRetriever.candidates(excludeOwnerId, cap).collectList())
                .map(tuple -> rank(tuple.getT1(), tuple.getT2(), threshold, limit))
                .doOnNext(results -> log.debug("Search returned {} results", results.size()));
    }

    public Mono<List<SearchResult>> search(String queryText) {
        return search(queryText, properties.getDefaultSearchLimit(),
                properties.getDefaultSearchThreshold(), null);
    }

    /**
     * Recommend other users' records similar to an owner's recent research.
     *
     * @param ownerId Owner to recommend for; their own records are never returned
     * @param limit Maximum number of results
     * @return Results ordered by score descending, empty if the owner has no records
     */
    public Mono<List<SearchResult>> recommend(String ownerId, int limit) {
        if (!StringUtils.hasText(ownerId)) {
            return Mono.error(new IllegalArgumentException("Owner ID is required"));
        }
        if (limit < 1) {
            return Mono.error(new IllegalArgumentException("Limit must be at least 1"));
        }

        return embeddingStore.recentByOwner(ownerId, properties.getRecommendationHistorySize())
                .map(EmbeddingRecord::getVector)
                .collectList()
                .flatMap(history -> {
                    if (history.isEmpty()) {
                        log.debug("No history for owner {}, nothing to recommend", ownerId);
                        return Mono.just(Collections.<SearchResult>emptyList());
                    }

                    double[] profile = ProfileVectors.average(history);
                    return candidateRetriever.candidates(ownerId, properties.getRecommendationCandidateCap())
                            .collectList()
                            .map(candidates -> rank(profile, candidates,
                                    properties.getRecommendationThreshold(), limit));
                })
                .doOnNext(results -> log.debug("Recommended {} records for owner {}", results.size(), ownerId));
    }

    public Mono<List<SearchResult>> recommend(String ownerId) {
        return recommend(ownerId, properties.getDefaultRecommendationLimit());
    }

    private List<SearchResult> rank(double[] target, List<EmbeddingRecord> candidates,
                                    double threshold, int limit) {
        log.debug("Scoring {} candidates (threshold {}, limit {})", candidates.size(), threshold, limit);
        return SimilarityRanker.rank(target, candidates, threshold, limit);
    }
}
