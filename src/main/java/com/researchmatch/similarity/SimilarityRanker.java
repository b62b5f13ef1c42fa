package com.researchmatch.similarity;

import com.researchmatch.model.EmbeddingRecord;
import com.researchmatch.model.dto.SearchResult;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Scores candidates against a target vector and keeps the best ones.
 *
 * <p>Results are ordered by score descending; equal scores are ordered by
 * record id ascending so repeated calls over the same candidates agree.
 * A candidate with the wrong dimension fails the whole batch.
 */
public final class SimilarityRanker {

    private static final Comparator<SearchResult> RANKING =
            Comparator.comparing(SearchResult::getScore, Comparator.reverseOrder())
                    .thenComparing(SearchResult::getId);

    private SimilarityRanker() {
    }

    /**
     * @param target query or profile vector
     * @param candidates records to score, vectors included
     * @param threshold minimum score to keep (inclusive)
     * @param limit maximum number of results
     */
    public static List<SearchResult> rank(double[] target, List<EmbeddingRecord> candidates,
                                          double threshold, int limit) {
        return candidates.stream()
                .map(candidate -> SearchResult.of(candidate,
                        CosineSimilarity.between(target, candidate.getVector())))
                .filter(result -> result.getScore() >= threshold)
                .sorted(RANKING)
                .limit(limit)
                .collect(Collectors.toList());
    }
}
