package com.researchmatch.store;

import com.researchmatch.model.EmbeddingRecord;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;

/**
 * Supplies the records a search or recommendation scores.
 */
public interface CandidateRetriever {

    /**
     * @param excludeOwnerId owner whose records must not be returned, or null
     * @param cap maximum number of candidates
     */
    Flux<EmbeddingRecord> candidates(@Nullable String excludeOwnerId, int cap);
}
