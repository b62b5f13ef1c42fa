package com.researchmatch.store;

import com.researchmatch.model.EmbeddingRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Brute-force retrieval: the newest {@code cap} records of the store.
 */
@Component
@RequiredArgsConstructor
public class ScanCandidateRetriever implements CandidateRetriever {

    private final EmbeddingStore embeddingStore;

    @Override
    public Flux<EmbeddingRecord> candidates(@Nullable String excludeOwnerId, int cap) {
        return embeddingStore.scanCandidates(excludeOwnerId, cap);
    }
}
