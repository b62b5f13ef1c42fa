package com.researchmatch.store;

import com.researchmatch.model.EmbeddingRecord;
import com.researchmatch.model.dto.EmbeddingPage;
import com.researchmatch.model.dto.EmbeddingSummary;
import com.researchmatch.model.dto.Pagination;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Process-local embedding store for development and tests.
 *
 * Vectors are copied on the way in and out so callers cannot modify stored records.
 */
@Component
@ConditionalOnProperty(name = "researchmatch.store.type", havingValue = "memory")
public class InMemoryEmbeddingStore implements EmbeddingStore {

    private static final Comparator<EmbeddingRecord> NEWEST_FIRST =
            Comparator.comparing(EmbeddingRecord::getCreatedAt, Comparator.reverseOrder())
                    .thenComparing(EmbeddingRecord::getId);

    private final ConcurrentMap<UUID, EmbeddingRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEmbeddingStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<EmbeddingRecord> put(String companyName, String sourceText, double[] vector,
                                     String ownerId, Map<String, Object> metadata) {
        return Mono.fromSupplier(() -> {
            LocalDateTime now = LocalDateTime.now(clock);
            EmbeddingRecord record = EmbeddingRecord.builder()
                    .id(UUID.randomUUID())
                    .companyName(companyName)
                    .sourceText(sourceText)
                    .vector(vector.clone())
                    .ownerId(ownerId)
                    .metadata(metadata == null ? null : Collections.unmodifiableMap(new HashMap<>(metadata)))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            records.put(record.getId(), record);
            return copy(record);
        });
    }

    @Override
    public Mono<EmbeddingRecord> update(UUID id, String newSourceText, double[] newVector) {
        return Mono.fromSupplier(() -> records.computeIfPresent(id, (key, existing) -> existing.toBuilder()
                        .sourceText(newSourceText)
                        .vector(newVector.clone())
                        .updatedAt(LocalDateTime.now(clock))
                        .build()))
                .map(InMemoryEmbeddingStore::copy);
    }

    @Override
    public Mono<Boolean> delete(UUID id) {
        return Mono.fromSupplier(() -> records.remove(id) != null);
    }

    @Override
    public Mono<EmbeddingRecord> findById(UUID id) {
        return Mono.fromSupplier(() -> records.get(id))
                .map(InMemoryEmbeddingStore::copy);
    }

    @Override
    public Mono<EmbeddingPage> listByOwner(String ownerId, int limit, int page) {
        return Mono.fromSupplier(() -> {
            List<EmbeddingRecord> owned = newestFirst(records.values().stream()
                    .filter(record -> record.getOwnerId().equals(ownerId)));
            List<EmbeddingSummary> embeddings = owned.stream()
                    .skip((long) (page - 1) * limit)
                    .limit(limit)
                    .map(EmbeddingRecord::toSummary)
                    .collect(Collectors.toList());
            return EmbeddingPage.builder()
                    .embeddings(embeddings)
                    .pagination(Pagination.of(owned.size(), page, limit))
                    .build();
        });
    }

    @Override
    public Flux<EmbeddingSummary> findByNameSubstring(String pattern, @Nullable String ownerId) {
        String needle = pattern.toLowerCase(Locale.ROOT);
        return Flux.defer(() -> Flux.fromIterable(newestFirst(records.values().stream()
                        .filter(record -> ownerId == null || record.getOwnerId().equals(ownerId))
                        .filter(record -> record.getCompanyName().toLowerCase(Locale.ROOT).contains(needle)))))
                .map(EmbeddingRecord::toSummary);
    }

    @Override
    public Flux<EmbeddingRecord> recentByOwner(String ownerId, int count) {
        return Flux.defer(() -> Flux.fromIterable(newestFirst(records.values().stream()
                        .filter(record -> record.getOwnerId().equals(ownerId)))))
                .take(count)
                .map(InMemoryEmbeddingStore::copy);
    }

    @Override
    public Flux<EmbeddingRecord> scanCandidates(@Nullable String excludeOwnerId, int cap) {
        return Flux.defer(() -> Flux.fromIterable(newestFirst(records.values().stream()
                        .filter(record -> excludeOwnerId == null || !record.getOwnerId().equals(excludeOwnerId)))))
                .take(cap)
                .map(InMemoryEmbeddingStore::copy);
    }

    private static List<EmbeddingRecord> newestFirst(Stream<EmbeddingRecord> stream) {
        return stream.sorted(NEWEST_FIRST).collect(Collectors.toList());
    }

    private static EmbeddingRecord copy(EmbeddingRecord record) {
        return record.toBuilder()
                .vector(record.getVector().clone())
                .build();
    }
}
