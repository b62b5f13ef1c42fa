package com.researchmatch.store;

import com.researchmatch.model.EmbeddingRecord;
import com.researchmatch.model.dto.EmbeddingPage;
import com.researchmatch.model.dto.EmbeddingSummary;
import com.researchmatch.model.dto.Pagination;
import com.researchmatch.model.entity.CompanyEmbedding;
import com.researchmatch.repository.CompanyEmbeddingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Embedding store backed by PostgreSQL through Spring Data R2DBC.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "researchmatch.store.type", havingValue = "r2dbc", matchIfMissing = true)
public class R2dbcEmbeddingStore implements EmbeddingStore {

    private final CompanyEmbeddingRepository repository;
    private final MetadataCodec metadataCodec;
    private final Clock clock;

    @Override
    public Mono<EmbeddingRecord> put(String companyName, String sourceText, double[] vector,
                                     String ownerId, Map<String, Object> metadata) {
        return Mono.fromCallable(() -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    return CompanyEmbedding.builder()
                            .companyName(companyName)
                            .sourceText(sourceText)
                            .embedding(box(vector))
                            .ownerId(ownerId)
                            .metadata(metadataCodec.serialize(metadata))
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                })
                .flatMap(repository::save)
                .map(this::toRecord);
    }

    @Override
    public Mono<EmbeddingRecord> update(UUID id, String newSourceText, double[] newVector) {
        return Mono.defer(() -> repository.updateContent(id, newSourceText, box(newVector), LocalDateTime.now(clock)))
                .flatMap(updated -> updated > 0 ? repository.findById(id) : Mono.empty())
                .map(this::toRecord);
    }

    @Override
    public Mono<Boolean> delete(UUID id) {
        return repository.removeById(id)
                .map(deleted -> deleted > 0);
    }

    @Override
    public Mono<EmbeddingRecord> findById(UUID id) {
        return repository.findById(id)
                .map(this::toRecord);
    }

    @Override
    public Mono<EmbeddingPage> listByOwner(String ownerId, int limit, int page) {
        long offset = (long) (page - 1) * limit;
        return repository.findSummariesByOwner(ownerId, limit, offset)
                .map(this::toSummary)
                .collectList()
                .zipWith(repository.countByOwnerId(ownerId))
                .map(tuple -> EmbeddingPage.builder()
                        .embeddings(tuple.getT1())
                        .pagination(Pagination.of(tuple.getT2(), page, limit))
                        .build());
    }

    @Override
    public Flux<EmbeddingSummary> findByNameSubstring(String pattern, @Nullable String ownerId) {
        String like = "%" + escapeLike(pattern) + "%";
        Flux<CompanyEmbedding> rows = ownerId == null
                ? repository.findSummariesByNameLike(like)
                : repository.findSummariesByNameLikeAndOwner(like, ownerId);
        return rows.map(this::toSummary);
    }

    @Override
    public Flux<EmbeddingRecord> recentByOwner(String ownerId, int count) {
        return repository.findRecentByOwner(ownerId, count)
                .map(this::toRecord);
    }

    @Override
    public Flux<EmbeddingRecord> scanCandidates(@Nullable String excludeOwnerId, int cap) {
        Flux<CompanyEmbedding> rows = excludeOwnerId == null
                ? repository.scan(cap)
                : repository.scanExcludingOwner(excludeOwnerId, cap);
        return rows.map(this::toRecord);
    }

    /**
     * Escape LIKE wildcards so the pattern matches literally.
     */
    static String escapeLike(String pattern) {
        return pattern.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    private EmbeddingRecord toRecord(CompanyEmbedding entity) {
        return EmbeddingRecord.builder()
                .id(entity.getId())
                .companyName(entity.getCompanyName())
                .sourceText(entity.getSourceText())
                .vector(unbox(entity.getEmbedding()))
                .ownerId(entity.getOwnerId())
                .metadata(metadataCodec.deserialize(entity.getMetadata()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private EmbeddingSummary toSummary(CompanyEmbedding entity) {
        return EmbeddingSummary.builder()
                .id(entity.getId())
                .companyName(entity.getCompanyName())
                .sourceText(entity.getSourceText())
                .ownerId(entity.getOwnerId())
                .metadata(metadataCodec.deserialize(entity.getMetadata()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private static Double[] box(double[] vector) {
        Double[] boxed = new Double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            boxed[i] = vector[i];
        }
        return boxed;
    }

    private static double[] unbox(Double[] vector) {
        if (vector == null) {
            return null;
        }
        double[] values = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            values[i] = vector[i];
        }
        return values;
    }
}
