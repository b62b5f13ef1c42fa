package com.researchmatch.model.dto;

import com.researchmatch.model.EmbeddingRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Single ranked result of a search or recommendation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {
    private String id;
    private String companyName;
    private String sourceText;
    private String ownerId;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private Double score;

    public static SearchResult of(EmbeddingRecord record, double score) {
        return SearchResult.builder()
                .id(record.getId().toString())
                .companyName(record.getCompanyName())
                .sourceText(record.getSourceText())
                .ownerId(record.getOwnerId())
                .metadata(record.getMetadata())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .score(score)
                .build();
    }
}
