package com.researchmatch.model;

import com.researchmatch.model.dto.EmbeddingSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A stored piece of company research together with its embedding vector.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingRecord {

    private UUID id;
    private String companyName;
    private String sourceText;
    private double[] vector;
    private String ownerId;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /**
     * The record without its vector payload.
     */
    public EmbeddingSummary toSummary() {
        return EmbeddingSummary.builder()
                .id(id)
                .companyName(companyName)
                .sourceText(sourceText)
                .ownerId(ownerId)
                .metadata(metadata)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
