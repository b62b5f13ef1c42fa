package com.researchmatch.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Stored record as returned by list and name-search operations, without the vector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingSummary {
    private UUID id;
    private String companyName;
    private String sourceText;
    private String ownerId;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
