package com.researchmatch.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of an owner's records.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingPage {
    private List<EmbeddingSummary> embeddings;
    private Pagination pagination;
}
