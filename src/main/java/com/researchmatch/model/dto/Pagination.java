package com.researchmatch.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Paging information for owner-scoped listings. Pages are 1-based.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pagination {
    private long total;
    private int page;
    private int limit;
    private long pages;

    public static Pagination of(long total, int page, int limit) {
        return Pagination.builder()
                .total(total)
                .page(page)
                .limit(limit)
                .pages((total + limit - 1) / limit)
                .build();
    }
}
