package com.researchmatch.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Row of the company_embeddings table.
 * The vector is a double precision[] column so values survive a round trip unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("company_embeddings")
public class CompanyEmbedding {

    @Id
    private UUID id;

    @Column("company_name")
    private String companyName;

    @Column("source_text")
    private String sourceText;

    // Left null by list queries, which do not select the column
    @Column("embedding")
    private Double[] embedding;

    @Column("owner_id")
    private String ownerId;

    @Column("metadata")
    private String metadata; // JSON string

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
