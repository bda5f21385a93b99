package com.graphrecall.model.entity;

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
 * Raw free-text statement as recorded by a user, persisted before any graph enrichment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("statements")
public class Statement {

    @Id
    private UUID id;

    @Column("user_id")
    private UUID userId;

    @Column("content")
    private String content;

    @Column("category")
    private String category;

    @Column("tags")
    private String tags;

    @Column("created_at")
    private LocalDateTime createdAt;
}
