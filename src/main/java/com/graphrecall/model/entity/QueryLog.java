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
 * Audit record of one answered (or unanswered) question.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("query_log")
public class QueryLog {

    @Id
    private UUID id;

    @Column("user_id")
    private UUID userId;

    @Column("question")
    private String question;

    @Column("result_count")
    private Integer resultCount;

    @Column("entities")
    private String entities; // JSON array

    @Column("relationship")
    private String relationship;

    @Column("search_description")
    private String searchDescription;

    @Column("created_at")
    private LocalDateTime createdAt;
}
