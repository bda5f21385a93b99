package com.graphrecall.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Named referent in a user's graph, unique per (userId, name).
 * Note: the description embedding lives in a pgvector column,
 * so rows are mapped by hand in the postgres repository.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Entity {

    private UUID id;

    private UUID userId;

    private String name;

    private String description;

    private float[] descriptionEmbedding;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
