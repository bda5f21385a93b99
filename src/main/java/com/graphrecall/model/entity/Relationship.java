package com.graphrecall.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Directed, labeled edge between two entities of the same user,
 * unique per (userId, sourceEntityId, label, targetEntityId).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Relationship {

    private UUID id;

    private UUID userId;

    private UUID sourceEntityId;

    private UUID targetEntityId;

    private String label;

    private float[] labelEmbedding;

    // Elaborated meaning of the label alone, comparable across entity pairs
    private String description;

    private float[] descriptionEmbedding;

    private String originalInput;

    private LocalDateTime createdAt;

    // Populated by reads that join the entities table
    private String sourceName;

    private String targetName;

    public boolean hasDescription() {
        return description != null && descriptionEmbedding != null;
    }
}
