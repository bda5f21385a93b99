package com.graphrecall.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Equivalence class of entities believed to denote the same referent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AliasGroup {

    private UUID id;

    private UUID userId;

    private UUID canonicalEntityId;

    private LocalDateTime createdAt;
}
