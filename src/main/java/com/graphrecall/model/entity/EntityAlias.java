package com.graphrecall.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Membership of one entity in one alias group. The entity id is the key,
 * so an entity can never sit in two groups at once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityAlias {

    private UUID entityId;

    private UUID aliasGroupId;

    private UUID userId;

    private LocalDateTime createdAt;
}
