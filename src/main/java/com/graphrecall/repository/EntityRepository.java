package com.graphrecall.repository;

import com.graphrecall.model.entity.Entity;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Storage for entities. Every lookup is scoped to one user.
 */
public interface EntityRepository {

    Mono<Entity> findByName(UUID userId, String name);

    Mono<Entity> findByNameIgnoreCase(UUID userId, String name);

    Mono<Entity> findById(UUID userId, UUID entityId);

    /**
     * Insert a new entity.
     * Errors with {@link org.springframework.dao.DuplicateKeyException} when (userId, name) is taken.
     */
    Mono<Entity> insert(Entity entity);

    /**
     * Replace the description only if the row is unchanged since it was read.
     *
     * @param seenUpdatedAt {@code updatedAt} of the row the new description was built from
     * @return the updated entity, or empty when another write got there first
     */
    Mono<Entity> updateDescription(UUID userId, UUID entityId, LocalDateTime seenUpdatedAt,
                                   String description, float[] embedding);

    /**
     * The user's entities ordered by cosine distance of their description embedding
     * to {@code embedding}, nearest first. No distance floor is applied.
     */
    Flux<Entity> findNearestByDescription(UUID userId, float[] embedding, int limit);

    Mono<Long> countByUser(UUID userId);
}
