package com.graphrecall.repository;

import com.graphrecall.model.entity.Relationship;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.UUID;

/**
 * Storage for relationship edges.
 */
public interface RelationshipRepository {

    /**
     * Insert a new edge.
     * Errors with {@link org.springframework.dao.DuplicateKeyException} when
     * (userId, source, label, target) already exists.
     */
    Mono<Relationship> insert(Relationship relationship);

    Mono<Relationship> findByKey(UUID userId, UUID sourceEntityId, String label, UUID targetEntityId);

    Mono<Relationship> findById(UUID relationshipId);

    /**
     * Edges of {@code userId} leaving any of {@code sourceEntityIds}, with entity names filled in.
     */
    Flux<Relationship> findOutgoing(UUID userId, Collection<UUID> sourceEntityIds);

    Mono<Relationship> updateDescription(UUID relationshipId, String description, float[] embedding);

    Flux<Relationship> findMissingDescriptions(UUID userId, int limit);

    Mono<Long> countByUser(UUID userId);
}
