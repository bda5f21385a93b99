package com.graphrecall.repository;

import com.graphrecall.model.entity.AliasGroup;
import com.graphrecall.model.entity.EntityAlias;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Storage for alias groups and their memberships.
 */
public interface AliasRepository {

    /**
     * Serialize alias changes of one user for the rest of the current transaction.
     */
    Mono<Void> lockUser(UUID userId);

    Mono<EntityAlias> findMembership(UUID entityId);

    Mono<AliasGroup> findGroup(UUID groupId);

    Mono<AliasGroup> createGroup(UUID userId, UUID canonicalEntityId);

    Mono<EntityAlias> addMember(UUID userId, UUID groupId, UUID entityId);

    Flux<EntityAlias> findMembers(UUID groupId);

    Mono<Long> countMembers(UUID groupId);

    /**
     * Move every member of {@code fromGroupId} into {@code toGroupId}.
     *
     * @return number of memberships moved
     */
    Mono<Long> reassignMembers(UUID fromGroupId, UUID toGroupId);

    Mono<Void> deleteGroup(UUID groupId);
}
