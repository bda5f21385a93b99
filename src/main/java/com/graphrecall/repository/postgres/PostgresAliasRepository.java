package com.graphrecall.repository.postgres;

import com.graphrecall.model.entity.AliasGroup;
import com.graphrecall.model.entity.EntityAlias;
import com.graphrecall.repository.AliasRepository;
import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Alias groups and memberships on PostgreSQL.
 * {@code entity_aliases.entity_id} is the primary key, which keeps membership a partition.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PostgresAliasRepository implements AliasRepository {

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Void> lockUser(UUID userId) {
        // Released automatically at commit or rollback
        return databaseClient.sql("SELECT pg_advisory_xact_lock(hashtextextended(:key, 0))")
                .bind("key", "alias:" + userId)
                .then();
    }

    @Override
    public Mono<EntityAlias> findMembership(UUID entityId) {
        return databaseClient.sql("SELECT entity_id, alias_group_id, user_id, created_at " +
                        "FROM entity_aliases WHERE entity_id = :entityId")
                .bind("entityId", entityId)
                .map((row, metadata) -> toMembership(row))
                .one();
    }

    @Override
    public Mono<AliasGroup> findGroup(UUID groupId) {
        return databaseClient.sql("SELECT id, user_id, canonical_entity_id, created_at FROM alias_groups WHERE id = :id")
                .bind("id", groupId)
                .map((row, metadata) -> AliasGroup.builder()
                        .id(row.get("id", UUID.class))
                        .userId(row.get("user_id", UUID.class))
                        .canonicalEntityId(row.get("canonical_entity_id", UUID.class))
                        .createdAt(row.get("created_at", LocalDateTime.class))
                        .build())
                .one();
    }

    @Override
    public Mono<AliasGroup> createGroup(UUID userId, UUID canonicalEntityId) {
        AliasGroup group = AliasGroup.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .canonicalEntityId(canonicalEntityId)
                .createdAt(LocalDateTime.now())
                .build();

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(
                        "INSERT INTO alias_groups (id, user_id, canonical_entity_id, created_at) " +
                        "VALUES (:id, :userId, :canonical, :createdAt)")
                .bind("id", group.getId())
                .bind("userId", userId)
                .bind("createdAt", group.getCreatedAt());
        spec = canonicalEntityId != null
                ? spec.bind("canonical", canonicalEntityId)
                : spec.bindNull("canonical", UUID.class);

        return spec.fetch().rowsUpdated().thenReturn(group);
    }

    @Override
    public Mono<EntityAlias> addMember(UUID userId, UUID groupId, UUID entityId) {
        EntityAlias membership = EntityAlias.builder()
                .entityId(entityId)
                .aliasGroupId(groupId)
                .userId(userId)
                .createdAt(LocalDateTime.now())
                .build();

        return databaseClient.sql("INSERT INTO entity_aliases (entity_id, alias_group_id, user_id, created_at) " +
                        "VALUES (:entityId, :groupId, :userId, :createdAt)")
                .bind("entityId", entityId)
                .bind("groupId", groupId)
                .bind("userId", userId)
                .bind("createdAt", membership.getCreatedAt())
                .fetch()
                .rowsUpdated()
                .thenReturn(membership);
    }

    @Override
    public Flux<EntityAlias> findMembers(UUID groupId) {
        return databaseClient.sql("SELECT entity_id, alias_group_id, user_id, created_at " +
                        "FROM entity_aliases WHERE alias_group_id = :groupId ORDER BY created_at")
                .bind("groupId", groupId)
                .map((row, metadata) -> toMembership(row))
                .all();
    }

    @Override
    public Mono<Long> countMembers(UUID groupId) {
        return databaseClient.sql("SELECT COUNT(*) AS total FROM entity_aliases WHERE alias_group_id = :groupId")
                .bind("groupId", groupId)
                .map((row, metadata) -> row.get("total", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    @Override
    public Mono<Long> reassignMembers(UUID fromGroupId, UUID toGroupId) {
        return databaseClient.sql("UPDATE entity_aliases SET alias_group_id = :toGroup WHERE alias_group_id = :fromGroup")
                .bind("toGroup", toGroupId)
                .bind("fromGroup", fromGroupId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<Void> deleteGroup(UUID groupId) {
        return databaseClient.sql("DELETE FROM alias_groups WHERE id = :id")
                .bind("id", groupId)
                .then();
    }

    private EntityAlias toMembership(Row row) {
        return EntityAlias.builder()
                .entityId(row.get("entity_id", UUID.class))
                .aliasGroupId(row.get("alias_group_id", UUID.class))
                .userId(row.get("user_id", UUID.class))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .build();
    }
}
