package com.graphrecall.repository.postgres;

import com.graphrecall.model.entity.Relationship;
import com.graphrecall.repository.RelationshipRepository;
import com.graphrecall.util.VectorUtil;
import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.UUID;

/**
 * Relationship storage on PostgreSQL. Reads join both endpoint entities so
 * callers get names without a second round trip.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PostgresRelationshipRepository implements RelationshipRepository {

    private static final String SELECT = "SELECT r.id, r.user_id, r.source_entity_id, r.target_entity_id, " +
            "r.relationship, r.relationship_vec::text AS relationship_vec, r.relationship_desc, " +
            "r.relationship_desc_vec::text AS relationship_desc_vec, r.original_input, r.created_at, " +
            "s.name AS source_name, t.name AS target_name " +
            "FROM relationships r " +
            "JOIN entities s ON s.id = r.source_entity_id AND s.user_id = r.user_id " +
            "JOIN entities t ON t.id = r.target_entity_id AND t.user_id = r.user_id ";

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Relationship> insert(Relationship relationship) {
        Relationship toSave = relationship.toBuilder()
                .id(relationship.getId() != null ? relationship.getId() : UUID.randomUUID())
                .createdAt(LocalDateTime.now())
                .build();

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(
                        "INSERT INTO relationships (id, user_id, source_entity_id, target_entity_id, relationship, " +
                        "relationship_vec, relationship_desc, relationship_desc_vec, original_input, created_at) " +
                        "VALUES (:id, :userId, :sourceId, :targetId, :label, CAST(:labelVec AS vector), " +
                        ":description, CAST(:descVec AS vector), :originalInput, :createdAt)")
                .bind("id", toSave.getId())
                .bind("userId", toSave.getUserId())
                .bind("sourceId", toSave.getSourceEntityId())
                .bind("targetId", toSave.getTargetEntityId())
                .bind("label", toSave.getLabel())
                .bind("originalInput", toSave.getOriginalInput())
                .bind("createdAt", toSave.getCreatedAt());
        spec = PostgresBindings.bindVector(spec, "labelVec", toSave.getLabelEmbedding());
        spec = PostgresBindings.bindText(spec, "description", toSave.getDescription());
        spec = PostgresBindings.bindVector(spec, "descVec", toSave.getDescriptionEmbedding());

        return spec.fetch()
                .rowsUpdated()
                .thenReturn(toSave);
    }

    @Override
    public Mono<Relationship> findByKey(UUID userId, UUID sourceEntityId, String label, UUID targetEntityId) {
        return databaseClient.sql(SELECT + "WHERE r.user_id = :userId AND r.source_entity_id = :sourceId " +
                        "AND r.relationship = :label AND r.target_entity_id = :targetId")
                .bind("userId", userId)
                .bind("sourceId", sourceEntityId)
                .bind("label", label)
                .bind("targetId", targetEntityId)
                .map((row, metadata) -> toRelationship(row))
                .one();
    }

    @Override
    public Mono<Relationship> findById(UUID relationshipId) {
        return databaseClient.sql(SELECT + "WHERE r.id = :id")
                .bind("id", relationshipId)
                .map((row, metadata) -> toRelationship(row))
                .one();
    }

    @Override
    public Flux<Relationship> findOutgoing(UUID userId, Collection<UUID> sourceEntityIds) {
        if (sourceEntityIds.isEmpty()) {
            return Flux.empty();
        }
        return databaseClient.sql(SELECT + "WHERE r.user_id = :userId AND r.source_entity_id IN (:sourceIds)")
                .bind("userId", userId)
                .bind("sourceIds", sourceEntityIds)
                .map((row, metadata) -> toRelationship(row))
                .all();
    }

    @Override
    public Mono<Relationship> updateDescription(UUID relationshipId, String description, float[] embedding) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(
                        "UPDATE relationships SET relationship_desc = :description, " +
                        "relationship_desc_vec = CAST(:vec AS vector) WHERE id = :id")
                .bind("id", relationshipId);
        spec = PostgresBindings.bindText(spec, "description", description);
        spec = PostgresBindings.bindVector(spec, "vec", embedding);

        return spec.fetch()
                .rowsUpdated()
                .then(findById(relationshipId));
    }

    @Override
    public Flux<Relationship> findMissingDescriptions(UUID userId, int limit) {
        return databaseClient.sql(SELECT + "WHERE r.user_id = :userId AND r.relationship_desc IS NULL " +
                        "ORDER BY r.created_at LIMIT :limit")
                .bind("userId", userId)
                .bind("limit", limit)
                .map((row, metadata) -> toRelationship(row))
                .all();
    }

    @Override
    public Mono<Long> countByUser(UUID userId) {
        return databaseClient.sql("SELECT COUNT(*) AS total FROM relationships WHERE user_id = :userId")
                .bind("userId", userId)
                .map((row, metadata) -> row.get("total", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    private Relationship toRelationship(Row row) {
        return Relationship.builder()
                .id(row.get("id", UUID.class))
                .userId(row.get("user_id", UUID.class))
                .sourceEntityId(row.get("source_entity_id", UUID.class))
                .targetEntityId(row.get("target_entity_id", UUID.class))
                .label(row.get("relationship", String.class))
                .labelEmbedding(VectorUtil.parse(row.get("relationship_vec", String.class)))
                .description(row.get("relationship_desc", String.class))
                .descriptionEmbedding(VectorUtil.parse(row.get("relationship_desc_vec", String.class)))
                .originalInput(row.get("original_input", String.class))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .sourceName(row.get("source_name", String.class))
                .targetName(row.get("target_name", String.class))
                .build();
    }
}
