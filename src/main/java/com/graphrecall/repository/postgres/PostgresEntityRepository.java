package com.graphrecall.repository.postgres;

import com.graphrecall.model.entity.Entity;
import com.graphrecall.repository.EntityRepository;
import com.graphrecall.util.VectorUtil;
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
 * Entity storage on PostgreSQL with the description embedding in a pgvector column.
 *
 * R2DBC has no pgvector codec, so vectors are written as text literals cast to
 * {@code vector} and read back through {@code ::text}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PostgresEntityRepository implements EntityRepository {

    private static final String COLUMNS = "id, user_id, name, description, " +
            "description_vec::text AS description_vec, created_at, updated_at";

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Entity> findByName(UUID userId, String name) {
        return databaseClient.sql("SELECT " + COLUMNS + " FROM entities WHERE user_id = :userId AND name = :name")
                .bind("userId", userId)
                .bind("name", name)
                .map((row, metadata) -> toEntity(row))
                .one();
    }

    @Override
    public Mono<Entity> findByNameIgnoreCase(UUID userId, String name) {
        return databaseClient.sql("SELECT " + COLUMNS + " FROM entities " +
                        "WHERE user_id = :userId AND LOWER(name) = LOWER(:name) ORDER BY created_at LIMIT 1")
                .bind("userId", userId)
                .bind("name", name)
                .map((row, metadata) -> toEntity(row))
                .one();
    }

    @Override
    public Mono<Entity> findById(UUID userId, UUID entityId) {
        return databaseClient.sql("SELECT " + COLUMNS + " FROM entities WHERE user_id = :userId AND id = :id")
                .bind("userId", userId)
                .bind("id", entityId)
                .map((row, metadata) -> toEntity(row))
                .one();
    }

    @Override
    public Mono<Entity> insert(Entity entity) {
        Entity toSave = entity.toBuilder()
                .id(entity.getId() != null ? entity.getId() : UUID.randomUUID())
                .createdAt(entity.getCreatedAt() != null ? entity.getCreatedAt() : LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(
                        "INSERT INTO entities (id, user_id, name, description, description_vec, created_at, updated_at) " +
                        "VALUES (:id, :userId, :name, :description, CAST(:vec AS vector), :createdAt, :updatedAt)")
                .bind("id", toSave.getId())
                .bind("userId", toSave.getUserId())
                .bind("name", toSave.getName())
                .bind("createdAt", toSave.getCreatedAt())
                .bind("updatedAt", toSave.getUpdatedAt());
        spec = PostgresBindings.bindText(spec, "description", toSave.getDescription());
        spec = PostgresBindings.bindVector(spec, "vec", toSave.getDescriptionEmbedding());

        return spec.fetch()
                .rowsUpdated()
                .thenReturn(toSave);
    }

    @Override
    public Mono<Entity> updateDescription(UUID userId, UUID entityId, LocalDateTime seenUpdatedAt,
                                          String description, float[] embedding) {
        // clock_timestamp() so two writes in one transaction still get distinct versions
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(
                        "UPDATE entities SET description = :description, description_vec = CAST(:vec AS vector), " +
                        "updated_at = clock_timestamp() " +
                        "WHERE user_id = :userId AND id = :id AND updated_at = :seen")
                .bind("userId", userId)
                .bind("id", entityId)
                .bind("seen", seenUpdatedAt);
        spec = PostgresBindings.bindText(spec, "description", description);
        spec = PostgresBindings.bindVector(spec, "vec", embedding);

        return spec.fetch()
                .rowsUpdated()
                .flatMap(rows -> {
                    if (rows == 0) {
                        log.debug("Entity {} changed since it was read, update skipped", entityId);
                        return Mono.empty();
                    }
                    return findById(userId, entityId);
                });
    }

    @Override
    public Flux<Entity> findNearestByDescription(UUID userId, float[] embedding, int limit) {
        // <=> is pgvector's cosine distance; rows without an embedding sort last
        return databaseClient.sql("SELECT " + COLUMNS + " FROM entities WHERE user_id = :userId " +
                        "ORDER BY entities.description_vec <=> CAST(:vec AS vector) ASC NULLS LAST LIMIT :limit")
                .bind("userId", userId)
                .bind("vec", VectorUtil.format(embedding))
                .bind("limit", limit)
                .map((row, metadata) -> toEntity(row))
                .all();
    }

    @Override
    public Mono<Long> countByUser(UUID userId) {
        return databaseClient.sql("SELECT COUNT(*) AS total FROM entities WHERE user_id = :userId")
                .bind("userId", userId)
                .map((row, metadata) -> row.get("total", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    private Entity toEntity(Row row) {
        return Entity.builder()
                .id(row.get("id", UUID.class))
                .userId(row.get("user_id", UUID.class))
                .name(row.get("name", String.class))
                .description(row.get("description", String.class))
                .descriptionEmbedding(VectorUtil.parse(row.get("description_vec", String.class)))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .updatedAt(row.get("updated_at", LocalDateTime.class))
                .build();
    }
}
