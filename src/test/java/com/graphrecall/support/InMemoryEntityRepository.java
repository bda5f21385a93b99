package com.graphrecall.support;

import com.graphrecall.model.entity.Entity;
import com.graphrecall.repository.EntityRepository;
import com.graphrecall.util.VectorUtil;
import org.springframework.dao.DuplicateKeyException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Map-backed entity storage with the same uniqueness and scoping rules as the postgres one.
 */
public class InMemoryEntityRepository implements EntityRepository {

    private final Map<UUID, Entity> entities = new ConcurrentHashMap<>();

    @Override
    public Mono<Entity> findByName(UUID userId, String name) {
        return Mono.justOrEmpty(entities.values().stream()
                .filter(entity -> entity.getUserId().equals(userId) && entity.getName().equals(name))
                .findFirst());
    }

    @Override
    public Mono<Entity> findByNameIgnoreCase(UUID userId, String name) {
        return Mono.justOrEmpty(entities.values().stream()
                .filter(entity -> entity.getUserId().equals(userId) && entity.getName().equalsIgnoreCase(name))
                .findFirst());
    }

    @Override
    public Mono<Entity> findById(UUID userId, UUID entityId) {
        return Mono.justOrEmpty(entities.get(entityId))
                .filter(entity -> entity.getUserId().equals(userId));
    }

    @Override
    public synchronized Mono<Entity> insert(Entity entity) {
        boolean taken = entities.values().stream()
                .anyMatch(existing -> existing.getUserId().equals(entity.getUserId())
                        && existing.getName().equals(entity.getName()));
        if (taken) {
            return Mono.error(new DuplicateKeyException("entities_user_id_name_key"));
        }
        Entity saved = entity.toBuilder()
                .id(entity.getId() != null ? entity.getId() : UUID.randomUUID())
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();
        entities.put(saved.getId(), saved);
        return Mono.just(saved);
    }

    @Override
    public Mono<Entity> updateDescription(UUID userId, UUID entityId, LocalDateTime seenUpdatedAt,
                                          String description, float[] embedding) {
        return Mono.fromCallable(() -> compareAndSet(userId, entityId, seenUpdatedAt, description, embedding));
    }

    private synchronized Entity compareAndSet(UUID userId, UUID entityId, LocalDateTime seenUpdatedAt,
                                              String description, float[] embedding) {
        Entity current = entities.get(entityId);
        if (current == null || !current.getUserId().equals(userId)
                || !Objects.equals(current.getUpdatedAt(), seenUpdatedAt)) {
            return null;
        }
        LocalDateTime now = LocalDateTime.now();
        Entity updated = current.toBuilder()
                .description(description)
                .descriptionEmbedding(embedding)
                .updatedAt(now.equals(seenUpdatedAt) ? now.plusNanos(1000) : now)
                .build();
        entities.put(entityId, updated);
        return updated;
    }

    @Override
    public Flux<Entity> findNearestByDescription(UUID userId, float[] embedding, int limit) {
        List<Entity> owned = entities.values().stream()
                .filter(entity -> entity.getUserId().equals(userId))
                .collect(Collectors.toList());
        List<Entity> ranked = new ArrayList<>(owned);
        ranked.sort(Comparator.comparingDouble(entity -> entity.getDescriptionEmbedding() == null
                ? Double.MAX_VALUE
                : VectorUtil.cosineDistance(embedding, entity.getDescriptionEmbedding())));
        return Flux.fromIterable(ranked).take(limit);
    }

    @Override
    public Mono<Long> countByUser(UUID userId) {
        return Mono.just(entities.values().stream()
                .filter(entity -> entity.getUserId().equals(userId))
                .count());
    }

    public List<Entity> all() {
        return new ArrayList<>(entities.values());
    }

    public Entity save(Entity entity) {
        return insert(entity).block();
    }
}
