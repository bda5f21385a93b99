package com.graphrecall.graph;

import com.graphrecall.config.GraphProperties;
import com.graphrecall.exception.ResourceNotFoundException;
import com.graphrecall.exception.StaleEntityException;
import com.graphrecall.gateway.LanguageModelGateway;
import com.graphrecall.model.entity.Entity;
import com.graphrecall.model.entity.User;
import com.graphrecall.repository.EntityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.UUID;

/**
 * Named entities of a user's graph: lazy creation, evidence accumulation and
 * nearest-neighbour lookup over description embeddings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityStore {

    static final String CONTEXT_SEPARATOR = "\n\n";
    static final int MAX_APPEND_ATTEMPTS = 5;

    private final EntityRepository entityRepository;
    private final LanguageModelGateway gateway;
    private final GraphProperties properties;

    /**
     * Exact lookup by (user, name).
     */
    public Mono<Entity> find(UUID userId, String name) {
        return entityRepository.findByName(userId, name);
    }

    public Mono<Entity> findIgnoreCase(UUID userId, String name) {
        return entityRepository.findByNameIgnoreCase(userId, name);
    }

    /**
     * Return the user's entity called {@code name}, creating it on first mention.
     *
     * A new entity gets a generated description and its embedding. When a concurrent
     * request inserts the same name first, the unique-key conflict is caught and the
     * winner's row is returned.
     *
     * @param context statement that mentioned the entity, passed to description generation
     */
    public Mono<Entity> getOrCreate(User user, String name, String context) {
        return entityRepository.findByName(user.getId(), name)
                .switchIfEmpty(Mono.defer(() -> create(user, name, context)));
    }

    /**
     * Append {@code snippet} to an existing entity's description and re-embed the whole text.
     * Descriptions past the configured length are condensed by the gateway.
     *
     * The write only lands if the row still carries the {@code updatedAt} it was read with;
     * otherwise the entity is re-read and the snippet appended to the newer description.
     *
     * @throws ResourceNotFoundException (as error signal) when the entity does not exist
     * @throws StaleEntityException (as error signal) when every attempt lost to a concurrent write
     */
    public Mono<Entity> appendContext(UUID userId, String name, String snippet) {
        return Mono.defer(() -> entityRepository.findByName(userId, name))
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Entity", name)))
                .flatMap(entity -> {
                    String current = entity.getDescription();
                    String combined = current == null || current.isBlank()
                            ? snippet
                            : current + CONTEXT_SEPARATOR + snippet;
                    return condense(entity.getName(), combined)
                            .flatMap(description -> gateway.embed(description)
                                    .flatMap(embedding -> entityRepository.updateDescription(
                                            userId, entity.getId(), entity.getUpdatedAt(), description, embedding)))
                            .switchIfEmpty(Mono.error(() -> new StaleEntityException(entity.getName())));
                })
                .retryWhen(Retry.max(MAX_APPEND_ATTEMPTS - 1)
                        .filter(StaleEntityException.class::isInstance)
                        .doBeforeRetry(signal -> log.debug("Entity '{}' changed during append, retry {}",
                                name, signal.totalRetries() + 1))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .doOnNext(entity -> log.debug("Appended context to entity '{}' ({} chars)",
                        entity.getName(), entity.getDescription().length()));
    }

    /**
     * The user's entities ranked by description distance to {@code queryEmbedding}, nearest first.
     * Returns a candidate whenever the user has any entity; no similarity floor is applied.
     */
    public Flux<Entity> nearestByDescription(UUID userId, float[] queryEmbedding, int limit) {
        return entityRepository.findNearestByDescription(userId, queryEmbedding, limit);
    }

    public Mono<Long> count(UUID userId) {
        return entityRepository.countByUser(userId);
    }

    private Mono<Entity> create(User user, String name, String context) {
        return gateway.describeEntity(name, user.getUsername(), context)
                .flatMap(description -> gateway.embed(description)
                        .map(embedding -> Entity.builder()
                                .userId(user.getId())
                                .name(name)
                                .description(description)
                                .descriptionEmbedding(embedding)
                                .build()))
                .flatMap(entity -> entityRepository.insert(entity)
                        .doOnNext(saved -> log.info("Created entity '{}' for user {}", name, user.getUsername()))
                        .onErrorResume(DuplicateKeyException.class, conflict -> {
                            log.debug("Entity '{}' was created concurrently, re-reading", name);
                            return entityRepository.findByName(user.getId(), name)
                                    .switchIfEmpty(Mono.error(conflict));
                        }));
    }

    private Mono<String> condense(String name, String description) {
        int maxLength = properties.getEntity().getMaxDescriptionLength();
        if (maxLength <= 0 || description.length() <= maxLength) {
            return Mono.just(description);
        }
        log.info("Description of '{}' reached {} chars, summarizing", name, description.length());
        return gateway.summarizeDescription(name, description, maxLength);
    }
}
