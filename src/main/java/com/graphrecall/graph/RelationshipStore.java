package com.graphrecall.graph;

import com.graphrecall.exception.ResourceNotFoundException;
import com.graphrecall.gateway.LanguageModelGateway;
import com.graphrecall.model.entity.Relationship;
import com.graphrecall.repository.RelationshipRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.UUID;

/**
 * Deduplicated, embedded edges with provenance back to the statement that produced them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelationshipStore {

    private final RelationshipRepository relationshipRepository;
    private final LanguageModelGateway gateway;

    /**
     * Insert an edge; on a (user, source, label, target) conflict the existing row is returned.
     * An existing row still waiting for its description takes the new one, if present.
     */
    public Mono<Relationship> create(Relationship edge) {
        return relationshipRepository.insert(edge)
                .onErrorResume(DuplicateKeyException.class, conflict -> relationshipRepository
                        .findByKey(edge.getUserId(), edge.getSourceEntityId(), edge.getLabel(), edge.getTargetEntityId())
                        .switchIfEmpty(Mono.error(conflict))
                        .flatMap(existing -> {
                            log.debug("Edge '{}' already exists as {}", edge.getLabel(), existing.getId());
                            if (!existing.hasDescription() && edge.hasDescription()) {
                                return relationshipRepository.updateDescription(
                                        existing.getId(), edge.getDescription(), edge.getDescriptionEmbedding());
                            }
                            return Mono.just(existing);
                        }));
    }

    /**
     * Generate the elaborated description of {@code edge}'s label and embed it.
     * The label alone is described, never the entities it joins.
     */
    public Mono<Relationship> describe(Relationship edge) {
        return gateway.describeRelationship(edge.getLabel())
                .flatMap(description -> gateway.embed(description)
                        .map(embedding -> edge.toBuilder()
                                .description(description)
                                .descriptionEmbedding(embedding)
                                .build()));
    }

    /**
     * Fill in the description of an edge that was stored without one.
     * Edges that already have a description are returned unchanged.
     */
    public Mono<Relationship> backfillDescription(UUID relationshipId) {
        return relationshipRepository.findById(relationshipId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Relationship", relationshipId)))
                .flatMap(edge -> {
                    if (edge.hasDescription()) {
                        return Mono.just(edge);
                    }
                    return describe(edge)
                            .flatMap(described -> relationshipRepository.updateDescription(
                                    edge.getId(), described.getDescription(), described.getDescriptionEmbedding()))
                            .doOnNext(updated -> log.info("Backfilled description of edge {} ('{}')",
                                    updated.getId(), updated.getLabel()));
                });
    }

    /**
     * Backfill up to {@code limit} of the user's undescribed edges. An edge whose
     * generation fails is left for the next sweep.
     *
     * @return number of edges filled in
     */
    public Mono<Long> backfillMissing(UUID userId, int limit) {
        return relationshipRepository.findMissingDescriptions(userId, limit)
                .concatMap(edge -> backfillDescription(edge.getId())
                        .onErrorResume(error -> {
                            log.warn("Backfill of edge {} failed: {}", edge.getId(), error.getMessage());
                            return Mono.empty();
                        }))
                .count();
    }

    public Flux<Relationship> outgoing(UUID userId, Collection<UUID> sourceEntityIds) {
        return relationshipRepository.findOutgoing(userId, sourceEntityIds);
    }

    public Mono<Long> count(UUID userId) {
        return relationshipRepository.countByUser(userId);
    }
}
