package com.graphrecall.service;

import com.graphrecall.config.GraphProperties;
import com.graphrecall.exception.ResourceNotFoundException;
import com.graphrecall.graph.AliasGraph;
import com.graphrecall.graph.EntityStore;
import com.graphrecall.graph.RelationshipStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Read and maintenance operations on a user's graph.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphService {

    private final UserService userService;
    private final EntityStore entityStore;
    private final AliasGraph aliasGraph;
    private final RelationshipStore relationshipStore;
    private final GraphProperties properties;

    /**
     * Other names of the entity called {@code name}; empty when it has no alias group.
     */
    public Mono<List<String>> aliases(UUID userId, String name) {
        return userService.get(userId)
                .flatMap(user -> entityStore.find(user.getId(), name)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Entity", name))))
                .flatMapMany(aliasGraph::aliasNames)
                .collectList();
    }

    /**
     * Fill in one batch of the user's missing relationship descriptions.
     */
    public Mono<Long> backfill(UUID userId) {
        return userService.get(userId)
                .flatMap(user -> relationshipStore.backfillMissing(user.getId(), properties.getBackfill().getBatchSize()))
                .doOnNext(filled -> log.info("Backfilled {} relationship descriptions for user {}", filled, userId));
    }
}
