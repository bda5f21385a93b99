package com.graphrecall.pipeline;

import com.graphrecall.graph.RelationshipStore;
import com.graphrecall.model.entity.Relationship;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Level-by-level breadth-first walk over outgoing edges. Purely structural:
 * every reachable edge within the hop bound is collected, relevant or not.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphWalker {

    private final RelationshipStore relationshipStore;

    /**
     * Collect the user's edges reachable from {@code anchorId} in at most {@code maxHops} hops,
     * in discovery order. Edge at hop 1 leaves the anchor itself.
     */
    public Mono<List<Relationship>> walk(UUID userId, UUID anchorId, int maxHops) {
        Set<UUID> visited = new HashSet<>();
        visited.add(anchorId);
        return expand(userId, Set.of(anchorId), visited, new LinkedHashMap<>(), 0, maxHops);
    }

    private Mono<List<Relationship>> expand(UUID userId,
                                            Set<UUID> frontier,
                                            Set<UUID> visited,
                                            Map<UUID, Relationship> collected,
                                            int depth,
                                            int maxHops) {
        if (depth >= maxHops || frontier.isEmpty()) {
            log.debug("Walk stopped at depth {} with {} edges", depth, collected.size());
            return Mono.just(new ArrayList<>(collected.values()));
        }

        return relationshipStore.outgoing(userId, frontier)
                .collectList()
                .flatMap(edges -> {
                    Set<UUID> nextLevel = new LinkedHashSet<>();
                    for (Relationship edge : edges) {
                        if (!userId.equals(edge.getUserId())) {
                            continue;
                        }
                        collected.putIfAbsent(edge.getId(), edge);
                        if (visited.add(edge.getTargetEntityId())) {
                            nextLevel.add(edge.getTargetEntityId());
                        }
                    }
                    return expand(userId, nextLevel, visited, collected, depth + 1, maxHops);
                });
    }
}
