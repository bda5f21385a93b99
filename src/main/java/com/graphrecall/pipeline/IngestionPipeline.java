package com.graphrecall.pipeline;

import com.graphrecall.gateway.LanguageModelGateway;
import com.graphrecall.graph.AliasGraph;
import com.graphrecall.graph.EntityStore;
import com.graphrecall.graph.RelationshipStore;
import com.graphrecall.model.entity.Entity;
import com.graphrecall.model.entity.Relationship;
import com.graphrecall.model.entity.User;
import com.graphrecall.model.graph.ExtractedTriple;
import com.graphrecall.model.graph.IngestionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns one free-text statement into graph mutations.
 *
 * <p>Order of work: extract fragments, re-attribute third-party claims, append the
 * statement to every already-known entity it mentions, then write each fragment as
 * an alias or an edge. A failing fragment is recorded in the report and skipped;
 * the rest of the statement is still ingested.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionPipeline {

    private final LanguageModelGateway gateway;
    private final AttributionPolicy attributionPolicy;
    private final EntityStore entityStore;
    private final RelationshipStore relationshipStore;
    private final AliasGraph aliasGraph;

    public Mono<IngestionReport> ingest(User user, String statement) {
        return Mono.defer(() -> {
            IngestionReport report = IngestionReport.empty();
            return gateway.extractTriples(statement, user.getUsername())
                    .onErrorResume(error -> {
                        log.warn("Extraction failed for user {}: {}", user.getUsername(), error.getMessage());
                        report.recordFailure("extraction: " + error.getMessage());
                        return Mono.just(List.of());
                    })
                    .flatMap(triples -> {
                        List<ExtractedTriple> fragments = triples.stream()
                                .filter(ExtractedTriple::isComplete)
                                .map(triple -> attributionPolicy.apply(triple, user.getUsername()))
                                .collect(Collectors.toList());
                        report.setFragments(fragments.size());
                        log.debug("Statement from {} yielded {} fragments", user.getUsername(), fragments.size());

                        return appendToKnownEntities(user, fragments, statement, report)
                                .thenMany(Flux.fromIterable(fragments)
                                        .concatMap(fragment -> write(user, fragment, statement, report)
                                                .onErrorResume(error -> {
                                                    log.warn("Fragment {} failed: {}", describe(fragment), error.getMessage());
                                                    report.recordFailure(describe(fragment) + ": " + error.getMessage());
                                                    return Mono.empty();
                                                })))
                                .then(Mono.just(report));
                    })
                    .doOnNext(done -> log.info("Ingested statement for {}: {} edges, {} aliases, {} failures",
                            user.getUsername(), done.getEdgesWritten(), done.getAliasesHandled(),
                            done.getFailures().size()));
        });
    }

    /**
     * Entities that existed before this statement accumulate it as context. Entities the
     * statement creates get it through description generation instead.
     */
    private Mono<Void> appendToKnownEntities(User user, List<ExtractedTriple> fragments,
                                             String statement, IngestionReport report) {
        Set<String> mentioned = new LinkedHashSet<>();
        for (ExtractedTriple fragment : fragments) {
            mentioned.add(fragment.getSource());
            mentioned.add(fragment.getTarget());
        }
        return Flux.fromIterable(mentioned)
                .concatMap(name -> entityStore.find(user.getId(), name)
                        .flatMap(existing -> entityStore.appendContext(user.getId(), existing.getName(), statement))
                        .doOnNext(updated -> report.recordContextAppend())
                        .onErrorResume(error -> {
                            log.warn("Appending context to '{}' failed: {}", name, error.getMessage());
                            report.recordFailure("context '" + name + "': " + error.getMessage());
                            return Mono.empty();
                        }))
                .then();
    }

    private Mono<Void> write(User user, ExtractedTriple fragment, String statement, IngestionReport report) {
        Mono<Tuple2<Entity, Entity>> endpoints = entityStore.getOrCreate(user, fragment.getSource(), statement)
                .flatMap(source -> entityStore.getOrCreate(user, fragment.getTarget(), statement)
                        .map(target -> Tuples.of(source, target)));

        if (fragment.isAlias()) {
            return endpoints
                    .flatMap(pair -> aliasGraph.handleAlias(pair.getT1(), pair.getT2()))
                    .doOnNext(outcome -> report.recordAlias())
                    .then();
        }

        return endpoints
                .flatMap(pair -> gateway.embed(fragment.getRelationship())
                        .map(labelEmbedding -> Relationship.builder()
                                .userId(user.getId())
                                .sourceEntityId(pair.getT1().getId())
                                .targetEntityId(pair.getT2().getId())
                                .sourceName(pair.getT1().getName())
                                .targetName(pair.getT2().getName())
                                .label(fragment.getRelationship())
                                .labelEmbedding(labelEmbedding)
                                .originalInput(statement)
                                .build()))
                .flatMap(edge -> relationshipStore.describe(edge)
                        .onErrorResume(error -> {
                            // Stored undescribed; the backfill job fills it in later
                            log.warn("Describing '{}' failed: {}", edge.getLabel(), error.getMessage());
                            return Mono.just(edge);
                        }))
                .flatMap(relationshipStore::create)
                .doOnNext(saved -> report.recordEdge())
                .then();
    }

    private static String describe(ExtractedTriple fragment) {
        return fragment.isAlias()
                ? fragment.getSource() + " = " + fragment.getTarget()
                : fragment.getSource() + " --" + fragment.getRelationship() + "--> " + fragment.getTarget();
    }
}
