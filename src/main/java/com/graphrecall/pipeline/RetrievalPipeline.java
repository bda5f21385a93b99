package com.graphrecall.pipeline;

import com.graphrecall.config.GraphProperties;
import com.graphrecall.exception.GatewayException;
import com.graphrecall.gateway.LanguageModelGateway;
import com.graphrecall.graph.EntityStore;
import com.graphrecall.model.entity.Entity;
import com.graphrecall.model.entity.Relationship;
import com.graphrecall.model.entity.User;
import com.graphrecall.model.graph.ParsedQuery;
import com.graphrecall.model.graph.RetrievalResult;
import com.graphrecall.model.graph.RetrievalStatus;
import com.graphrecall.model.graph.RetrievalTrace;
import com.graphrecall.model.graph.ScoredEdge;
import com.graphrecall.util.VectorUtil;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Answers a question from the asking user's graph.
 *
 * <p>Stages: parse the question, resolve an anchor entity, walk outgoing edges
 * from it, score each edge against the asked relationship, keep the adaptive
 * band of nearest edges, aggregate their source statements and synthesize an
 * answer from those statements only. Synthesis is skipped when nothing survives.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrievalPipeline {

    private final LanguageModelGateway gateway;
    private final EntityStore entityStore;
    private final GraphWalker graphWalker;
    private final AdaptiveRelevanceFilter relevanceFilter;
    private final GraphProperties properties;

    public Mono<RetrievalResult> answer(User user, String question) {
        return gateway.parseQuery(question, user.getUsername())
                .flatMap(parsed -> resolveAnchor(user, parsed, question)
                        .flatMap(anchor -> retrieve(user, question, parsed, anchor))
                        .switchIfEmpty(Mono.fromSupplier(() -> {
                            log.debug("No anchor for '{}' in {}'s graph", mention(parsed, question), user.getUsername());
                            return RetrievalResult.noInformation(trace(parsed, null, 0,
                                    "No entity matched '" + mention(parsed, question) + "'"));
                        })));
    }

    /**
     * Exact name, then case-insensitive name, then nearest entity by description embedding.
     */
    Mono<Anchor> resolveAnchor(User user, ParsedQuery parsed, String question) {
        String mention = mention(parsed, question);
        return entityStore.find(user.getId(), mention)
                .map(entity -> new Anchor(entity, "exact name"))
                .switchIfEmpty(Mono.defer(() -> entityStore.findIgnoreCase(user.getId(), mention)
                        .map(entity -> new Anchor(entity, "case-insensitive name"))))
                .switchIfEmpty(Mono.defer(() -> nearestAnchor(user, mention)));
    }

    private Mono<Anchor> nearestAnchor(User user, String mention) {
        Double maxDistance = properties.getRetrieval().getMaxAnchorDistance();
        return gateway.embed(mention)
                .flatMap(embedding -> entityStore.nearestByDescription(user.getId(), embedding, 1)
                        .next()
                        .flatMap(entity -> {
                            double distance = entity.getDescriptionEmbedding() == null
                                    ? Double.NaN
                                    : distance(embedding, entity.getDescriptionEmbedding(), entity.getName());
                            if (maxDistance != null && !(distance <= maxDistance)) {
                                log.debug("Nearest entity '{}' at {} is beyond {}", entity.getName(), distance, maxDistance);
                                return Mono.empty();
                            }
                            return Mono.just(new Anchor(entity,
                                    String.format(Locale.ROOT, "nearest description, distance %.4f", distance)));
                        }));
    }

    private Mono<RetrievalResult> retrieve(User user, String question, ParsedQuery parsed, Anchor anchor) {
        GraphProperties.Retrieval settings = properties.getRetrieval();
        Entity entity = anchor.getEntity();
        String anchorText = "'" + entity.getName() + "' (" + anchor.getMatch() + ")";

        return graphWalker.walk(user.getId(), entity.getId(), settings.getMaxHops())
                .flatMap(edges -> {
                    if (edges.isEmpty()) {
                        return Mono.just(RetrievalResult.noInformation(trace(parsed, entity.getName(), 0,
                                "Anchored on " + anchorText + "; no outgoing edges within "
                                        + settings.getMaxHops() + " hops")));
                    }
                    return gateway.embed(parsed.getRelationshipPhrase())
                            .flatMap(queryEmbedding -> {
                                AdaptiveRelevanceFilter.Band band = relevanceFilter.filter(
                                        score(edges, queryEmbedding), settings.getDistanceCeiling());
                                Aggregate aggregate = aggregate(band.getKept());
                                String description = describeSearch(anchorText, edges.size(), settings, band);
                                RetrievalTrace trace = trace(parsed, entity.getName(),
                                        aggregate.getStatements().size(), description);
                                log.debug("Retrieval for {}: {}", user.getUsername(), description);

                                if (aggregate.getStatements().isEmpty()) {
                                    return Mono.just(RetrievalResult.noInformation(trace));
                                }
                                return gateway.synthesize(question, aggregate.getStatements())
                                        .map(answer -> RetrievalResult.builder()
                                                .status(RetrievalStatus.ANSWERED)
                                                .answer(answer)
                                                .statements(aggregate.getStatements())
                                                .matchedEntities(aggregate.getTargets())
                                                .trace(trace)
                                                .build());
                            });
                });
    }

    /**
     * Distance of each edge to the asked relationship. The elaborated description is
     * compared when present, the bare label otherwise.
     */
    List<ScoredEdge> score(List<Relationship> edges, float[] queryEmbedding) {
        List<ScoredEdge> scored = new ArrayList<>(edges.size());
        for (Relationship edge : edges) {
            float[] embedding = edge.getDescriptionEmbedding() != null
                    ? edge.getDescriptionEmbedding()
                    : edge.getLabelEmbedding();
            if (embedding == null) {
                continue;
            }
            scored.add(new ScoredEdge(edge, distance(queryEmbedding, embedding, edge.getLabel())));
        }
        return scored;
    }

    // Mixed dimensions mean the embedding model changed under stored vectors
    private static double distance(float[] query, float[] stored, String storedFor) {
        try {
            return VectorUtil.cosineDistance(query, stored);
        } catch (IllegalArgumentException e) {
            throw new GatewayException("embed", "query embedding has " + query.length
                    + " dimensions but '" + storedFor + "' was stored with " + stored.length, e);
        }
    }

    private Aggregate aggregate(List<ScoredEdge> kept) {
        Set<String> seenTargets = new HashSet<>();
        List<String> targets = new ArrayList<>();
        Set<String> statements = new LinkedHashSet<>();
        for (ScoredEdge candidate : kept) {
            Relationship edge = candidate.getRelationship();
            String target = edge.getTargetName() != null ? edge.getTargetName() : String.valueOf(edge.getTargetEntityId());
            if (!seenTargets.add(target.toLowerCase(Locale.ROOT))) {
                continue;
            }
            targets.add(target);
            statements.add(edge.getOriginalInput());
        }
        return new Aggregate(targets, new ArrayList<>(statements));
    }

    private static String describeSearch(String anchorText, int walked,
                                         GraphProperties.Retrieval settings,
                                         AdaptiveRelevanceFilter.Band band) {
        StringBuilder description = new StringBuilder()
                .append("Anchored on ").append(anchorText)
                .append("; walked ").append(walked).append(" edge(s) within ")
                .append(settings.getMaxHops()).append(" hop(s)")
                .append("; ").append(band.getWithinCeiling()).append(" of ").append(band.getCandidates())
                .append(" within distance ").append(String.format(Locale.ROOT, "%.2f", settings.getDistanceCeiling()));
        if (band.getWithinCeiling() > 0) {
            description.append(String.format(Locale.ROOT,
                    "; kept %d with distance <= %.4f (mean %.4f, stddev %.4f)",
                    band.getKept().size(), band.getThreshold(), band.getMean(), band.getStdDev()));
        }
        return description.toString();
    }

    private static RetrievalTrace trace(ParsedQuery parsed, String anchor, int resultCount, String description) {
        return RetrievalTrace.builder()
                .entities(parsed.getEntities() == null ? List.of() : parsed.getEntities())
                .relationshipPhrase(parsed.getRelationshipPhrase())
                .anchor(anchor)
                .resultCount(resultCount)
                .searchDescription(description)
                .build();
    }

    // The first extracted entity is the primary one; a question naming none falls back to its own text
    private static String mention(ParsedQuery parsed, String question) {
        List<String> entities = parsed.getEntities() == null ? List.of() : parsed.getEntities().stream()
                .filter(name -> name != null && !name.isBlank())
                .collect(Collectors.toList());
        return entities.isEmpty() ? question : entities.get(0);
    }

    @Value
    static class Anchor {
        Entity entity;
        String match;
    }

    @Value
    private static class Aggregate {
        List<String> targets;
        List<String> statements;
    }
}
