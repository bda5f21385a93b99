package com.graphrecall.gateway;

import com.graphrecall.model.graph.ExtractedTriple;
import com.graphrecall.model.graph.ParsedQuery;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Language-model capabilities the graph engine consumes: extraction, embedding and completion.
 * Failures surface as {@link com.graphrecall.exception.GatewayException}.
 */
public interface LanguageModelGateway {

    /**
     * Embed text into a vector of the deployment's fixed dimensionality.
     */
    Mono<float[]> embed(String text);

    /**
     * Split a statement into ordered fragments, with the speaker substituted for first-person
     * references and possessives resolved to compound names ("sam's partner").
     * Malformed model output yields the fragments that could be read, possibly none.
     */
    Mono<List<ExtractedTriple>> extractTriples(String text, String username);

    /**
     * Decompose a question using the same placeholder and attribution rules as extraction.
     */
    Mono<ParsedQuery> parseQuery(String question, String username);

    /**
     * Answer {@code question} from the given original statements only.
     */
    Mono<String> synthesize(String question, List<String> passages);

    /**
     * Short description of a newly seen entity.
     *
     * @param context statement in which the entity was first mentioned, may be null
     */
    Mono<String> describeEntity(String name, String username, String context);

    /**
     * Elaborate the meaning of a relationship label independent of the entities it joins,
     * so edges of the same kind stay comparable across entity pairs.
     */
    Mono<String> describeRelationship(String label);

    /**
     * Condense an accumulated entity description.
     */
    Mono<String> summarizeDescription(String name, String description, int maxLength);
}
