package com.graphrecall.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Question decomposed into the entities it mentions and the relationship it asks about.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedQuery {

    @Builder.Default
    private List<String> entities = List.of();

    private String relationshipPhrase;
}
