package com.graphrecall.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What a retrieval looked at, handed to query history for auditing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalTrace {

    @Builder.Default
    private List<String> entities = List.of();

    private String relationshipPhrase;

    private String anchor;

    private int resultCount;

    private String searchDescription;
}
