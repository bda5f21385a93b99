package com.graphrecall.model.graph;

import com.graphrecall.model.entity.Relationship;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Candidate edge with its cosine distance to the question's relationship phrase.
 */
@Data
@AllArgsConstructor
public class ScoredEdge {

    private Relationship relationship;

    private double distance;
}
