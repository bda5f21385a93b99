package com.graphrecall.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of the graph mutations one statement produced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReport {

    private int fragments;

    private int edgesWritten;

    private int aliasesHandled;

    private int contextAppends;

    @Builder.Default
    private List<String> failures = new ArrayList<>();

    public void recordEdge() {
        edgesWritten++;
    }

    public void recordAlias() {
        aliasesHandled++;
    }

    public void recordContextAppend() {
        contextAppends++;
    }

    public void recordFailure(String failure) {
        failures.add(failure);
    }

    public static IngestionReport empty() {
        return IngestionReport.builder().build();
    }
}
