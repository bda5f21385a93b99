package com.graphrecall.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResult {

    public static final String NO_INFORMATION_ANSWER =
            "I don't have any information about that yet.";

    private RetrievalStatus status;

    private String answer;

    @Builder.Default
    private List<String> statements = List.of();

    // Target entity names of the surviving edges
    @Builder.Default
    private List<String> matchedEntities = List.of();

    private RetrievalTrace trace;

    public static RetrievalResult noInformation(RetrievalTrace trace) {
        return RetrievalResult.builder()
                .status(RetrievalStatus.NO_INFORMATION)
                .answer(NO_INFORMATION_ANSWER)
                .trace(trace)
                .build();
    }
}
