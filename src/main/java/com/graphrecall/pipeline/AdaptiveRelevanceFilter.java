package com.graphrecall.pipeline;

import com.graphrecall.model.graph.ScoredEdge;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Self-calibrating relevance cutoff.
 *
 * <p>Candidates above an absolute distance ceiling are dropped first. Of the rest,
 * only those within one population standard deviation above the mean distance
 * survive, i.e. {@code distance <= mean + stddev}.</p>
 */
@Component
public class AdaptiveRelevanceFilter {

    // Absorbs rounding when every distance is identical
    private static final double EPSILON = 1e-12;

    public Band filter(List<ScoredEdge> candidates, double ceiling) {
        List<ScoredEdge> withinCeiling = candidates.stream()
                .filter(candidate -> candidate.getDistance() <= ceiling)
                .collect(Collectors.toList());
        if (withinCeiling.isEmpty()) {
            return new Band(List.of(), candidates.size(), 0, Double.NaN, Double.NaN, Double.NaN);
        }

        double mean = withinCeiling.stream()
                .mapToDouble(ScoredEdge::getDistance)
                .average()
                .orElse(0.0);
        double variance = withinCeiling.stream()
                .mapToDouble(candidate -> Math.pow(candidate.getDistance() - mean, 2))
                .sum() / withinCeiling.size();
        double stdDev = Math.sqrt(variance);
        double threshold = mean + stdDev;

        List<ScoredEdge> kept = withinCeiling.stream()
                .filter(candidate -> candidate.getDistance() <= threshold + EPSILON)
                .sorted(Comparator.comparingDouble(ScoredEdge::getDistance))
                .collect(Collectors.toList());

        return new Band(kept, candidates.size(), withinCeiling.size(), mean, stdDev, threshold);
    }

    /**
     * Survivors, nearest first, with the statistics that produced them.
     */
    @Getter
    @AllArgsConstructor
    public static class Band {
        private final List<ScoredEdge> kept;
        private final int candidates;
        private final int withinCeiling;
        private final double mean;
        private final double stdDev;
        private final double threshold;
    }
}
