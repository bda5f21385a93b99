package com.graphrecall.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tuning knobs for graph construction and retrieval.
 */
@Data
@Component
@ConfigurationProperties(prefix = "graphrecall.graph")
public class GraphProperties {

    private Retrieval retrieval = new Retrieval();
    private EntitySettings entity = new EntitySettings();
    private Backfill backfill = new Backfill();

    @Data
    public static class Retrieval {
        // Outgoing hops walked from the anchor
        private int maxHops = 4;
        // Candidates farther than this are dropped before the mean + stddev band
        private double distanceCeiling = 0.8;
        // Null keeps the fuzzy anchor unconditional
        private Double maxAnchorDistance;
    }

    @Data
    public static class EntitySettings {
        // 0 disables summarization of appended context
        private int maxDescriptionLength = 4000;
    }

    @Data
    public static class Backfill {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(10);
        private int batchSize = 50;
    }
}
