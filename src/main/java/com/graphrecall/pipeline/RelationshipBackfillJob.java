package com.graphrecall.pipeline;

import com.graphrecall.config.GraphProperties;
import com.graphrecall.graph.RelationshipStore;
import com.graphrecall.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Periodically fills in relationship descriptions that generation failed to produce
 * at ingestion time. Enabled with {@code graphrecall.graph.backfill.enabled=true};
 * sweeps run {@link GraphProperties.Backfill#getInterval()} apart.
 */
@EnableScheduling
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "graphrecall.graph.backfill", name = "enabled", havingValue = "true")
public class RelationshipBackfillJob {

    private final UserRepository userRepository;
    private final RelationshipStore relationshipStore;
    private final GraphProperties properties;

    @Scheduled(fixedDelayString = "#{@graphProperties.backfill.interval.toString()}",
            initialDelayString = "#{@graphProperties.backfill.interval.toString()}")
    public void run() {
        sweep().subscribe(
                filled -> log.info("Backfill sweep filled {} relationship descriptions", filled),
                error -> log.error("Backfill sweep failed", error));
    }

    /**
     * One pass over every user with undescribed edges, at most one batch per user.
     */
    public Mono<Long> sweep() {
        int batchSize = properties.getBackfill().getBatchSize();
        return userRepository.findWithPendingBackfill()
                .concatMap(user -> relationshipStore.backfillMissing(user.getId(), batchSize)
                        .doOnNext(filled -> log.debug("Backfilled {} edges for {}", filled, user.getUsername())))
                .reduce(0L, Long::sum);
    }
}
