package com.graphrecall.repository;

import com.graphrecall.model.entity.QueryLog;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for question history.
 */
@Repository
public interface QueryLogRepository extends ReactiveCrudRepository<QueryLog, UUID> {

    @Query("SELECT * FROM query_log WHERE user_id = :userId ORDER BY created_at DESC LIMIT :limit")
    Flux<QueryLog> findRecent(UUID userId, int limit);

    Mono<Long> countByUserId(UUID userId);
}
