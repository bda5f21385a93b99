package com.graphrecall.repository;

import com.graphrecall.model.entity.Statement;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Repository for recorded statements.
 */
@Repository
public interface StatementRepository extends ReactiveCrudRepository<Statement, UUID> {

    @Query("SELECT * FROM statements WHERE user_id = :userId ORDER BY created_at DESC LIMIT :limit")
    Flux<Statement> findRecent(UUID userId, int limit);

    /**
     * Case-insensitive substring search over content and tags, optionally within one category.
     */
    @Query("SELECT * FROM statements WHERE user_id = :userId " +
            "AND (content ILIKE '%' || :term || '%' OR tags ILIKE '%' || :term || '%') " +
            "AND (CAST(:category AS TEXT) IS NULL OR category = :category) " +
            "ORDER BY created_at DESC")
    Flux<Statement> search(UUID userId, String term, String category);

    Mono<Long> countByUserId(UUID userId);

    Mono<Long> countByUserIdAndCreatedAtAfter(UUID userId, LocalDateTime since);
}
