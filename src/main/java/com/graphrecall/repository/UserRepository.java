package com.graphrecall.repository;

import com.graphrecall.model.entity.User;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for User entities.
 */
@Repository
public interface UserRepository extends ReactiveCrudRepository<User, UUID> {

    Mono<User> findByUsername(String username);

    @Query("SELECT EXISTS(SELECT 1 FROM users WHERE username = :username)")
    Mono<Boolean> existsByUsername(String username);

    /**
     * Users owning at least one relationship still missing its elaborated description.
     */
    @Query("SELECT DISTINCT u.* FROM users u JOIN relationships r ON r.user_id = u.id " +
            "WHERE r.relationship_desc IS NULL")
    Flux<User> findWithPendingBackfill();
}
