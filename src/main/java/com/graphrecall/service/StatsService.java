package com.graphrecall.service;

import com.graphrecall.graph.EntityStore;
import com.graphrecall.graph.RelationshipStore;
import com.graphrecall.model.dto.StatsResponse;
import com.graphrecall.repository.QueryLogRepository;
import com.graphrecall.repository.StatementRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class StatsService {

    private final UserService userService;
    private final StatementRepository statementRepository;
    private final QueryLogRepository queryLogRepository;
    private final EntityStore entityStore;
    private final RelationshipStore relationshipStore;

    public Mono<StatsResponse> stats(UUID userId) {
        LocalDateTime weekAgo = LocalDateTime.now().minusDays(7);
        return userService.get(userId)
                .flatMap(user -> Mono.zip(
                                statementRepository.countByUserId(userId),
                                queryLogRepository.countByUserId(userId),
                                statementRepository.countByUserIdAndCreatedAtAfter(userId, weekAgo),
                                entityStore.count(userId),
                                relationshipStore.count(userId))
                        .map(counts -> StatsResponse.builder()
                                .userId(userId.toString())
                                .totalStatements(counts.getT1())
                                .totalQueries(counts.getT2())
                                .thisWeekStatements(counts.getT3())
                                .entityCount(counts.getT4())
                                .relationshipCount(counts.getT5())
                                .build()));
    }
}
