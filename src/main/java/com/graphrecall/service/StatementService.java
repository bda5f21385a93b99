package com.graphrecall.service;

import com.graphrecall.model.dto.StatementRequest;
import com.graphrecall.model.dto.StatementResponse;
import com.graphrecall.model.entity.Statement;
import com.graphrecall.model.graph.IngestionReport;
import com.graphrecall.pipeline.IngestionPipeline;
import com.graphrecall.repository.StatementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Records raw statements and feeds them to graph ingestion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatementService {

    static final int DEFAULT_LIMIT = 10;

    private final UserService userService;
    private final StatementRepository statementRepository;
    private final IngestionPipeline ingestionPipeline;

    /**
     * Persist the statement, then ingest it into the user's graph.
     * The statement is kept even when every enrichment step fails.
     */
    public Mono<StatementResponse> record(UUID userId, StatementRequest request) {
        return userService.get(userId)
                .flatMap(user -> statementRepository.save(Statement.builder()
                                .userId(user.getId())
                                .content(request.getContent())
                                .category(blankToNull(request.getCategory()))
                                .tags(blankToNull(request.getTags()))
                                .createdAt(LocalDateTime.now())
                                .build())
                        .flatMap(saved -> ingestionPipeline.ingest(user, saved.getContent())
                                .onErrorResume(error -> {
                                    log.error("Ingestion of statement {} failed", saved.getId(), error);
                                    IngestionReport report = IngestionReport.empty();
                                    report.recordFailure(error.getMessage());
                                    return Mono.just(report);
                                })
                                .map(report -> toResponse(saved, report))));
    }

    public Flux<StatementResponse> recent(UUID userId, Integer limit) {
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
        return userService.get(userId)
                .flatMapMany(user -> statementRepository.findRecent(user.getId(), effectiveLimit))
                .map(statement -> toResponse(statement, null));
    }

    public Flux<StatementResponse> search(UUID userId, String term, String category) {
        return userService.get(userId)
                .flatMapMany(user -> statementRepository.search(
                        user.getId(), term == null ? "" : term.trim(), blankToNull(category)))
                .map(statement -> toResponse(statement, null));
    }

    private static StatementResponse toResponse(Statement statement, IngestionReport report) {
        return StatementResponse.builder()
                .id(statement.getId().toString())
                .content(statement.getContent())
                .category(statement.getCategory())
                .tags(statement.getTags())
                .createdAt(statement.getCreatedAt())
                .ingestion(report)
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
