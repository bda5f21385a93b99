package com.graphrecall.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphrecall.model.dto.QueryLogResponse;
import com.graphrecall.model.entity.QueryLog;
import com.graphrecall.model.graph.RetrievalTrace;
import com.graphrecall.repository.QueryLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Audit trail of asked questions and what retrieval looked at to answer them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryHistoryService {

    static final int DEFAULT_LIMIT = 10;

    private final QueryLogRepository queryLogRepository;
    private final ObjectMapper objectMapper;

    public Mono<QueryLog> record(UUID userId, String question, RetrievalTrace trace) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(trace.getEntities()))
                .flatMap(entities -> queryLogRepository.save(QueryLog.builder()
                        .userId(userId)
                        .question(question)
                        .resultCount(trace.getResultCount())
                        .entities(entities)
                        .relationship(trace.getRelationshipPhrase())
                        .searchDescription(trace.getSearchDescription())
                        .createdAt(LocalDateTime.now())
                        .build()));
    }

    public Flux<QueryLogResponse> recent(UUID userId, Integer limit) {
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
        return queryLogRepository.findRecent(userId, effectiveLimit)
                .map(this::toResponse);
    }

    private QueryLogResponse toResponse(QueryLog entry) {
        return QueryLogResponse.builder()
                .id(entry.getId().toString())
                .question(entry.getQuestion())
                .resultCount(entry.getResultCount() == null ? 0 : entry.getResultCount())
                .entities(readEntities(entry))
                .relationship(entry.getRelationship())
                .searchDescription(entry.getSearchDescription())
                .createdAt(entry.getCreatedAt())
                .build();
    }

    private List<String> readEntities(QueryLog entry) {
        if (entry.getEntities() == null || entry.getEntities().isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(entry.getEntities(), new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Unreadable entities on query log {}: {}", entry.getId(), e.getMessage());
            return List.of();
        }
    }
}
