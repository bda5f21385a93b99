package com.graphrecall.service;

import com.graphrecall.model.dto.AnswerResponse;
import com.graphrecall.model.dto.QueryLogResponse;
import com.graphrecall.model.graph.RetrievalResult;
import com.graphrecall.pipeline.RetrievalPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Answers questions from a user's graph and logs each retrieval.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionService {

    private final UserService userService;
    private final RetrievalPipeline retrievalPipeline;
    private final QueryHistoryService queryHistoryService;

    public Mono<AnswerResponse> ask(UUID userId, String question) {
        return userService.get(userId)
                .flatMap(user -> retrievalPipeline.answer(user, question))
                .flatMap(result -> queryHistoryService.record(userId, question, result.getTrace())
                        .doOnError(error -> log.warn("Could not log question for {}: {}", userId, error.getMessage()))
                        .onErrorResume(error -> Mono.empty())
                        .thenReturn(toResponse(question, result)));
    }

    public Flux<QueryLogResponse> history(UUID userId, Integer limit) {
        return userService.get(userId)
                .flatMapMany(user -> queryHistoryService.recent(user.getId(), limit));
    }

    private static AnswerResponse toResponse(String question, RetrievalResult result) {
        return AnswerResponse.builder()
                .question(question)
                .status(result.getStatus())
                .answer(result.getAnswer())
                .statements(result.getStatements())
                .matchedEntities(result.getMatchedEntities())
                .entities(result.getTrace().getEntities())
                .relationship(result.getTrace().getRelationshipPhrase())
                .searchDescription(result.getTrace().getSearchDescription())
                .build();
    }
}
