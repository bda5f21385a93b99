package com.graphrecall.controller;

import com.graphrecall.model.dto.AnswerResponse;
import com.graphrecall.model.dto.QueryLogResponse;
import com.graphrecall.model.dto.QuestionRequest;
import com.graphrecall.service.QuestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for asking questions and browsing question history.
 */
@RestController
@RequestMapping("/v1/users/{userId}/questions")
@RequiredArgsConstructor
public class QuestionController {

    private final QuestionService questionService;

    @PostMapping
    public Mono<AnswerResponse> ask(
            @PathVariable UUID userId,
            @Valid @RequestBody QuestionRequest request) {
        return questionService.ask(userId, request.getQuestion());
    }

    @GetMapping
    public Flux<QueryLogResponse> history(
            @PathVariable UUID userId,
            @RequestParam(required = false) Integer limit) {
        return questionService.history(userId, limit);
    }
}
