package com.graphrecall.controller;

import com.graphrecall.model.dto.StatementRequest;
import com.graphrecall.model.dto.StatementResponse;
import com.graphrecall.service.StatementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for recording and browsing statements.
 */
@RestController
@RequestMapping("/v1/users/{userId}/statements")
@RequiredArgsConstructor
public class StatementController {

    private final StatementService statementService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<StatementResponse> record(
            @PathVariable UUID userId,
            @Valid @RequestBody StatementRequest request) {
        return statementService.record(userId, request);
    }

    @GetMapping
    public Flux<StatementResponse> recent(
            @PathVariable UUID userId,
            @RequestParam(required = false) Integer limit) {
        return statementService.recent(userId, limit);
    }

    @GetMapping("/search")
    public Flux<StatementResponse> search(
            @PathVariable UUID userId,
            @RequestParam("q") String term,
            @RequestParam(required = false) String category) {
        return statementService.search(userId, term, category);
    }
}
