package com.graphrecall.controller;

import com.graphrecall.service.GraphService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Controller for alias lookup and relationship maintenance.
 */
@RestController
@RequestMapping("/v1/users/{userId}")
@RequiredArgsConstructor
public class GraphController {

    private final GraphService graphService;

    @GetMapping("/entities/{name}/aliases")
    public Mono<Map<String, Object>> aliases(
            @PathVariable UUID userId,
            @PathVariable String name) {
        return graphService.aliases(userId, name)
                .map(aliases -> Map.<String, Object>of("entity", name, "aliases", aliases));
    }

    @PostMapping("/relationships/backfill")
    public Mono<Map<String, Long>> backfill(@PathVariable UUID userId) {
        return graphService.backfill(userId)
                .map(filled -> Map.of("backfilled", filled));
    }
}
