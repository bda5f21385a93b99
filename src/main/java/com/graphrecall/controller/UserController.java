package com.graphrecall.controller;

import com.graphrecall.model.dto.StatsResponse;
import com.graphrecall.model.dto.UserRegisterRequest;
import com.graphrecall.model.dto.UserResponse;
import com.graphrecall.service.StatsService;
import com.graphrecall.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for user registration and per-user stats.
 */
@RestController
@RequestMapping("/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final StatsService statsService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<UserResponse> register(@Valid @RequestBody UserRegisterRequest request) {
        return userService.register(request);
    }

    @GetMapping("/{userId}/stats")
    public Mono<StatsResponse> stats(@PathVariable UUID userId) {
        return statsService.stats(userId);
    }
}
