package com.graphrecall.service;

import com.graphrecall.exception.DuplicateResourceException;
import com.graphrecall.exception.ResourceNotFoundException;
import com.graphrecall.model.dto.UserRegisterRequest;
import com.graphrecall.model.dto.UserResponse;
import com.graphrecall.model.entity.User;
import com.graphrecall.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Service for user registration and lookup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    /**
     * Register a new user.
     *
     * @param request registration request
     * @return the created user
     */
    @Transactional
    public Mono<UserResponse> register(UserRegisterRequest request) {
        String username = request.getUsername().trim();
        return userRepository.existsByUsername(username)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateResourceException("User", username));
                    }

                    User user = User.builder()
                            .username(username)
                            .createdAt(LocalDateTime.now())
                            .build();

                    return userRepository.save(user)
                            .doOnNext(saved -> log.info("Registered user {} ({})", saved.getUsername(), saved.getId()))
                            .map(UserService::toResponse);
                });
    }

    /**
     * Load a user, failing with {@link ResourceNotFoundException} when unknown.
     */
    public Mono<User> get(UUID userId) {
        return userRepository.findById(userId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", userId)));
    }

    static UserResponse toResponse(User user) {
        return UserResponse.builder()
                .id(user.getId().toString())
                .username(user.getUsername())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
