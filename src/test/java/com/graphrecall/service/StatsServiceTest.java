package com.graphrecall.service;

import com.graphrecall.exception.ResourceNotFoundException;
import com.graphrecall.graph.EntityStore;
import com.graphrecall.graph.RelationshipStore;
import com.graphrecall.model.entity.User;
import com.graphrecall.repository.QueryLogRepository;
import com.graphrecall.repository.StatementRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Unit tests for StatsService.
 */
@ExtendWith(MockitoExtension.class)
class StatsServiceTest {

    @Mock
    private UserService userService;

    @Mock
    private StatementRepository statementRepository;

    @Mock
    private QueryLogRepository queryLogRepository;

    @Mock
    private EntityStore entityStore;

    @Mock
    private RelationshipStore relationshipStore;

    @InjectMocks
    private StatsService statsService;

    @Test
    void stats_CollectsAllCounters() {
        User user = User.builder().id(UUID.randomUUID()).username("sam").build();
        UUID userId = user.getId();
        when(userService.get(userId)).thenReturn(Mono.just(user));
        when(statementRepository.countByUserId(userId)).thenReturn(Mono.just(12L));
        when(queryLogRepository.countByUserId(userId)).thenReturn(Mono.just(4L));
        when(statementRepository.countByUserIdAndCreatedAtAfter(eq(userId), any(LocalDateTime.class)))
                .thenReturn(Mono.just(3L));
        when(entityStore.count(userId)).thenReturn(Mono.just(9L));
        when(relationshipStore.count(userId)).thenReturn(Mono.just(7L));

        StepVerifier.create(statsService.stats(userId))
                .assertNext(stats -> {
                    assertThat(stats.getTotalStatements()).isEqualTo(12L);
                    assertThat(stats.getTotalQueries()).isEqualTo(4L);
                    assertThat(stats.getThisWeekStatements()).isEqualTo(3L);
                    assertThat(stats.getEntityCount()).isEqualTo(9L);
                    assertThat(stats.getRelationshipCount()).isEqualTo(7L);
                })
                .verifyComplete();
    }

    @Test
    void stats_UnknownUser() {
        UUID unknown = UUID.randomUUID();
        when(userService.get(unknown)).thenReturn(Mono.error(new ResourceNotFoundException("User", unknown)));

        StepVerifier.create(statsService.stats(unknown))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }
}
