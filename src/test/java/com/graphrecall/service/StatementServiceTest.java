package com.graphrecall.service;

import com.graphrecall.model.dto.StatementRequest;
import com.graphrecall.model.entity.Statement;
import com.graphrecall.model.entity.User;
import com.graphrecall.model.graph.IngestionReport;
import com.graphrecall.pipeline.IngestionPipeline;
import com.graphrecall.repository.StatementRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for StatementService.
 */
@ExtendWith(MockitoExtension.class)
class StatementServiceTest {

    @Mock
    private UserService userService;

    @Mock
    private StatementRepository statementRepository;

    @Mock
    private IngestionPipeline ingestionPipeline;

    @InjectMocks
    private StatementService statementService;

    private User user;
    private Statement saved;

    @BeforeEach
    void setUp() {
        user = User.builder().id(UUID.randomUUID()).username("sam").build();
        saved = Statement.builder()
                .id(UUID.randomUUID())
                .userId(user.getId())
                .content("Jake Owen is my favorite country artist")
                .category("music")
                .createdAt(LocalDateTime.now())
                .build();
    }

    @Test
    void record_SavesThenIngests() {
        IngestionReport report = IngestionReport.builder().fragments(1).edgesWritten(1).build();
        when(userService.get(user.getId())).thenReturn(Mono.just(user));
        when(statementRepository.save(any(Statement.class))).thenReturn(Mono.just(saved));
        when(ingestionPipeline.ingest(user, saved.getContent())).thenReturn(Mono.just(report));

        StatementRequest request = StatementRequest.builder()
                .content(saved.getContent())
                .category(" music ")
                .tags("")
                .build();

        StepVerifier.create(statementService.record(user.getId(), request))
                .assertNext(response -> {
                    assertThat(response.getId()).isEqualTo(saved.getId().toString());
                    assertThat(response.getIngestion().getEdgesWritten()).isEqualTo(1);
                })
                .verifyComplete();

        ArgumentCaptor<Statement> captor = ArgumentCaptor.forClass(Statement.class);
        verify(statementRepository).save(captor.capture());
        assertThat(captor.getValue().getCategory()).isEqualTo("music");
        assertThat(captor.getValue().getTags()).isNull();
    }

    @Test
    void record_IngestionErrorKeepsStatement() {
        when(userService.get(user.getId())).thenReturn(Mono.just(user));
        when(statementRepository.save(any(Statement.class))).thenReturn(Mono.just(saved));
        when(ingestionPipeline.ingest(eq(user), any(String.class)))
                .thenReturn(Mono.error(new IllegalStateException("database went away")));

        StatementRequest request = StatementRequest.builder().content(saved.getContent()).build();

        StepVerifier.create(statementService.record(user.getId(), request))
                .assertNext(response -> {
                    assertThat(response.getContent()).isEqualTo(saved.getContent());
                    assertThat(response.getIngestion().getFailures()).containsExactly("database went away");
                })
                .verifyComplete();
    }

    @Test
    void recent_DefaultsToTen() {
        when(userService.get(user.getId())).thenReturn(Mono.just(user));
        when(statementRepository.findRecent(user.getId(), 10)).thenReturn(Flux.just(saved));

        StepVerifier.create(statementService.recent(user.getId(), null))
                .assertNext(response -> assertThat(response.getIngestion()).isNull())
                .verifyComplete();
    }

    @Test
    void search_PassesBlankCategoryAsNull() {
        when(userService.get(user.getId())).thenReturn(Mono.just(user));
        when(statementRepository.search(user.getId(), "jake", null)).thenReturn(Flux.just(saved));

        StepVerifier.create(statementService.search(user.getId(), " jake ", " "))
                .expectNextCount(1)
                .verifyComplete();
    }
}
