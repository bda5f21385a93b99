package com.graphrecall.pipeline;

import com.graphrecall.config.GraphProperties;
import com.graphrecall.graph.AliasGraph;
import com.graphrecall.graph.EntityStore;
import com.graphrecall.graph.RelationshipStore;
import com.graphrecall.model.entity.Entity;
import com.graphrecall.model.entity.Relationship;
import com.graphrecall.model.entity.User;
import com.graphrecall.model.graph.ExtractedTriple;
import com.graphrecall.model.graph.IngestionReport;
import com.graphrecall.support.FakeLanguageModelGateway;
import com.graphrecall.support.InMemoryAliasRepository;
import com.graphrecall.support.InMemoryEntityRepository;
import com.graphrecall.support.InMemoryRelationshipRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionPipelineTest {

    private static final String FAVORITE = "Jake Owen is my favorite country artist";

    private InMemoryEntityRepository entityRepository;
    private InMemoryRelationshipRepository relationshipRepository;
    private InMemoryAliasRepository aliasRepository;
    private FakeLanguageModelGateway gateway;
    private RelationshipStore relationshipStore;
    private AliasGraph aliasGraph;
    private IngestionPipeline pipeline;
    private User sam;

    @BeforeEach
    void setUp() {
        entityRepository = new InMemoryEntityRepository();
        relationshipRepository = new InMemoryRelationshipRepository(entityRepository);
        aliasRepository = new InMemoryAliasRepository();
        gateway = new FakeLanguageModelGateway();
        EntityStore entityStore = new EntityStore(entityRepository, gateway, new GraphProperties());
        relationshipStore = new RelationshipStore(relationshipRepository, gateway);
        aliasGraph = new AliasGraph(aliasRepository, entityRepository);
        pipeline = new IngestionPipeline(gateway, new AttributionPolicy(), entityStore, relationshipStore, aliasGraph);
        sam = User.builder().id(UUID.randomUUID()).username("sam").build();
    }

    @Test
    void ingest_FirstPersonStatementWritesOneEdge() {
        gateway.extraction(FAVORITE, triple("sam", "favorite country artist is", "Jake Owen"));

        StepVerifier.create(pipeline.ingest(sam, FAVORITE))
                .assertNext(report -> {
                    assertThat(report.getFragments()).isEqualTo(1);
                    assertThat(report.getEdgesWritten()).isEqualTo(1);
                    assertThat(report.getFailures()).isEmpty();
                })
                .verifyComplete();

        List<Relationship> edges = relationshipRepository.all();
        assertThat(edges).hasSize(1);
        Relationship edge = edges.get(0);
        assertThat(edge.getSourceName()).isEqualTo("sam");
        assertThat(edge.getLabel()).isEqualTo("favorite country artist is");
        assertThat(edge.getTargetName()).isEqualTo("Jake Owen");
        assertThat(edge.getOriginalInput()).isEqualTo(FAVORITE);
        assertThat(edge.hasDescription()).isTrue();
    }

    @Test
    void ingest_ThirdPartyClaimIsAttributedToSpeaker() {
        String statement = "the food at Lucia's is spicy";
        gateway.extraction(statement, triple("the food at Lucia's", "is", "spicy"));

        pipeline.ingest(sam, statement).block();

        List<Relationship> edges = relationshipRepository.all();
        assertThat(edges).hasSize(1);
        assertThat(edges.get(0).getSourceName()).isEqualTo("sam");
        assertThat(edges.get(0).getLabel()).isEqualTo("claims is spicy");
        assertThat(edges.get(0).getTargetName()).isEqualTo("the food at Lucia's");
        assertThat(entityRepository.findByName(sam.getId(), "spicy").block()).isNull();
    }

    @Test
    void ingest_AliasFragmentGroupsEntitiesWithoutEdge() {
        String statement = "Marissa is my fiancee";
        gateway.extraction(statement,
                triple("Marissa", "is", "sam's fiancee").toBuilder().alias(true).build());

        IngestionReport report = pipeline.ingest(sam, statement).block();

        assertThat(report.getAliasesHandled()).isEqualTo(1);
        assertThat(relationshipRepository.all()).isEmpty();
        Entity fiancee = entityRepository.findByName(sam.getId(), "sam's fiancee").block();
        assertThat(aliasGraph.aliasNames(fiancee).collectList().block()).containsExactly("Marissa");
    }

    @Test
    void ingest_FailingFragmentDoesNotAbortTheRest() {
        String statement = "I like hiking and I live in Denver";
        gateway.extraction(statement,
                triple("sam", "likes", "hiking"),
                triple("sam", "lives in", "Denver"));
        gateway.failEmbeddingOf("likes");

        IngestionReport report = pipeline.ingest(sam, statement).block();

        assertThat(report.getFragments()).isEqualTo(2);
        assertThat(report.getEdgesWritten()).isEqualTo(1);
        assertThat(report.getFailures()).hasSize(1);
        assertThat(report.getFailures().get(0)).contains("likes");
        assertThat(relationshipRepository.all()).extracting(Relationship::getLabel).containsExactly("lives in");
    }

    @Test
    void ingest_ExtractionFailureIsReportedNotThrown() {
        gateway.failExtraction();

        StepVerifier.create(pipeline.ingest(sam, FAVORITE))
                .assertNext(report -> {
                    assertThat(report.getFragments()).isZero();
                    assertThat(report.getFailures()).hasSize(1);
                })
                .verifyComplete();
        assertThat(entityRepository.all()).isEmpty();
    }

    @Test
    void ingest_DescriptionFailureStoresEdgeForBackfill() {
        gateway.extraction(FAVORITE, triple("sam", "favorite country artist is", "Jake Owen"));
        gateway.failRelationshipDescriptions(true);

        IngestionReport report = pipeline.ingest(sam, FAVORITE).block();

        assertThat(report.getEdgesWritten()).isEqualTo(1);
        Relationship edge = relationshipRepository.all().get(0);
        assertThat(edge.hasDescription()).isFalse();
        assertThat(edge.getLabelEmbedding()).isNotNull();

        gateway.failRelationshipDescriptions(false);
        assertThat(relationshipStore.backfillMissing(sam.getId(), 10).block()).isEqualTo(1L);
        assertThat(relationshipRepository.all().get(0).hasDescription()).isTrue();
    }

    @Test
    void ingest_KnownEntitiesAccumulateTheStatement() {
        gateway.extraction(FAVORITE, triple("sam", "favorite country artist is", "Jake Owen"));
        pipeline.ingest(sam, FAVORITE).block();
        String concert = "Jake Owen played a great show in Denver";
        gateway.extraction(concert, triple("sam", "saw live", "Jake Owen"));

        IngestionReport report = pipeline.ingest(sam, concert).block();

        assertThat(report.getContextAppends()).isEqualTo(2);
        Entity jake = entityRepository.findByName(sam.getId(), "Jake Owen").block();
        assertThat(jake.getDescription()).endsWith(concert);
        assertThat(entityRepository.all()).hasSize(2);
    }

    @Test
    void ingest_RepeatedStatementDoesNotDuplicateEdges() {
        gateway.extraction(FAVORITE, triple("sam", "favorite country artist is", "Jake Owen"));

        pipeline.ingest(sam, FAVORITE).block();
        pipeline.ingest(sam, FAVORITE).block();

        assertThat(relationshipRepository.all()).hasSize(1);
    }

    private static ExtractedTriple triple(String source, String relationship, String target) {
        return ExtractedTriple.builder().source(source).relationship(relationship).target(target).build();
    }
}
