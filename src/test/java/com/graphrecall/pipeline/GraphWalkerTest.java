package com.graphrecall.pipeline;

import com.graphrecall.graph.RelationshipStore;
import com.graphrecall.model.entity.Entity;
import com.graphrecall.model.entity.Relationship;
import com.graphrecall.support.FakeLanguageModelGateway;
import com.graphrecall.support.InMemoryEntityRepository;
import com.graphrecall.support.InMemoryRelationshipRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class GraphWalkerTest {

    private InMemoryEntityRepository entityRepository;
    private InMemoryRelationshipRepository relationshipRepository;
    private GraphWalker walker;
    private UUID userId;

    @BeforeEach
    void setUp() {
        entityRepository = new InMemoryEntityRepository();
        relationshipRepository = new InMemoryRelationshipRepository(entityRepository);
        walker = new GraphWalker(new RelationshipStore(relationshipRepository, new FakeLanguageModelGateway()));
        userId = UUID.randomUUID();
    }

    @Test
    void walk_StopsAtMaxHops() {
        List<Entity> chain = chain(userId, "a", "b", "c", "d", "e", "f");

        List<Relationship> edges = walker.walk(userId, chain.get(0).getId(), 4).block();

        assertThat(labels(edges)).containsExactly("a->b", "b->c", "c->d", "d->e");
    }

    @Test
    void walk_CollectsEveryBranchAtEachLevel() {
        Entity sam = entity(userId, "sam");
        Entity jake = entity(userId, "Jake Owen");
        Entity denver = entity(userId, "Denver");
        Entity florida = entity(userId, "Florida");
        edge(userId, sam, jake, "favorite country artist is");
        edge(userId, sam, denver, "lives in");
        edge(userId, jake, florida, "is from");

        List<Relationship> edges = walker.walk(userId, sam.getId(), 1).block();

        assertThat(labels(edges)).containsExactlyInAnyOrder("favorite country artist is", "lives in");
    }

    @Test
    void walk_TerminatesOnCycles() {
        Entity a = entity(userId, "a");
        Entity b = entity(userId, "b");
        edge(userId, a, b, "a->b");
        edge(userId, b, a, "b->a");

        List<Relationship> edges = walker.walk(userId, a.getId(), 10).block();

        assertThat(labels(edges)).containsExactly("a->b", "b->a");
    }

    @Test
    void walk_NeverEntersAnotherUsersGraph() {
        UUID otherUser = UUID.randomUUID();
        Entity sam = entity(userId, "sam");
        Entity jake = entity(userId, "Jake Owen");
        edge(userId, sam, jake, "likes");
        Entity intruder = entity(otherUser, "secret");
        relationshipRepository.save(Relationship.builder()
                .userId(otherUser)
                .sourceEntityId(sam.getId())
                .targetEntityId(intruder.getId())
                .label("leaks")
                .labelEmbedding(FakeLanguageModelGateway.DEFAULT_EMBEDDING)
                .originalInput("not yours")
                .build());

        List<Relationship> edges = walker.walk(userId, sam.getId(), 4).block();

        assertThat(labels(edges)).containsExactly("likes");
        assertThat(edges).allMatch(edge -> edge.getUserId().equals(userId));
    }

    @Test
    void walk_AnchorWithoutEdgesYieldsNothing() {
        Entity loner = entity(userId, "loner");

        assertThat(walker.walk(userId, loner.getId(), 4).block()).isEmpty();
    }

    private List<Entity> chain(UUID owner, String... names) {
        List<Entity> entities = Arrays.stream(names)
                .map(name -> entity(owner, name))
                .collect(Collectors.toList());
        for (int i = 0; i + 1 < entities.size(); i++) {
            edge(owner, entities.get(i), entities.get(i + 1), names[i] + "->" + names[i + 1]);
        }
        return entities;
    }

    private Entity entity(UUID owner, String name) {
        return entityRepository.save(Entity.builder().userId(owner).name(name).build());
    }

    private void edge(UUID owner, Entity source, Entity target, String label) {
        relationshipRepository.save(Relationship.builder()
                .userId(owner)
                .sourceEntityId(source.getId())
                .targetEntityId(target.getId())
                .label(label)
                .labelEmbedding(FakeLanguageModelGateway.DEFAULT_EMBEDDING)
                .originalInput(label)
                .build());
    }

    private static List<String> labels(List<Relationship> edges) {
        return edges.stream().map(Relationship::getLabel).collect(Collectors.toList());
    }
}
