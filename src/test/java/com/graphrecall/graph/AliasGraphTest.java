package com.graphrecall.graph;

import com.graphrecall.exception.AliasConflictException;
import com.graphrecall.model.entity.Entity;
import com.graphrecall.model.graph.AliasAction;
import com.graphrecall.model.graph.AliasOutcome;
import com.graphrecall.support.InMemoryAliasRepository;
import com.graphrecall.support.InMemoryEntityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AliasGraphTest {

    private InMemoryEntityRepository entityRepository;
    private InMemoryAliasRepository aliasRepository;
    private AliasGraph aliasGraph;
    private UUID userId;

    @BeforeEach
    void setUp() {
        entityRepository = new InMemoryEntityRepository();
        aliasRepository = new InMemoryAliasRepository();
        aliasGraph = new AliasGraph(aliasRepository, entityRepository);
        userId = UUID.randomUUID();
    }

    @Test
    void handleAlias_NeitherGroupedCreatesGroup() {
        Entity marissa = entity("Marissa");
        Entity fiancee = entity("sam's fiancee");

        AliasOutcome outcome = aliasGraph.handleAlias(marissa, fiancee).block();

        assertThat(outcome.getAction()).isEqualTo(AliasAction.CREATED_GROUP);
        assertThat(aliasGraph.membersOf(marissa.getId()).collectList().block())
                .containsExactlyInAnyOrder(marissa.getId(), fiancee.getId());
        assertThat(aliasRepository.findGroup(outcome.getGroupId()).block().getCanonicalEntityId())
                .isEqualTo(marissa.getId());
    }

    @Test
    void handleAlias_UngroupedEntityJoinsExistingGroup() {
        Entity marissa = entity("Marissa");
        Entity fiancee = entity("sam's fiancee");
        Entity riss = entity("Riss");
        AliasOutcome created = aliasGraph.handleAlias(marissa, fiancee).block();

        AliasOutcome joined = aliasGraph.handleAlias(riss, marissa).block();

        assertThat(joined.getAction()).isEqualTo(AliasAction.JOINED_GROUP);
        assertThat(joined.getGroupId()).isEqualTo(created.getGroupId());
        assertThat(aliasGraph.membersOf(riss.getId()).collectList().block()).hasSize(3);
    }

    @Test
    void handleAlias_SameGroupIsNoOp() {
        Entity marissa = entity("Marissa");
        Entity fiancee = entity("sam's fiancee");
        aliasGraph.handleAlias(marissa, fiancee).block();

        StepVerifier.create(aliasGraph.handleAlias(fiancee, marissa))
                .assertNext(outcome -> assertThat(outcome.getAction()).isEqualTo(AliasAction.ALREADY_GROUPED))
                .verifyComplete();
        assertThat(aliasRepository.groupCount()).isEqualTo(1);
    }

    @Test
    void handleAlias_MergesSmallerGroupIntoLarger() {
        Entity a = entity("a");
        Entity b = entity("b");
        Entity c = entity("c");
        Entity d = entity("d");
        Entity e = entity("e");
        AliasOutcome larger = aliasGraph.handleAlias(a, b).block();
        aliasGraph.handleAlias(c, a).block();
        AliasOutcome smaller = aliasGraph.handleAlias(d, e).block();

        AliasOutcome merged = aliasGraph.handleAlias(d, a).block();

        assertThat(merged.getAction()).isEqualTo(AliasAction.MERGED_GROUPS);
        assertThat(merged.getGroupId()).isEqualTo(larger.getGroupId());
        assertThat(merged.getRemovedGroupId()).isEqualTo(smaller.getGroupId());
        assertThat(merged.getMovedMembers()).isEqualTo(2);
        assertThat(aliasRepository.countMembers(larger.getGroupId()).block()).isEqualTo(5L);
        assertThat(aliasRepository.countMembers(smaller.getGroupId()).block()).isZero();
        assertThat(aliasRepository.groupExists(smaller.getGroupId())).isFalse();
    }

    @Test
    void handleAlias_TieMergesTargetGroupIntoSourceGroup() {
        Entity a = entity("a");
        Entity b = entity("b");
        Entity c = entity("c");
        Entity d = entity("d");
        AliasOutcome first = aliasGraph.handleAlias(a, b).block();
        AliasOutcome second = aliasGraph.handleAlias(c, d).block();

        AliasOutcome merged = aliasGraph.handleAlias(a, c).block();

        assertThat(merged.getGroupId()).isEqualTo(first.getGroupId());
        assertThat(merged.getRemovedGroupId()).isEqualTo(second.getGroupId());
        assertThat(aliasGraph.membersOf(d.getId()).collectList().block()).hasSize(4);
    }

    @Test
    void handleAlias_SelfAliasIsIgnored() {
        Entity marissa = entity("Marissa");

        StepVerifier.create(aliasGraph.handleAlias(marissa, marissa))
                .assertNext(outcome -> assertThat(outcome.getAction()).isEqualTo(AliasAction.IGNORED))
                .verifyComplete();
        assertThat(aliasRepository.groupCount()).isZero();
    }

    @Test
    void handleAlias_CrossUserIsRejected() {
        Entity mine = entity("Marissa");
        Entity theirs = entityRepository.save(Entity.builder().userId(UUID.randomUUID()).name("Marissa").build());

        StepVerifier.create(aliasGraph.handleAlias(mine, theirs))
                .expectError(AliasConflictException.class)
                .verify();
    }

    @Test
    void membersOf_UngroupedEntityIsItsOwnMember() {
        Entity loner = entity("loner");

        StepVerifier.create(aliasGraph.membersOf(loner.getId()))
                .expectNext(loner.getId())
                .verifyComplete();
    }

    @Test
    void aliasNames_ExcludesEntityItself() {
        Entity marissa = entity("Marissa");
        Entity fiancee = entity("sam's fiancee");
        aliasGraph.handleAlias(marissa, fiancee).block();

        StepVerifier.create(aliasGraph.aliasNames(fiancee))
                .expectNext("Marissa")
                .verifyComplete();
    }

    private Entity entity(String name) {
        return entityRepository.save(Entity.builder().userId(userId).name(name).build());
    }
}
