package com.graphrecall.pipeline;

import com.graphrecall.model.graph.ExtractedTriple;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AttributionPolicyTest {

    private final AttributionPolicy policy = new AttributionPolicy();

    @Test
    void apply_ThirdPartyDescriptionBecomesSpeakerClaim() {
        ExtractedTriple claim = policy.apply(triple("the food at Lucia's", "is", "spicy"), "sam");

        assertThat(claim.getSource()).isEqualTo("sam");
        assertThat(claim.getRelationship()).isEqualTo("claims is spicy");
        assertThat(claim.getTarget()).isEqualTo("the food at Lucia's");
    }

    @Test
    void apply_SensoryVerbsAreDescriptive() {
        ExtractedTriple claim = policy.apply(triple("the soup", "tastes", "bland"), "sam");

        assertThat(claim.getSource()).isEqualTo("sam");
        assertThat(claim.getRelationship()).isEqualTo("claims tastes bland");
    }

    @Test
    void apply_FirstPersonFragmentPassesThrough() {
        ExtractedTriple fact = triple("sam", "favorite country artist is", "Jake Owen");

        assertThat(policy.apply(fact, "sam")).isEqualTo(fact);
        assertThat(policy.apply(triple("Sam", "is", "tired"), "sam").getSource()).isEqualTo("Sam");
    }

    @Test
    void apply_NonDescriptiveThirdPartyFragmentPassesThrough() {
        ExtractedTriple fact = triple("sam's partner", "works at", "Acme");

        assertThat(policy.apply(fact, "sam")).isEqualTo(fact);
    }

    @Test
    void apply_AliasFragmentPassesThrough() {
        ExtractedTriple alias = triple("Marissa", "is", "sam's fiancee").toBuilder().alias(true).build();

        assertThat(policy.apply(alias, "sam")).isEqualTo(alias);
    }

    private static ExtractedTriple triple(String source, String relationship, String target) {
        return ExtractedTriple.builder().source(source).relationship(relationship).target(target).build();
    }
}
