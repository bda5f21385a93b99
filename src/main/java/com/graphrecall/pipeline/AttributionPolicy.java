package com.graphrecall.pipeline;

import com.graphrecall.model.graph.ExtractedTriple;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Re-attributes descriptive claims about third parties to the speaker.
 *
 * <p>"the food at X is spicy" said by sam is stored as
 * {@code sam --claims is spicy--> the food at X}, never as a bare fact about X.
 * Fragments whose source is the speaker, and alias fragments, pass through unchanged.</p>
 */
@Component
public class AttributionPolicy {

    static final String CLAIM_PREFIX = "claims";

    private static final Set<String> DESCRIPTIVE_VERBS = Set.of(
            "is", "are", "was", "were", "am", "be", "been",
            "seem", "seems", "look", "looks", "appear", "appears",
            "taste", "tastes", "sound", "sounds", "feel", "feels", "smell", "smells"
    );

    public ExtractedTriple apply(ExtractedTriple triple, String username) {
        if (triple.isAlias()
                || triple.getSource().equalsIgnoreCase(username)
                || !isDescriptive(triple.getRelationship())) {
            return triple;
        }
        return triple.toBuilder()
                .source(username)
                .relationship(CLAIM_PREFIX + " " + triple.getRelationship() + " " + triple.getTarget())
                .target(triple.getSource())
                .build();
    }

    boolean isDescriptive(String relationship) {
        String normalized = relationship.trim().toLowerCase(Locale.ROOT);
        int space = normalized.indexOf(' ');
        String verb = space < 0 ? normalized : normalized.substring(0, space);
        return DESCRIPTIVE_VERBS.contains(verb);
    }
}
