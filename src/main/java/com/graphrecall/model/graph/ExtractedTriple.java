package com.graphrecall.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One statement fragment as returned by extraction: {@code source --relationship--> target}.
 * When {@code alias} is set the two sides name the same referent and no edge is written.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedTriple {

    private String source;

    private String relationship;

    private String target;

    private boolean alias;

    public boolean isComplete() {
        return notBlank(source) && notBlank(target) && (alias || notBlank(relationship));
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
