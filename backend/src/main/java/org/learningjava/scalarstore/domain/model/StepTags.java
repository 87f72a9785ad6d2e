package org.learningjava.scalarstore.domain.model;

import java.util.List;

/**
 * Per-row metadata: the step, the scalar names populated in that row (sorted) and the row's tags.
 */
public record StepTags(long step, List<String> scalarNames, List<String> tags) {

    public StepTags {
        scalarNames = List.copyOf(scalarNames);
        tags = List.copyOf(tags);
    }
}
