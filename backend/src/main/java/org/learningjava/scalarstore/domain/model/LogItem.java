package org.learningjava.scalarstore.domain.model;

import java.util.List;
import java.util.Map;

/**
 * One step worth of scalars for a single experiment.
 */
public record LogItem(
        long step,
        Map<String, Double> scalars,
        List<String> tags
) {
    public LogItem {
        scalars = scalars == null ? Map.of() : scalars;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
