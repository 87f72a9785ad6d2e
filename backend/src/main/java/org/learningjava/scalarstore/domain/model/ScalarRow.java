package org.learningjava.scalarstore.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One physical row of a project scalar table.
 *
 * @param values internal column to value; absent columns are NULL in storage
 */
public record ScalarRow(
        Instant timestamp,
        String experimentId,
        long step,
        List<String> tags,
        Map<String, Double> values
) {
    public ScalarRow {
        tags = tags == null ? List.of() : List.copyOf(tags);
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
