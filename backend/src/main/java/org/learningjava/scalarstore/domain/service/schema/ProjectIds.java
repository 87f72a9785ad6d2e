package org.learningjava.scalarstore.domain.service.schema;

import java.util.Locale;
import java.util.Objects;

/**
 * One spelling per project. Table names, mapping snapshots and cache keys are all keyed by the
 * canonical id, so {@code ABC-DEF} and {@code abcdef} address the same data.
 */
public final class ProjectIds {

    private ProjectIds() {
    }

    /** Lower-cased, dashes removed; rejected when it cannot name a table. */
    public static String canonical(String projectId) {
        Objects.requireNonNull(projectId, "projectId");
        String id = projectId.toLowerCase(Locale.ROOT).replace("-", "");
        Identifiers.requireSafe(TableManager.SCALARS_PREFIX + id);
        return id;
    }
}
