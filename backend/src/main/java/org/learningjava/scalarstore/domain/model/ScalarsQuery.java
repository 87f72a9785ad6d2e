package org.learningjava.scalarstore.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Read request against one project. Null {@code experimentIds} (or an empty list) targets the
 * whole project; null {@code maxPoints} falls back to the configured default.
 */
public record ScalarsQuery(
        String projectId,
        List<String> experimentIds,
        Integer maxPoints,
        boolean returnTags,
        Instant startTime,
        Instant endTime
) {
    public ScalarsQuery {
        experimentIds = (experimentIds == null || experimentIds.isEmpty())
                ? null
                : experimentIds.stream().distinct().toList();
    }

    public static ScalarsQuery forExperiments(String projectId, List<String> experimentIds) {
        return new ScalarsQuery(projectId, experimentIds, null, false, null, null);
    }

    public static ScalarsQuery forProject(String projectId) {
        return new ScalarsQuery(projectId, null, null, false, null, null);
    }

    public boolean wholeProject() {
        return experimentIds == null;
    }

    public boolean hasTimeRange() {
        return startTime != null || endTime != null;
    }
}
