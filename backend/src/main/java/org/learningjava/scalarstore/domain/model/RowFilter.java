package org.learningjava.scalarstore.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Read filter for a project table.
 *
 * @param experimentIds      null scans the whole project
 * @param startTime          inclusive lower bound on the row timestamp, or null
 * @param endTime            inclusive upper bound on the row timestamp, or null
 * @param limitPerExperiment flat cap on rows returned per experiment
 */
public record RowFilter(
        List<String> experimentIds,
        Instant startTime,
        Instant endTime,
        int limitPerExperiment
) {
    public RowFilter {
        experimentIds = experimentIds == null ? null : List.copyOf(experimentIds);
        if (limitPerExperiment <= 0) {
            throw new IllegalArgumentException("limitPerExperiment must be positive");
        }
    }

    public boolean wholeProject() {
        return experimentIds == null;
    }
}
