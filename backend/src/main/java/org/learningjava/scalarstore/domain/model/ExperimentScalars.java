package org.learningjava.scalarstore.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reassembled time series of one experiment. {@code tags} is null unless tags were requested.
 */
public record ExperimentScalars(
        String experimentId,
        Map<String, ScalarSeries> scalars,
        List<StepTags> tags
) {
    public ExperimentScalars {
        scalars = Collections.unmodifiableMap(new LinkedHashMap<>(scalars));
        tags = tags == null ? null : List.copyOf(tags);
    }
}
