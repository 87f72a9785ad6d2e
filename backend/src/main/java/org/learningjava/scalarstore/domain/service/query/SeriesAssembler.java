package org.learningjava.scalarstore.domain.service.query;

import org.learningjava.scalarstore.domain.model.ExperimentScalars;
import org.learningjava.scalarstore.domain.model.NameMapping;
import org.learningjava.scalarstore.domain.model.ScalarRow;
import org.learningjava.scalarstore.domain.model.ScalarSeries;
import org.learningjava.scalarstore.domain.model.StepTags;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds per-experiment, per-scalar series from raw table rows.
 * Rows are expected ordered by experiment then step; that order is kept.
 */
@Component
public class SeriesAssembler {

    public List<ExperimentScalars> assemble(List<ScalarRow> rows, NameMapping mapping, int maxPoints, boolean returnTags) {
        Map<String, Builder> byExperiment = new LinkedHashMap<>();
        for (ScalarRow row : rows) {
            byExperiment.computeIfAbsent(row.experimentId(), Builder::new)
                    .add(row, mapping, maxPoints, returnTags);
        }
        List<ExperimentScalars> out = new ArrayList<>(byExperiment.size());
        for (Builder b : byExperiment.values()) {
            out.add(b.build(returnTags));
        }
        return out;
    }

    private static final class Builder {
        private final String experimentId;
        private final Map<String, List<Long>> steps = new LinkedHashMap<>();
        private final Map<String, List<Double>> values = new LinkedHashMap<>();
        private final List<StepTags> tags = new ArrayList<>();

        Builder(String experimentId) {
            this.experimentId = experimentId;
        }

        void add(ScalarRow row, NameMapping mapping, int maxPoints, boolean returnTags) {
            List<String> populated = new ArrayList<>();
            row.values().forEach((column, value) -> {
                if (value == null) {
                    return;
                }
                Optional<String> name = mapping.nameFor(column);
                if (name.isEmpty()) {
                    return; // orphaned column
                }
                List<Long> xs = steps.computeIfAbsent(name.get(), k -> new ArrayList<>());
                if (xs.size() < maxPoints) {
                    xs.add(row.step());
                    values.computeIfAbsent(name.get(), k -> new ArrayList<>()).add(value);
                }
                populated.add(name.get());
            });
            if (returnTags && tags.size() < maxPoints) {
                populated.sort(null);
                tags.add(new StepTags(row.step(), populated, row.tags()));
            }
        }

        ExperimentScalars build(boolean returnTags) {
            Map<String, ScalarSeries> series = new LinkedHashMap<>();
            steps.forEach((name, xs) -> series.put(name, new ScalarSeries(xs, values.get(name))));
            return new ExperimentScalars(experimentId, series, returnTags ? tags : null);
        }
    }
}
