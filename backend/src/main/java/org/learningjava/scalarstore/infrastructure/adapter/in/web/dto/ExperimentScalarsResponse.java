package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.learningjava.scalarstore.domain.model.ExperimentScalars;
import org.learningjava.scalarstore.domain.model.ScalarSeries;
import org.learningjava.scalarstore.domain.model.StepTags;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ExperimentScalarsResponse(
        String experimentId,
        Map<String, Series> scalars,
        @JsonInclude(JsonInclude.Include.NON_NULL) List<Tags> tags
) {
    public record Series(List<Long> x, List<Double> y) {
        static Series from(ScalarSeries s) {
            return new Series(s.x(), s.y());
        }
    }

    public record Tags(long step, List<String> scalarNames, List<String> tags) {
        static Tags from(StepTags t) {
            return new Tags(t.step(), t.scalarNames(), t.tags());
        }
    }

    public static ExperimentScalarsResponse from(ExperimentScalars es) {
        Map<String, Series> scalars = new LinkedHashMap<>();
        es.scalars().forEach((name, series) -> scalars.put(name, Series.from(series)));
        List<Tags> tags = es.tags() == null ? null : es.tags().stream().map(Tags::from).toList();
        return new ExperimentScalarsResponse(es.experimentId(), scalars, tags);
    }
}
