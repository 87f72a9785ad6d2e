package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import org.learningjava.scalarstore.domain.model.LogItem;

import java.util.List;
import java.util.Map;

public record LogScalarRequest(
        @NotNull Map<String, Double> scalars,
        @NotNull Long step,
        List<String> tags
) {
    public LogItem toItem() {
        return new LogItem(step, scalars, tags);
    }
}
