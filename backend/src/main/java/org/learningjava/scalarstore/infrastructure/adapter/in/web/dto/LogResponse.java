package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.learningjava.scalarstore.domain.model.LogResult;

import java.util.List;

public record LogResponse(
        String status,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> warnings
) {
    public static LogResponse from(LogResult r) {
        return new LogResponse(r.status(), r.hasWarnings() ? r.warnings() : null);
    }
}
