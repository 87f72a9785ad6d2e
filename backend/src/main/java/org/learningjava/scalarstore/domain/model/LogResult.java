package org.learningjava.scalarstore.domain.model;

import java.util.List;

public record LogResult(String status, List<String> warnings) {

    public static final String LOGGED = "logged";

    public LogResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static LogResult logged(List<String> warnings) {
        return new LogResult(LOGGED, warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
