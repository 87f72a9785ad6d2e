package org.learningjava.scalarstore.application.port;

import org.learningjava.scalarstore.domain.model.ExperimentScalars;

import java.util.List;
import java.util.Optional;

/**
 * Result cache in front of the query path. Never authoritative: every entry can be rebuilt from the backend.
 */
public interface ScalarsCachePort {

    Optional<List<ExperimentScalars>> get(String key);

    void set(String key, List<ExperimentScalars> value);

    void remove(String key);

    /**
     * Drops every entry whose key matches the glob pattern ({@code *} any run, {@code ?} one char,
     * {@code \\} quotes the next char).
     *
     * @return number of entries removed
     */
    int invalidate(String pattern);
}
