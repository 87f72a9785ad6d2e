package org.learningjava.scalarstore.application.port;

import org.learningjava.scalarstore.domain.model.NameMapping;

import java.time.Instant;
import java.util.Optional;

/**
 * Persisted name mapping snapshots, one logical record per project. The most recent snapshot wins.
 */
public interface MappingStorePort {
    void ensureSchema();

    Optional<NameMapping> loadLatest(String projectId);

    void save(String projectId, NameMapping mapping, Instant updatedAt);
}
