package org.learningjava.scalarstore.infrastructure.adapter.out.cache;

import org.learningjava.scalarstore.application.port.ScalarsCachePort;
import org.learningjava.scalarstore.domain.model.ExperimentScalars;

import java.util.List;
import java.util.Optional;

/** Used when caching is switched off: every read misses. */
public class NoOpScalarsCache implements ScalarsCachePort {

    @Override
    public Optional<List<ExperimentScalars>> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, List<ExperimentScalars> value) {
    }

    @Override
    public void remove(String key) {
    }

    @Override
    public int invalidate(String pattern) {
        return 0;
    }
}
