package org.learningjava.scalarstore.infrastructure.adapter.out.cache;

import org.learningjava.scalarstore.application.port.ScalarsCachePort;
import org.learningjava.scalarstore.domain.model.ExperimentScalars;
import org.learningjava.scalarstore.domain.service.cache.GlobPattern;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local result cache: entries expire after a fixed TTL, and the least recently used
 * entries are evicted once {@code maxSize} is exceeded.
 */
public class InMemoryScalarsCache implements ScalarsCachePort {

    private record Entry(List<ExperimentScalars> value, Instant expiresAt) { }

    private final Clock clock;
    private final Duration ttl;
    private final LinkedHashMap<String, Entry> entries;

    public InMemoryScalarsCache(Clock clock, Duration ttl, int maxSize) {
        if (ttl.isNegative() || ttl.isZero() || maxSize <= 0) {
            throw new IllegalArgumentException("ttl and maxSize must be positive");
        }
        this.clock = clock;
        this.ttl = ttl;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > maxSize;
            }
        };
    }

    @Override
    public synchronized Optional<List<ExperimentScalars>> get(String key) {
        Entry e = entries.get(key);
        if (e == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(e.expiresAt())) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(e.value());
    }

    @Override
    public synchronized void set(String key, List<ExperimentScalars> value) {
        entries.put(key, new Entry(List.copyOf(value), clock.instant().plus(ttl)));
    }

    @Override
    public synchronized void remove(String key) {
        entries.remove(key);
    }

    @Override
    public synchronized int invalidate(String pattern) {
        GlobPattern glob = GlobPattern.compile(pattern);
        int removed = 0;
        Iterator<String> it = entries.keySet().iterator();
        while (it.hasNext()) {
            if (glob.matches(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }
}
