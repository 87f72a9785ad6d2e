package org.learningjava.scalarstore.domain.service.mapping;

import org.learningjava.scalarstore.application.port.MappingStorePort;
import org.learningjava.scalarstore.domain.model.MappingResolution;
import org.learningjava.scalarstore.domain.model.NameMapping;
import org.learningjava.scalarstore.domain.service.schema.BaseColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Translates user-facing scalar names into stable internal column identifiers, per project.
 * <p>
 * Each project's mapping is cached in memory and reconciled with the latest persisted snapshot
 * whenever an unknown name shows up. Allocation is serialized per project inside this process only;
 * two processes that first see the same name concurrently may each allocate a column, and the
 * snapshot saved last wins. The loser's column stays in the table, unreachable.
 * <p>
 * Saves are serialized per project and always write the whole in-memory view, so within one process
 * the snapshot written last holds every name resolved before it.
 */
@Component
public class NameColumnMapper {
    private static final Logger log = LoggerFactory.getLogger(NameColumnMapper.class);

    private static final int MAX_ALLOCATION_ATTEMPTS = 16;

    private final MappingStorePort store;
    private final ColumnIdGenerator ids;
    private final Clock clock;
    private final Map<String, NameMapping> views = new ConcurrentHashMap<>();
    private final Map<String, Object> saveLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSaved = new ConcurrentHashMap<>();

    public NameColumnMapper(MappingStorePort store, ColumnIdGenerator ids, Clock clock) {
        this.store = store;
        this.ids = ids;
        this.clock = clock;
    }

    /** Latest persisted snapshot, or an empty mapping when the project has none yet. */
    public NameMapping load(String projectId) {
        NameMapping loaded = store.loadLatest(projectId).orElse(NameMapping.empty());
        return views.merge(projectId, loaded, NameMapping::merge);
    }

    /** The in-memory view, loading it on first use. */
    public NameMapping current(String projectId) {
        NameMapping view = views.get(projectId);
        return view != null ? view : load(projectId);
    }

    public MappingResolution resolve(String projectId, Collection<String> names) {
        Set<String> requested = new LinkedHashSet<>(names);
        NameMapping view = current(projectId);

        if (!containsAll(view, requested)) {
            // Another process may already have allocated these names.
            view = load(projectId);
        }

        AtomicBoolean changed = new AtomicBoolean(false);
        if (!containsAll(view, requested)) {
            view = views.compute(projectId, (key, existing) -> {
                NameMapping next = existing == null ? NameMapping.empty() : existing;
                for (String name : requested) {
                    if (!next.containsName(name)) {
                        next = next.with(name, allocate(next));
                        changed.set(true);
                    }
                }
                return next;
            });
        }

        Map<String, String> subset = new LinkedHashMap<>();
        for (String name : requested) {
            subset.put(name, view.columnFor(name).orElseThrow());
        }
        if (changed.get()) {
            log.info("Mapping of project {} grew to {} name(s)", projectId, view.size());
        }
        return new MappingResolution(subset, view, changed.get());
    }

    /**
     * Persists the project's current view as a new snapshot. Call after {@link #resolve} reported a change.
     * Snapshot times are strictly increasing per project, so two saves in the same millisecond never tie.
     */
    public void save(String projectId) {
        synchronized (saveLocks.computeIfAbsent(projectId, key -> new Object())) {
            NameMapping view = current(projectId);
            Instant at = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            Instant previous = lastSaved.get(projectId);
            if (previous != null && !at.isAfter(previous)) {
                at = previous.plusMillis(1);
            }
            store.save(projectId, view, at);
            lastSaved.put(projectId, at);
            log.debug("Saved mapping snapshot for project {} ({} entries)", projectId, view.size());
        }
    }

    public Optional<String> nameFor(String projectId, String column) {
        return current(projectId).nameFor(column);
    }

    private String allocate(NameMapping mapping) {
        for (int attempt = 0; attempt < MAX_ALLOCATION_ATTEMPTS; attempt++) {
            String candidate = ids.next();
            if (!mapping.containsColumn(candidate) && !BaseColumn.isBase(candidate)) {
                return candidate;
            }
            log.warn("Column id collision on {}, retrying", candidate);
        }
        throw new IllegalStateException("Could not allocate a unique column id after "
                + MAX_ALLOCATION_ATTEMPTS + " attempts");
    }

    private static boolean containsAll(NameMapping mapping, Set<String> names) {
        for (String name : names) {
            if (!mapping.containsName(name)) {
                return false;
            }
        }
        return true;
    }
}
