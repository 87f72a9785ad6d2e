package org.learningjava.scalarstore.application.usecase;

import org.learningjava.scalarstore.application.port.ScalarTablePort;
import org.learningjava.scalarstore.application.port.ScalarsCachePort;
import org.learningjava.scalarstore.domain.model.LogItem;
import org.learningjava.scalarstore.domain.model.LogResult;
import org.learningjava.scalarstore.domain.model.MappingResolution;
import org.learningjava.scalarstore.domain.model.ScalarRow;
import org.learningjava.scalarstore.domain.service.cache.CacheKeys;
import org.learningjava.scalarstore.domain.service.mapping.NameColumnMapper;
import org.learningjava.scalarstore.domain.service.schema.ProjectIds;
import org.learningjava.scalarstore.domain.service.schema.TableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Write path: validate, map names to columns, evolve the schema, append one row per step.
 * A batch is inserted with a single statement, so it lands entirely or not at all. Failures are
 * never retried here; row inserts are not idempotent.
 */
@Service
public class LogScalarsUseCase {
    private static final Logger log = LoggerFactory.getLogger(LogScalarsUseCase.class);

    private final TableManager tableManager;
    private final NameColumnMapper mapper;
    private final ScalarTablePort tables;
    private final ScalarsCachePort cache;
    private final LastLoggedUseCase lastLogged;
    private final Clock clock;

    public LogScalarsUseCase(TableManager tableManager,
                             NameColumnMapper mapper,
                             ScalarTablePort tables,
                             ScalarsCachePort cache,
                             LastLoggedUseCase lastLogged,
                             Clock clock) {
        this.tableManager = tableManager;
        this.mapper = mapper;
        this.tables = tables;
        this.cache = cache;
        this.lastLogged = lastLogged;
        this.clock = clock;
    }

    public LogResult logScalar(String projectId, String experimentId, long step,
                               Map<String, Double> scalars, List<String> tags) {
        return logScalars(projectId, experimentId, List.of(new LogItem(step, scalars, tags)));
    }

    public LogResult logScalars(String rawProjectId, String experimentId, List<LogItem> items) {
        if (experimentId == null || experimentId.isBlank()) {
            throw new IllegalArgumentException("experimentId is required");
        }
        String projectId = ProjectIds.canonical(rawProjectId);
        String table = tableManager.tableName(projectId);

        // 1) drop cached reads this write can change
        invalidate(projectId, experimentId);

        // 2) filter invalid entries
        List<String> warnings = new ArrayList<>();
        List<LogItem> accepted = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        for (LogItem item : items == null ? List.<LogItem>of() : items) {
            Map<String, Double> kept = new LinkedHashMap<>();
            item.scalars().forEach((name, value) -> {
                if (name == null || name.isBlank()) {
                    warnings.add("Dropped scalar with empty name at step " + item.step());
                } else if (value == null) {
                    warnings.add("Dropped scalar '" + name + "' with null value at step " + item.step());
                } else {
                    kept.put(name, value);
                }
            });
            if (!kept.isEmpty()) {
                accepted.add(new LogItem(item.step(), kept, item.tags()));
                names.addAll(kept.keySet());
            }
        }
        if (!warnings.isEmpty()) {
            log.warn("{} scalar entr(ies) dropped for {}/{}", warnings.size(), projectId, experimentId);
        }
        if (accepted.isEmpty()) {
            return LogResult.logged(warnings);
        }

        // 3) resolve names, persist the mapping only when it grew
        MappingResolution resolution = mapper.resolve(projectId, names);
        if (resolution.changed()) {
            mapper.save(projectId);
        }
        Map<String, String> columns = resolution.columns();

        // 4) schema
        Set<String> ordered = new LinkedHashSet<>();
        for (String name : names) {
            ordered.add(columns.get(name));
        }
        List<String> scalarColumns = new ArrayList<>(ordered);
        tableManager.ensureSchema(table, scalarColumns);

        // 5) rows
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        List<ScalarRow> rows = new ArrayList<>(accepted.size());
        for (LogItem item : accepted) {
            Map<String, Double> values = new LinkedHashMap<>();
            item.scalars().forEach((name, value) -> values.put(columns.get(name), value));
            rows.add(new ScalarRow(now, experimentId, item.step(), item.tags(), values));
        }
        tables.insertRows(table, scalarColumns, rows);
        log.debug("Inserted {} row(s) into {} for experiment {}", rows.size(), table, experimentId);

        // a reader may have repopulated the cache from pre-insert data in the meantime
        invalidate(projectId, experimentId);

        lastLogged.touch(projectId, experimentId);
        return LogResult.logged(warnings);
    }

    private void invalidate(String projectId, String experimentId) {
        cache.invalidate(CacheKeys.experimentPattern(projectId, experimentId));
        cache.invalidate(CacheKeys.wholeProjectPattern(projectId));
    }
}
