package org.learningjava.scalarstore.application.usecase;

import org.learningjava.scalarstore.application.port.ScalarTablePort;
import org.learningjava.scalarstore.application.port.ScalarsCachePort;
import org.learningjava.scalarstore.config.ScalarsProperties;
import org.learningjava.scalarstore.domain.model.ExperimentScalars;
import org.learningjava.scalarstore.domain.model.NameMapping;
import org.learningjava.scalarstore.domain.model.RowFilter;
import org.learningjava.scalarstore.domain.model.ScalarRow;
import org.learningjava.scalarstore.domain.model.ScalarsQuery;
import org.learningjava.scalarstore.domain.service.cache.CacheKeys;
import org.learningjava.scalarstore.domain.service.mapping.NameColumnMapper;
import org.learningjava.scalarstore.domain.service.query.SeriesAssembler;
import org.learningjava.scalarstore.domain.service.schema.BaseColumn;
import org.learningjava.scalarstore.domain.service.schema.ProjectIds;
import org.learningjava.scalarstore.domain.service.schema.TableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read path: cache first, then a filtered scan of the project table reassembled into series.
 * <p>
 * Whole-project reads use one cache entry; reads for an explicit id list use one entry per
 * experiment so that only the uncached ones hit the backend. Time-bounded reads bypass the cache.
 */
@Service
public class QueryScalarsUseCase {
    private static final Logger log = LoggerFactory.getLogger(QueryScalarsUseCase.class);

    private final TableManager tableManager;
    private final NameColumnMapper mapper;
    private final ScalarTablePort tables;
    private final ScalarsCachePort cache;
    private final SeriesAssembler assembler;
    private final int defaultMaxPoints;

    public QueryScalarsUseCase(TableManager tableManager,
                               NameColumnMapper mapper,
                               ScalarTablePort tables,
                               ScalarsCachePort cache,
                               SeriesAssembler assembler,
                               ScalarsProperties props) {
        this.tableManager = tableManager;
        this.mapper = mapper;
        this.tables = tables;
        this.cache = cache;
        this.assembler = assembler;
        this.defaultMaxPoints = props.getDefaultMaxPoints();
    }

    public List<ExperimentScalars> getScalars(ScalarsQuery query) {
        int maxPoints = query.maxPoints() == null ? defaultMaxPoints : query.maxPoints();
        if (maxPoints <= 0) {
            throw new IllegalArgumentException("maxPoints must be positive");
        }
        if (query.startTime() != null && query.endTime() != null && query.startTime().isAfter(query.endTime())) {
            throw new IllegalArgumentException("startTime must not be after endTime");
        }
        String projectId = ProjectIds.canonical(query.projectId());
        String table = tableManager.tableName(projectId);
        boolean cacheable = !query.hasTimeRange();

        if (query.wholeProject()) {
            String key = CacheKeys.wholeProject(projectId, maxPoints, query.returnTags());
            if (cacheable) {
                Optional<List<ExperimentScalars>> hit = cache.get(key);
                if (hit.isPresent()) {
                    log.debug("Cache hit {}", key);
                    return hit.get();
                }
            }
            List<ExperimentScalars> result = fetch(table, projectId, query, null, maxPoints);
            if (cacheable) {
                cache.set(key, result);
            }
            return result;
        }

        Map<String, List<ExperimentScalars>> byExperiment = new HashMap<>();
        List<String> missing = new ArrayList<>();
        for (String experimentId : query.experimentIds()) {
            Optional<List<ExperimentScalars>> hit = cacheable
                    ? cache.get(CacheKeys.experiment(projectId, experimentId, maxPoints, query.returnTags()))
                    : Optional.empty();
            if (hit.isPresent()) {
                byExperiment.put(experimentId, hit.get());
            } else {
                missing.add(experimentId);
            }
        }
        log.debug("Query {}: {} cached, {} to fetch", projectId, byExperiment.size(), missing.size());

        if (!missing.isEmpty()) {
            Map<String, ExperimentScalars> fetched = new HashMap<>();
            for (ExperimentScalars es : fetch(table, projectId, query, missing, maxPoints)) {
                fetched.put(es.experimentId(), es);
            }
            for (String experimentId : missing) {
                ExperimentScalars es = fetched.get(experimentId);
                List<ExperimentScalars> value = es == null ? List.of() : List.of(es);
                byExperiment.put(experimentId, value);
                if (cacheable) {
                    cache.set(CacheKeys.experiment(projectId, experimentId, maxPoints, query.returnTags()), value);
                }
            }
        }

        List<ExperimentScalars> result = new ArrayList<>();
        for (String experimentId : query.experimentIds()) {
            result.addAll(byExperiment.get(experimentId));
        }
        return result;
    }

    private List<ExperimentScalars> fetch(String table, String projectId, ScalarsQuery query,
                                          List<String> experimentIds, int maxPoints) {
        if (!tableManager.exists(table)) {
            return List.of();
        }
        // described on every read so columns added by other processes are visible
        Set<String> columns = tableManager.currentColumns(table);
        List<String> scalarColumns = new ArrayList<>();
        for (String column : columns) {
            if (!BaseColumn.isBase(column)) {
                scalarColumns.add(column);
            }
        }

        NameMapping mapping = mapper.current(projectId);
        if (!mapping.columns().containsAll(scalarColumns)) {
            mapping = mapper.load(projectId);
        }
        final NameMapping known = mapping;
        scalarColumns.removeIf(column -> !known.containsColumn(column));

        RowFilter filter = new RowFilter(experimentIds, query.startTime(), query.endTime(), maxPoints);
        List<ScalarRow> rows = tables.selectRows(table, scalarColumns, filter);
        return assembler.assemble(rows, known, maxPoints, query.returnTags());
    }
}
