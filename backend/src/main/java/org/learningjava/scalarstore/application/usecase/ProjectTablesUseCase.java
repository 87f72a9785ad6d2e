package org.learningjava.scalarstore.application.usecase;

import org.learningjava.scalarstore.application.port.ScalarTablePort;
import org.learningjava.scalarstore.application.port.ScalarsCachePort;
import org.learningjava.scalarstore.domain.service.cache.CacheKeys;
import org.learningjava.scalarstore.domain.service.schema.ProjectIds;
import org.learningjava.scalarstore.domain.service.schema.TableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ProjectTablesUseCase {
    private static final Logger log = LoggerFactory.getLogger(ProjectTablesUseCase.class);

    private final TableManager tableManager;
    private final ScalarTablePort tables;
    private final ScalarsCachePort cache;
    private final LastLoggedUseCase lastLogged;

    public ProjectTablesUseCase(TableManager tableManager,
                                ScalarTablePort tables,
                                ScalarsCachePort cache,
                                LastLoggedUseCase lastLogged) {
        this.tableManager = tableManager;
        this.tables = tables;
        this.cache = cache;
        this.lastLogged = lastLogged;
    }

    public String tableName(String projectId) {
        return tableManager.tableName(projectId);
    }

    /** Creates the project table with base columns only; returns its name. */
    public String createTable(String projectId) {
        String table = tableManager.tableName(projectId);
        tableManager.createBaseTable(table);
        return table;
    }

    public boolean exists(String projectId) {
        return tableManager.exists(tableManager.tableName(projectId));
    }

    /**
     * Drops the project table and its freshness table. The name mapping is kept, so names logged
     * again later resolve to the same columns.
     */
    public String dropTable(String projectId) {
        String canonical = ProjectIds.canonical(projectId);
        String table = tableManager.tableName(canonical);
        tableManager.dropTable(table);
        lastLogged.drop(canonical);
        int removed = cache.invalidate(CacheKeys.projectPattern(canonical));
        log.info("Dropped project {} ({} cache entr(ies) removed)", canonical, removed);
        return table;
    }

    public List<String> experimentIds(String projectId) {
        String table = tableManager.tableName(projectId);
        if (!tableManager.exists(table)) {
            return List.of();
        }
        return tables.distinctExperimentIds(table);
    }
}
