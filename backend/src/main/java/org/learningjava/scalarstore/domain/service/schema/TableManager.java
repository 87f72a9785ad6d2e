package org.learningjava.scalarstore.domain.service.schema;

import org.learningjava.scalarstore.application.port.ScalarTablePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Derives project table names and keeps project tables in step with the scalar columns writers need.
 * Every schema change is additive and idempotent, so concurrent callers may race freely.
 */
@Component
public class TableManager {
    private static final Logger log = LoggerFactory.getLogger(TableManager.class);

    static final String SCALARS_PREFIX = "scalars_";
    static final String LAST_LOGGED_PREFIX = "last_logged_";

    private final ScalarTablePort tables;

    public TableManager(ScalarTablePort tables) {
        this.tables = tables;
    }

    public String tableName(String projectId) {
        return derive(SCALARS_PREFIX, projectId);
    }

    public String lastLoggedTableName(String projectId) {
        return derive(LAST_LOGGED_PREFIX, projectId);
    }

    public boolean exists(String table) {
        return tables.tableExists(Identifiers.requireSafe(table));
    }

    public Set<String> currentColumns(String table) {
        return tables.describeColumns(Identifiers.requireSafe(table));
    }

    /**
     * Creates the table with the base columns plus {@code requiredScalarColumns} when it is missing,
     * otherwise adds exactly the columns it lacks.
     */
    public void ensureSchema(String table, Collection<String> requiredScalarColumns) {
        Identifiers.requireSafe(table);
        Set<String> required = new LinkedHashSet<>(Identifiers.requireSafe(requiredScalarColumns));

        if (!tables.tableExists(table)) {
            tables.createTable(table, required);
            log.info("Created scalar table {} with {} scalar column(s)", table, required.size());
            if (required.isEmpty()) {
                return;
            }
            // A concurrent writer may have created it first with a different column set.
        }

        Set<String> missing = new LinkedHashSet<>(required);
        missing.removeAll(tables.describeColumns(table));
        if (!missing.isEmpty()) {
            tables.addColumns(table, missing);
            log.info("Added {} scalar column(s) to {}", missing.size(), table);
        }
    }

    public void createBaseTable(String table) {
        ensureSchema(table, Set.of());
    }

    public void dropTable(String table) {
        tables.dropTable(Identifiers.requireSafe(table));
        log.info("Dropped scalar table {}", table);
    }

    private static String derive(String prefix, String projectId) {
        return Identifiers.requireSafe(prefix + ProjectIds.canonical(projectId));
    }
}
