package org.learningjava.scalarstore.domain.service.schema;

import org.learningjava.scalarstore.domain.model.RowFilter;
import org.learningjava.scalarstore.domain.model.ScalarRow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import static org.learningjava.scalarstore.domain.service.schema.Identifiers.doubleLiteral;
import static org.learningjava.scalarstore.domain.service.schema.Identifiers.requireSafe;
import static org.learningjava.scalarstore.domain.service.schema.Identifiers.stringArrayLiteral;
import static org.learningjava.scalarstore.domain.service.schema.Identifiers.stringListLiteral;
import static org.learningjava.scalarstore.domain.service.schema.Identifiers.stringLiteral;
import static org.learningjava.scalarstore.domain.service.schema.Identifiers.timestampLiteral;

/**
 * Statement builder for the columnar backend. The backend has no bound parameters for DDL,
 * so every identifier goes through {@link Identifiers#requireSafe(String)} and every value
 * through one of the literal renderers.
 * <p>
 * Schema statements are phrased {@code IF NOT EXISTS} / {@code IF EXISTS} so re-issuing them is a no-op.
 */
public final class ScalarsSql {

    /** Alias of the epoch-millis projection of the timestamp column in reads. */
    public static final String TIMESTAMP_MS = "timestamp_ms";

    private ScalarsSql() {
    }

    // ---------- project scalar tables ----------

    public static String createTable(String table, Collection<String> scalarColumns) {
        List<String> defs = new ArrayList<>();
        for (BaseColumn c : BaseColumn.values()) {
            defs.add(c.columnName() + " " + c.dbType());
        }
        for (String column : requireSafe(scalarColumns)) {
            defs.add(column + " " + BaseColumn.SCALAR_COLUMN_TYPE);
        }
        return "CREATE TABLE IF NOT EXISTS " + requireSafe(table)
                + " (" + String.join(", ", defs) + ")"
                + " ENGINE = MergeTree"
                + " PARTITION BY toDate(" + BaseColumn.TIMESTAMP.columnName() + ")"
                + " ORDER BY (" + BaseColumn.EXPERIMENT_ID.columnName() + ", " + BaseColumn.STEP.columnName() + ")";
    }

    public static String addColumns(String table, Collection<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No columns to add");
        }
        String adds = requireSafe(columns).stream()
                .map(c -> "ADD COLUMN IF NOT EXISTS " + c + " " + BaseColumn.SCALAR_COLUMN_TYPE)
                .collect(Collectors.joining(", "));
        return "ALTER TABLE " + requireSafe(table) + " " + adds;
    }

    public static String existsTable(String table) {
        return "EXISTS TABLE " + requireSafe(table);
    }

    public static String describeTable(String table) {
        return "DESCRIBE TABLE " + requireSafe(table);
    }

    public static String dropTable(String table) {
        return "DROP TABLE IF EXISTS " + requireSafe(table);
    }

    public static String insertRows(String table, List<String> scalarColumns, List<ScalarRow> rows) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("No rows to insert");
        }
        List<String> columns = new ArrayList<>(BaseColumn.names());
        columns.addAll(requireSafe(scalarColumns));

        StringBuilder sb = new StringBuilder("INSERT INTO ")
                .append(requireSafe(table))
                .append(" (").append(String.join(", ", columns)).append(") VALUES ");
        for (int i = 0; i < rows.size(); i++) {
            ScalarRow row = rows.get(i);
            if (i > 0) sb.append(", ");
            sb.append('(')
                    .append(timestampLiteral(row.timestamp())).append(", ")
                    .append(stringLiteral(row.experimentId())).append(", ")
                    .append(row.step()).append(", ")
                    .append(stringArrayLiteral(row.tags()));
            for (String column : scalarColumns) {
                sb.append(", ").append(doubleLiteral(row.values().get(column)));
            }
            sb.append(')');
        }
        return sb.toString();
    }

    public static String selectRows(String table, List<String> scalarColumns, RowFilter filter) {
        List<String> projections = new ArrayList<>();
        projections.add("toUnixTimestamp64Milli(" + BaseColumn.TIMESTAMP.columnName() + ") AS " + TIMESTAMP_MS);
        projections.add(BaseColumn.EXPERIMENT_ID.columnName());
        projections.add(BaseColumn.STEP.columnName());
        projections.add(BaseColumn.TAGS.columnName());
        projections.addAll(requireSafe(scalarColumns));

        List<String> where = new ArrayList<>();
        if (!filter.wholeProject()) {
            where.add(BaseColumn.EXPERIMENT_ID.columnName() + " IN (" + stringListLiteral(filter.experimentIds()) + ")");
        }
        if (filter.startTime() != null) {
            where.add(BaseColumn.TIMESTAMP.columnName() + " >= " + timestampLiteral(filter.startTime()));
        }
        if (filter.endTime() != null) {
            where.add(BaseColumn.TIMESTAMP.columnName() + " <= " + timestampLiteral(filter.endTime()));
        }

        StringBuilder sb = new StringBuilder("SELECT ")
                .append(String.join(", ", projections))
                .append(" FROM ").append(requireSafe(table));
        if (!where.isEmpty()) {
            sb.append(" WHERE ").append(String.join(" AND ", where));
        }
        sb.append(" ORDER BY ").append(BaseColumn.EXPERIMENT_ID.columnName())
                .append(", ").append(BaseColumn.STEP.columnName())
                .append(" LIMIT ").append(filter.limitPerExperiment())
                .append(" BY ").append(BaseColumn.EXPERIMENT_ID.columnName());
        return sb.toString();
    }

    public static String distinctExperimentIds(String table) {
        String col = BaseColumn.EXPERIMENT_ID.columnName();
        return "SELECT DISTINCT " + col + " FROM " + requireSafe(table) + " ORDER BY " + col;
    }

    // ---------- mapping snapshots ----------

    public static String createMappingTable(String table) {
        return "CREATE TABLE IF NOT EXISTS " + requireSafe(table)
                + " (project_id String, mapping String, updated_at DateTime64(3, 'UTC'))"
                + " ENGINE = MergeTree ORDER BY (project_id, updated_at)";
    }

    public static String insertMapping(String table, String projectId, String mappingJson, Instant updatedAt) {
        return "INSERT INTO " + requireSafe(table) + " (project_id, mapping, updated_at) VALUES ("
                + stringLiteral(projectId) + ", " + stringLiteral(mappingJson) + ", "
                + timestampLiteral(updatedAt) + ")";
    }

    public static String selectLatestMapping(String table, String projectId) {
        return "SELECT mapping FROM " + requireSafe(table)
                + " WHERE project_id = " + stringLiteral(projectId)
                + " ORDER BY updated_at DESC LIMIT 1";
    }

    // ---------- last-logged freshness ----------

    public static String createLastLoggedTable(String table) {
        return "CREATE TABLE IF NOT EXISTS " + requireSafe(table)
                + " (experiment_id String, last_modified DateTime64(3, 'UTC'))"
                + " ENGINE = ReplacingMergeTree(last_modified) ORDER BY experiment_id";
    }

    public static String upsertLastLogged(String table, String experimentId, Instant at) {
        return "INSERT INTO " + requireSafe(table) + " (experiment_id, last_modified) VALUES ("
                + stringLiteral(experimentId) + ", " + timestampLiteral(at) + ")";
    }

    public static String selectLastLogged(String table, List<String> experimentIds) {
        StringBuilder sb = new StringBuilder("SELECT experiment_id, toUnixTimestamp64Milli(max(last_modified)) AS last_modified_ms FROM ")
                .append(requireSafe(table));
        if (experimentIds != null && !experimentIds.isEmpty()) {
            sb.append(" WHERE experiment_id IN (").append(stringListLiteral(experimentIds)).append(")");
        }
        return sb.append(" GROUP BY experiment_id ORDER BY experiment_id").toString();
    }
}
