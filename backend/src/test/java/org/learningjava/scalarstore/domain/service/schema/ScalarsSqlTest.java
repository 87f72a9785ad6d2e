package org.learningjava.scalarstore.domain.service.schema;

import org.junit.jupiter.api.Test;
import org.learningjava.scalarstore.domain.error.InvalidIdentifierException;
import org.learningjava.scalarstore.domain.model.RowFilter;
import org.learningjava.scalarstore.domain.model.ScalarRow;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScalarsSqlTest {

    @Test
    void createTable_has_base_columns_partitioning_and_sort_key() {
        String sql = ScalarsSql.createTable("scalars_p1", List.of("s_a"));
        assertEquals("CREATE TABLE IF NOT EXISTS scalars_p1 ("
                + "timestamp DateTime64(3, 'UTC'), experiment_id String, step Int64, tags Array(String), "
                + "s_a Nullable(Float64)) ENGINE = MergeTree PARTITION BY toDate(timestamp) "
                + "ORDER BY (experiment_id, step)", sql);
    }

    @Test
    void every_identifier_is_validated() {
        assertThrows(InvalidIdentifierException.class, () -> ScalarsSql.createTable("scalars_p1", List.of("bad-col")));
        assertThrows(InvalidIdentifierException.class, () -> ScalarsSql.dropTable("x; DROP TABLE y"));
        assertThrows(InvalidIdentifierException.class, () -> ScalarsSql.addColumns("scalars_p1", List.of("S_A")));
    }

    @Test
    void addColumns_is_one_idempotent_statement() {
        assertEquals("ALTER TABLE scalars_p1 ADD COLUMN IF NOT EXISTS s_a Nullable(Float64), "
                        + "ADD COLUMN IF NOT EXISTS s_b Nullable(Float64)",
                ScalarsSql.addColumns("scalars_p1", List.of("s_a", "s_b")));
        assertThrows(IllegalArgumentException.class, () -> ScalarsSql.addColumns("scalars_p1", List.of()));
    }

    @Test
    void insert_writes_null_for_absent_scalars_and_escapes_values() {
        var row = new ScalarRow(Instant.parse("2024-01-01T00:00:00Z"), "e'1", 3,
                List.of("x", "it's"), Map.of("s_a", 1.0));

        String sql = ScalarsSql.insertRows("scalars_p1", List.of("s_a", "s_b"), List.of(row));

        assertTrue(sql.startsWith("INSERT INTO scalars_p1 (timestamp, experiment_id, step, tags, s_a, s_b) VALUES "));
        assertTrue(sql.endsWith("(toDateTime64('2024-01-01 00:00:00.000', 3, 'UTC'), 'e\\'1', 3, ['x', 'it\\'s'], 1.0, NULL)"),
                sql);
    }

    @Test
    void select_filters_by_experiments_and_time_and_limits_per_experiment() {
        var filter = new RowFilter(List.of("e1", "e2"),
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z"), 100);

        String sql = ScalarsSql.selectRows("scalars_p1", List.of("s_a"), filter);

        assertTrue(sql.startsWith("SELECT toUnixTimestamp64Milli(timestamp) AS timestamp_ms, experiment_id, step, tags, s_a FROM scalars_p1"));
        assertTrue(sql.contains(" WHERE experiment_id IN ('e1', 'e2')"
                + " AND timestamp >= toDateTime64('2024-01-01 00:00:00.000', 3, 'UTC')"
                + " AND timestamp <= toDateTime64('2024-01-02 00:00:00.000', 3, 'UTC')"), sql);
        assertTrue(sql.endsWith(" ORDER BY experiment_id, step LIMIT 100 BY experiment_id"));
    }

    @Test
    void select_for_whole_project_has_no_where_clause() {
        String sql = ScalarsSql.selectRows("scalars_p1", List.of(), new RowFilter(null, null, null, 5));
        assertFalse(sql.contains("WHERE"));
        assertTrue(sql.contains("tags FROM scalars_p1 ORDER BY"));
    }

    @Test
    void mapping_and_last_logged_statements() {
        assertEquals("SELECT mapping FROM scalars_mapping WHERE project_id = 'p1' ORDER BY updated_at DESC LIMIT 1",
                ScalarsSql.selectLatestMapping("scalars_mapping", "p1"));
        assertTrue(ScalarsSql.createLastLoggedTable("last_logged_p1").contains("ReplacingMergeTree(last_modified)"));
        assertTrue(ScalarsSql.selectLastLogged("last_logged_p1", List.of("e1")).contains("WHERE experiment_id IN ('e1')"));
        assertFalse(ScalarsSql.selectLastLogged("last_logged_p1", null).contains("WHERE"));
    }
}
