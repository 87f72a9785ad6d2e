package org.learningjava.scalarstore.infrastructure.adapter.out.clickhouse;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.scalarstore.application.usecase.LastLoggedUseCase;
import org.learningjava.scalarstore.application.usecase.LogScalarsUseCase;
import org.learningjava.scalarstore.application.usecase.QueryScalarsUseCase;
import org.learningjava.scalarstore.config.ScalarsProperties;
import org.learningjava.scalarstore.domain.error.BackendUnavailableException;
import org.learningjava.scalarstore.domain.model.NameMapping;
import org.learningjava.scalarstore.domain.model.RowFilter;
import org.learningjava.scalarstore.domain.model.ScalarRow;
import org.learningjava.scalarstore.domain.model.ScalarsQuery;
import org.learningjava.scalarstore.domain.service.mapping.ColumnIdGenerator;
import org.learningjava.scalarstore.domain.service.mapping.NameColumnMapper;
import org.learningjava.scalarstore.domain.service.query.SeriesAssembler;
import org.learningjava.scalarstore.domain.service.schema.BaseColumn;
import org.learningjava.scalarstore.domain.service.schema.TableManager;
import org.learningjava.scalarstore.infrastructure.adapter.out.cache.NoOpScalarsCache;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class ClickHouseAdaptersTest extends ClickHouseTestBase {

    private static final AtomicInteger SEQ = new AtomicInteger();
    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00.250Z");

    private ClickHouseJdbc jdbc;
    private ClickHouseScalarTableAdapter tables;
    private String table;

    @BeforeEach
    void init() {
        jdbc = new ClickHouseJdbc(dataSource(), 30);
        tables = new ClickHouseScalarTableAdapter(jdbc);
        table = "scalars_it" + SEQ.incrementAndGet();
    }

    @Test
    void schema_is_created_and_extended_idempotently() {
        assertFalse(tables.tableExists(table));

        tables.createTable(table, List.of("s_a"));
        tables.createTable(table, List.of("s_a"));
        tables.addColumns(table, List.of("s_b"));
        tables.addColumns(table, List.of("s_a", "s_b"));

        assertTrue(tables.tableExists(table));
        var columns = tables.describeColumns(table);
        assertTrue(columns.containsAll(BaseColumn.names()));
        assertTrue(columns.containsAll(List.of("s_a", "s_b")));
        assertEquals(BaseColumn.names().size() + 2, columns.size());

        tables.dropTable(table);
        tables.dropTable(table);
        assertFalse(tables.tableExists(table));
    }

    @Test
    void rows_round_trip_with_nulls_tags_and_special_values() {
        tables.createTable(table, List.of("s_a", "s_b"));
        tables.insertRows(table, List.of("s_a", "s_b"), List.of(
                new ScalarRow(T0, "e'1", 1, List.of("it's", "x"), Map.of("s_a", 0.5)),
                new ScalarRow(T0, "e'1", 2, List.of(), Map.of("s_a", Double.NaN, "s_b", 2.0)),
                new ScalarRow(T0, "e2", 1, List.of(), Map.of("s_b", -1.0))));

        var rows = tables.selectRows(table, List.of("s_a", "s_b"), new RowFilter(List.of("e'1"), null, null, 100));

        assertEquals(2, rows.size());
        var first = rows.get(0);
        assertEquals(T0, first.timestamp());
        assertEquals("e'1", first.experimentId());
        assertEquals(1L, first.step());
        assertEquals(List.of("it's", "x"), first.tags());
        assertEquals(Map.of("s_a", 0.5), first.values());
        assertTrue(rows.get(1).values().get("s_a").isNaN());
        assertEquals(2.0, rows.get(1).values().get("s_b"));

        assertEquals(List.of("e'1", "e2"), tables.distinctExperimentIds(table));
    }

    @Test
    void select_limits_per_experiment_and_filters_time() {
        tables.createTable(table, List.of("s_a"));
        tables.insertRows(table, List.of("s_a"), List.of(
                new ScalarRow(T0, "e1", 1, List.of(), Map.of("s_a", 1.0)),
                new ScalarRow(T0, "e1", 2, List.of(), Map.of("s_a", 2.0)),
                new ScalarRow(T0.plusSeconds(60), "e1", 3, List.of(), Map.of("s_a", 3.0)),
                new ScalarRow(T0, "e2", 1, List.of(), Map.of("s_a", 4.0))));

        var limited = tables.selectRows(table, List.of("s_a"), new RowFilter(null, null, null, 2));
        assertEquals(List.of(1L, 2L, 1L), limited.stream().map(ScalarRow::step).toList());

        var late = tables.selectRows(table, List.of("s_a"), new RowFilter(null, T0.plusSeconds(1), null, 100));
        assertEquals(1, late.size());
        assertEquals(3L, late.get(0).step());
    }

    @Test
    void mapping_store_returns_latest_snapshot() {
        var store = new ClickHouseMappingStoreAdapter(jdbc, "scalars_mapping_it" + SEQ.incrementAndGet(), new ObjectMapper());
        store.ensureSchema();
        assertTrue(store.loadLatest("p1").isEmpty());

        store.save("p1", new NameMapping(Map.of("loss", "s_1")), T0);
        store.save("p1", new NameMapping(Map.of("loss", "s_1", "acc", "s_2")), T0.plusMillis(1));
        store.save("p2", new NameMapping(Map.of("other", "s_9")), T0.plusMillis(2));

        var latest = store.loadLatest("p1").orElseThrow();
        assertEquals(Map.of("loss", "s_1", "acc", "s_2"), latest.asMap());
    }

    @Test
    void last_logged_keeps_max_per_experiment() {
        var store = new ClickHouseLastLoggedAdapter(jdbc);
        String ll = "last_logged_it" + SEQ.incrementAndGet();

        store.touch(ll, "e1", T0);
        store.touch(ll, "e1", T0.plusSeconds(5));
        store.touch(ll, "e2", T0);

        var rows = store.find(ll, List.of("e1"));
        assertEquals(1, rows.size());
        assertEquals(T0.plusSeconds(5), rows.get(0).lastModified());
        assertEquals(2, store.find(ll, null).size());
    }

    @Test
    void bad_statement_surfaces_as_backend_error() {
        assertThrows(BackendUnavailableException.class, () -> jdbc.execute("SELECT * FROM no_such_table_xyz"));
    }

    @Test
    void engine_round_trip_over_clickhouse() {
        String project = "it" + SEQ.incrementAndGet();
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        var props = new ScalarsProperties();
        var tableManager = new TableManager(tables);
        var mapper = new NameColumnMapper(
                new ClickHouseMappingStoreAdapter(jdbc, "scalars_mapping", new ObjectMapper()), new ColumnIdGenerator(), clock);
        var cache = new NoOpScalarsCache();
        var lastLogged = new LastLoggedUseCase(new ClickHouseLastLoggedAdapter(jdbc), tableManager, clock, props);
        var writer = new LogScalarsUseCase(tableManager, mapper, tables, cache, lastLogged, clock);
        var reader = new QueryScalarsUseCase(tableManager, mapper, tables, cache, new SeriesAssembler(), props);

        assertTrue(reader.getScalars(ScalarsQuery.forProject(project)).isEmpty());

        writer.logScalar(project, "e1", 1, Map.of("a", 1.0), List.of("t"));
        writer.logScalar(project, "e1", 2, Map.of("b", 2.0), null);

        var out = reader.getScalars(new ScalarsQuery(project, List.of("e1"), null, true, null, null));
        assertEquals(1, out.size());
        assertEquals(List.of(1L), out.get(0).scalars().get("a").x());
        assertEquals(List.of(2.0), out.get(0).scalars().get("b").y());
        assertEquals(List.of("t"), out.get(0).tags().get(0).tags());
        assertEquals(1, lastLogged.lastLogged(project, null).size());
    }
}
