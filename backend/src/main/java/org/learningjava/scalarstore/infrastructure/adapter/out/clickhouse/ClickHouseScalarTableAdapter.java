package org.learningjava.scalarstore.infrastructure.adapter.out.clickhouse;

import org.learningjava.scalarstore.application.port.ScalarTablePort;
import org.learningjava.scalarstore.domain.model.RowFilter;
import org.learningjava.scalarstore.domain.model.ScalarRow;
import org.learningjava.scalarstore.domain.service.schema.BaseColumn;
import org.learningjava.scalarstore.domain.service.schema.ScalarsSql;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ClickHouseScalarTableAdapter implements ScalarTablePort {

    private final ClickHouseJdbc jdbc;

    public ClickHouseScalarTableAdapter(ClickHouseJdbc jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean tableExists(String table) {
        return jdbc.tableExists(table);
    }

    @Override
    public Set<String> describeColumns(String table) {
        return new LinkedHashSet<>(jdbc.query(ScalarsSql.describeTable(table), rs -> rs.getString(1)));
    }

    @Override
    public void createTable(String table, Collection<String> scalarColumns) {
        jdbc.execute(ScalarsSql.createTable(table, scalarColumns));
    }

    @Override
    public void addColumns(String table, Collection<String> scalarColumns) {
        if (scalarColumns.isEmpty()) {
            return;
        }
        jdbc.execute(ScalarsSql.addColumns(table, scalarColumns));
    }

    @Override
    public void dropTable(String table) {
        jdbc.execute(ScalarsSql.dropTable(table));
    }

    @Override
    public void insertRows(String table, List<String> scalarColumns, List<ScalarRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        jdbc.execute(ScalarsSql.insertRows(table, scalarColumns, rows));
    }

    @Override
    public List<ScalarRow> selectRows(String table, List<String> scalarColumns, RowFilter filter) {
        return jdbc.query(ScalarsSql.selectRows(table, scalarColumns, filter), rs -> toRow(rs, scalarColumns));
    }

    @Override
    public List<String> distinctExperimentIds(String table) {
        return jdbc.query(ScalarsSql.distinctExperimentIds(table), rs -> rs.getString(1));
    }

    private static ScalarRow toRow(ResultSet rs, List<String> scalarColumns) throws SQLException {
        Map<String, Double> values = new LinkedHashMap<>();
        for (String column : scalarColumns) {
            double v = rs.getDouble(column);
            if (!rs.wasNull()) {
                values.put(column, v);
            }
        }
        return new ScalarRow(
                Instant.ofEpochMilli(rs.getLong(ScalarsSql.TIMESTAMP_MS)),
                rs.getString(BaseColumn.EXPERIMENT_ID.columnName()),
                rs.getLong(BaseColumn.STEP.columnName()),
                readTags(rs.getArray(BaseColumn.TAGS.columnName())),
                values);
    }

    private static List<String> readTags(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        Object raw = array.getArray();
        if (!(raw instanceof Object[] items)) {
            return List.of();
        }
        List<String> tags = new ArrayList<>(items.length);
        for (Object item : items) {
            if (item != null) {
                tags.add(item.toString());
            }
        }
        return tags;
    }
}
