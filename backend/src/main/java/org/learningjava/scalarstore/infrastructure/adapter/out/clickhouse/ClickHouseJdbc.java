package org.learningjava.scalarstore.infrastructure.adapter.out.clickhouse;

import org.learningjava.scalarstore.domain.error.BackendUnavailableException;
import org.learningjava.scalarstore.domain.service.schema.ScalarsSql;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin JDBC helper shared by the ClickHouse adapters. Every statement gets the configured query
 * timeout; any {@link SQLException} surfaces as {@link BackendUnavailableException}.
 */
public class ClickHouseJdbc {
    private static final Logger log = LoggerFactory.getLogger(ClickHouseJdbc.class);

    private static final int MAX_LOGGED_SQL = 500;

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    public ClickHouseJdbc(DataSource dataSource, int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public void execute(String sql) {
        log.debug("SQL: {}", abbreviate(sql));
        try (Connection c = dataSource.getConnection();
             Statement st = c.createStatement()) {
            st.setQueryTimeout(queryTimeoutSeconds);
            st.execute(sql);
        } catch (SQLException e) {
            throw new BackendUnavailableException("ClickHouse statement failed: " + e.getMessage(), e);
        }
    }

    public <T> List<T> query(String sql, RowMapper<T> mapper) {
        log.debug("SQL: {}", abbreviate(sql));
        try (Connection c = dataSource.getConnection();
             Statement st = c.createStatement()) {
            st.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = st.executeQuery(sql)) {
                List<T> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(mapper.map(rs));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new BackendUnavailableException("ClickHouse query failed: " + e.getMessage(), e);
        }
    }

    public boolean tableExists(String table) {
        List<Integer> rows = query(ScalarsSql.existsTable(table), rs -> rs.getInt(1));
        return !rows.isEmpty() && rows.get(0) == 1;
    }

    private static String abbreviate(String sql) {
        return sql.length() <= MAX_LOGGED_SQL ? sql : sql.substring(0, MAX_LOGGED_SQL) + "... (" + sql.length() + " chars)";
    }
}
