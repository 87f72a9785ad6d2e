package org.learningjava.scalarstore.infrastructure.adapter.out.clickhouse;

import org.learningjava.scalarstore.application.port.LastLoggedStorePort;
import org.learningjava.scalarstore.domain.error.BackendUnavailableException;
import org.learningjava.scalarstore.domain.model.LastLogged;
import org.learningjava.scalarstore.domain.service.schema.ScalarsSql;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class ClickHouseLastLoggedAdapter implements LastLoggedStorePort {

    private final ClickHouseJdbc jdbc;
    // tables this process has already created
    private final Set<String> created = ConcurrentHashMap.newKeySet();

    public ClickHouseLastLoggedAdapter(ClickHouseJdbc jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void touch(String table, String experimentId, Instant at) {
        if (!created.contains(table)) {
            jdbc.execute(ScalarsSql.createLastLoggedTable(table));
            created.add(table);
        }
        try {
            jdbc.execute(ScalarsSql.upsertLastLogged(table, experimentId, at));
        } catch (BackendUnavailableException e) {
            // maybe dropped elsewhere; recreate on the next touch
            created.remove(table);
            throw e;
        }
    }

    @Override
    public List<LastLogged> find(String table, List<String> experimentIds) {
        return jdbc.query(ScalarsSql.selectLastLogged(table, experimentIds),
                rs -> new LastLogged(rs.getString(1), Instant.ofEpochMilli(rs.getLong(2))));
    }

    @Override
    public boolean tableExists(String table) {
        return jdbc.tableExists(table);
    }

    @Override
    public void dropTable(String table) {
        jdbc.execute(ScalarsSql.dropTable(table));
        created.remove(table);
    }
}
