package org.learningjava.scalarstore.infrastructure.adapter.out.clickhouse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.scalarstore.application.port.MappingStorePort;
import org.learningjava.scalarstore.domain.error.MappingFormatException;
import org.learningjava.scalarstore.domain.model.NameMapping;
import org.learningjava.scalarstore.domain.service.schema.Identifiers;
import org.learningjava.scalarstore.domain.service.schema.ScalarsSql;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Mapping snapshots in one shared table; each save appends the full mapping as JSON.
 */
public class ClickHouseMappingStoreAdapter implements MappingStorePort {
    private static final Logger log = LoggerFactory.getLogger(ClickHouseMappingStoreAdapter.class);

    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() { };

    private final ClickHouseJdbc jdbc;
    private final String table;
    private final ObjectMapper om;
    private volatile boolean schemaReady;

    public ClickHouseMappingStoreAdapter(ClickHouseJdbc jdbc, String table, ObjectMapper om) {
        this.jdbc = jdbc;
        this.table = Identifiers.requireSafe(table);
        this.om = om;
    }

    @Override
    public void ensureSchema() {
        jdbc.execute(ScalarsSql.createMappingTable(table));
        if (!schemaReady) {
            log.info("Mapping table {} ready", table);
        }
        schemaReady = true;
    }

    @Override
    public Optional<NameMapping> loadLatest(String projectId) {
        ensureReady();
        List<String> rows = jdbc.query(ScalarsSql.selectLatestMapping(table, projectId), rs -> rs.getString(1));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new NameMapping(om.readValue(rows.get(0), MAP_TYPE)));
        } catch (JsonProcessingException e) {
            throw new MappingFormatException(projectId, e);
        }
    }

    @Override
    public void save(String projectId, NameMapping mapping, Instant updatedAt) {
        ensureReady();
        String json;
        try {
            json = om.writeValueAsString(mapping.asMap());
        } catch (JsonProcessingException e) {
            throw new MappingFormatException(projectId, e);
        }
        jdbc.execute(ScalarsSql.insertMapping(table, projectId, json, updatedAt));
    }

    private void ensureReady() {
        if (!schemaReady) {
            ensureSchema();
        }
    }
}
