package org.learningjava.scalarstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "scalars")
public class ScalarsProperties {
    private String mappingTable = "scalars_mapping";
    private int defaultMaxPoints = 1000;
    private ClickHouse clickhouse = new ClickHouse();
    private Cache cache = new Cache();
    private LastLogged lastLogged = new LastLogged();
    private Schema schema = new Schema();

    public String getMappingTable() { return mappingTable; }
    public void setMappingTable(String v) { this.mappingTable = v; }
    public int getDefaultMaxPoints() { return defaultMaxPoints; }
    public void setDefaultMaxPoints(int v) { this.defaultMaxPoints = v; }
    public ClickHouse getClickhouse() { return clickhouse; }
    public void setClickhouse(ClickHouse v) { this.clickhouse = v; }
    public Cache getCache() { return cache; }
    public void setCache(Cache v) { this.cache = v; }
    public LastLogged getLastLogged() { return lastLogged; }
    public void setLastLogged(LastLogged v) { this.lastLogged = v; }
    public Schema getSchema() { return schema; }
    public void setSchema(Schema v) { this.schema = v; }

    public static class ClickHouse {
        private String url = "jdbc:clickhouse://localhost:8123/default";
        private String username = "default";
        private String password = "";
        private int poolSize = 8;
        private long connectionTimeoutMs = 5000;
        private int queryTimeoutSeconds = 30;

        public String getUrl() { return url; }
        public void setUrl(String v) { this.url = v; }
        public String getUsername() { return username; }
        public void setUsername(String v) { this.username = v; }
        public String getPassword() { return password; }
        public void setPassword(String v) { this.password = v; }
        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int v) { this.poolSize = v; }
        public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
        public void setConnectionTimeoutMs(long v) { this.connectionTimeoutMs = v; }
        public int getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
        public void setQueryTimeoutSeconds(int v) { this.queryTimeoutSeconds = v; }
    }

    public static class Cache {
        public enum Backend { MEMORY, REDIS }

        private boolean enabled = true;
        private Backend backend = Backend.MEMORY;
        private long ttlSeconds = 60;
        private int maxSize = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }
        public Backend getBackend() { return backend; }
        public void setBackend(Backend v) { this.backend = v; }
        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long v) { this.ttlSeconds = v; }
        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int v) { this.maxSize = v; }

        /** A cache with no lifetime or no room behaves as disabled. */
        public boolean isActive() {
            return enabled && ttlSeconds > 0 && maxSize > 0;
        }
    }

    public static class LastLogged {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }
    }

    public static class Schema {
        private boolean initOnStartup = true;

        public boolean isInitOnStartup() { return initOnStartup; }
        public void setInitOnStartup(boolean v) { this.initOnStartup = v; }
    }
}
