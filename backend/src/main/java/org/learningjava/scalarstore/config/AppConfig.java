package org.learningjava.scalarstore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.learningjava.scalarstore.application.port.LastLoggedStorePort;
import org.learningjava.scalarstore.application.port.MappingStorePort;
import org.learningjava.scalarstore.application.port.ScalarTablePort;
import org.learningjava.scalarstore.application.port.ScalarsCachePort;
import org.learningjava.scalarstore.infrastructure.adapter.out.cache.InMemoryScalarsCache;
import org.learningjava.scalarstore.infrastructure.adapter.out.cache.NoOpScalarsCache;
import org.learningjava.scalarstore.infrastructure.adapter.out.cache.RedisScalarsCache;
import org.learningjava.scalarstore.infrastructure.adapter.out.clickhouse.ClickHouseJdbc;
import org.learningjava.scalarstore.infrastructure.adapter.out.clickhouse.ClickHouseLastLoggedAdapter;
import org.learningjava.scalarstore.infrastructure.adapter.out.clickhouse.ClickHouseMappingStoreAdapter;
import org.learningjava.scalarstore.infrastructure.adapter.out.clickhouse.ClickHouseScalarTableAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AppConfig {
    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    //objects with external dependencies
    @Bean
    HikariDataSource clickHouseDataSource(ScalarsProperties props) {
        ScalarsProperties.ClickHouse ch = props.getClickhouse();
        // pool opens on first use, so the service starts even when ClickHouse is down
        HikariDataSource ds = new HikariDataSource();
        ds.setPoolName("clickhouse");
        ds.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");
        ds.setJdbcUrl(ch.getUrl());
        ds.setUsername(ch.getUsername());
        ds.setPassword(ch.getPassword());
        ds.setMaximumPoolSize(ch.getPoolSize());
        ds.setConnectionTimeout(ch.getConnectionTimeoutMs());
        log.info("ClickHouse at {} (pool size {})", ch.getUrl(), ch.getPoolSize());
        return ds;
    }

    @Bean
    ClickHouseJdbc clickHouseJdbc(HikariDataSource ds, ScalarsProperties props) {
        return new ClickHouseJdbc(ds, props.getClickhouse().getQueryTimeoutSeconds());
    }

    @Bean
    ScalarTablePort scalarTables(ClickHouseJdbc jdbc) {
        return new ClickHouseScalarTableAdapter(jdbc);
    }

    @Bean
    MappingStorePort mappingStore(ClickHouseJdbc jdbc, ScalarsProperties props, ObjectMapper om) {
        return new ClickHouseMappingStoreAdapter(jdbc, props.getMappingTable(), om);
    }

    @Bean
    LastLoggedStorePort lastLoggedStore(ClickHouseJdbc jdbc) {
        return new ClickHouseLastLoggedAdapter(jdbc);
    }

    @Bean
    ScalarsCachePort scalarsCache(ScalarsProperties props,
                                  Clock clock,
                                  ObjectProvider<StringRedisTemplate> redis,
                                  ObjectMapper om) {
        ScalarsProperties.Cache c = props.getCache();
        if (!c.isActive()) {
            log.info("Scalars cache disabled");
            return new NoOpScalarsCache();
        }
        Duration ttl = Duration.ofSeconds(c.getTtlSeconds());
        if (c.getBackend() == ScalarsProperties.Cache.Backend.REDIS) {
            StringRedisTemplate template = redis.getIfAvailable();
            if (template != null) {
                log.info("Scalars cache: redis ttl={}s maxSize={}", c.getTtlSeconds(), c.getMaxSize());
                return new RedisScalarsCache(template, om, clock, ttl, c.getMaxSize());
            }
            log.warn("scalars.cache.backend=redis but no Redis connection is configured, using in-memory cache");
        }
        log.info("Scalars cache: in-memory ttl={}s maxSize={}", c.getTtlSeconds(), c.getMaxSize());
        return new InMemoryScalarsCache(clock, ttl, c.getMaxSize());
    }
}
