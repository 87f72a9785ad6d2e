package org.learningjava.scalarstore.infrastructure.adapter.out.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.scalarstore.application.port.ScalarsCachePort;
import org.learningjava.scalarstore.domain.model.ExperimentScalars;
import org.learningjava.scalarstore.domain.service.cache.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Result cache shared by every service process. Values are JSON strings written with a TTL; a sorted
 * set scored by last access time bounds the number of entries, evicting the least recently used.
 * <p>
 * Redis is an accelerator only: any Redis failure is logged and treated as a miss or a no-op.
 */
public class RedisScalarsCache implements ScalarsCachePort {
    private static final Logger log = LoggerFactory.getLogger(RedisScalarsCache.class);

    static final String INDEX_KEY = CacheKeys.PREFIX + ":keys";
    private static final TypeReference<List<ExperimentScalars>> VALUE_TYPE = new TypeReference<>() { };
    private static final int SCAN_BATCH = 500;

    private final StringRedisTemplate redis;
    private final ObjectMapper om;
    private final Clock clock;
    private final Duration ttl;
    private final int maxSize;

    public RedisScalarsCache(StringRedisTemplate redis, ObjectMapper om, Clock clock, Duration ttl, int maxSize) {
        if (ttl.isNegative() || ttl.isZero() || maxSize <= 0) {
            throw new IllegalArgumentException("ttl and maxSize must be positive");
        }
        this.redis = redis;
        this.om = om;
        this.clock = clock;
        this.ttl = ttl;
        this.maxSize = maxSize;
    }

    @Override
    public Optional<List<ExperimentScalars>> get(String key) {
        String json;
        try {
            json = redis.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            redis.opsForZSet().add(INDEX_KEY, key, clock.millis());
        } catch (DataAccessException e) {
            log.warn("Redis get failed for {}, treating as miss", key, e);
            return Optional.empty();
        }
        try {
            return Optional.of(om.readValue(json, VALUE_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cache entry {}, dropping it", key, e);
            remove(key);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, List<ExperimentScalars> value) {
        String json;
        try {
            json = om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize cache entry {}", key, e);
            return;
        }
        try {
            redis.opsForValue().set(key, json, ttl);
            redis.opsForZSet().add(INDEX_KEY, key, clock.millis());
            enforceMaxSize();
        } catch (DataAccessException e) {
            log.warn("Redis set failed for {}", key, e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            redis.delete(key);
            redis.opsForZSet().remove(INDEX_KEY, key);
        } catch (DataAccessException e) {
            log.warn("Redis remove failed for {}", key, e);
        }
    }

    @Override
    public int invalidate(String pattern) {
        List<String> keys = new ArrayList<>();
        try {
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
            try (Cursor<String> cursor = redis.scan(options)) {
                while (cursor.hasNext()) {
                    String key = cursor.next();
                    if (!INDEX_KEY.equals(key)) {
                        keys.add(key);
                    }
                }
            }
            if (keys.isEmpty()) {
                return 0;
            }
            Long deleted = redis.delete(keys);
            redis.opsForZSet().remove(INDEX_KEY, keys.toArray());
            log.debug("Invalidated {} key(s) matching {}", keys.size(), pattern);
            return deleted == null ? 0 : deleted.intValue();
        } catch (DataAccessException e) {
            log.warn("Redis invalidate failed for {}", pattern, e);
            return 0;
        }
    }

    private void enforceMaxSize() {
        Long total = redis.opsForZSet().zCard(INDEX_KEY);
        if (total == null || total <= maxSize) {
            return;
        }
        long excess = total - maxSize;
        Set<String> oldest = redis.opsForZSet().range(INDEX_KEY, 0, excess - 1);
        if (oldest == null || oldest.isEmpty()) {
            return;
        }
        redis.delete(oldest);
        redis.opsForZSet().remove(INDEX_KEY, oldest.toArray());
        log.debug("Evicted {} cache entr(ies) over max size {}", oldest.size(), maxSize);
    }
}
