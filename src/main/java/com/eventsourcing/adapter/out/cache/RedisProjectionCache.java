package com.eventsourcing.adapter.out.cache;

import com.eventsourcing.application.port.out.ProjectionCache;
import com.eventsourcing.application.port.out.ProjectionRecord;
import com.eventsourcing.application.port.out.RecordCodec;
import com.eventsourcing.application.port.out.RecordKeys;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;
import com.eventsourcing.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Projection cache shared between instances. Each entry is a hash holding the version and the
 * projection document; writes go through a script that refuses to replace a newer version.
 */
@Repository
@ConditionalOnProperty(prefix = "app.projection-cache", name = "type", havingValue = "redis")
public class RedisProjectionCache implements ProjectionCache {

    private static final Logger log = LoggerFactory.getLogger(RedisProjectionCache.class);

    private static final String VERSION_FIELD = "version";
    private static final String PAYLOAD_FIELD = "payload";

    private static final RedisScript<Long> PUT_IF_NEWER = new DefaultRedisScript<>("""
        local current = redis.call('HGET', KEYS[1], 'version')
        if current and tonumber(current) > tonumber(ARGV[1]) then
          return 0
        end
        redis.call('HSET', KEYS[1], 'version', ARGV[1], 'payload', ARGV[2])
        return 1
        """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final HashOperations<String, String, String> hashOps;
    private final RecordCodec codec;
    private final String keyPrefix;

    public RedisProjectionCache(StringRedisTemplate redisTemplate, RecordCodec codec, AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.hashOps = redisTemplate.opsForHash();
        this.codec = codec;
        this.keyPrefix = appProperties.getProjectionCache().getKeyPrefix();
    }

    @Override
    public Optional<Student> get(StudentId streamId) {
        List<String> values = hashOps.multiGet(cacheKey(streamId), List.of(VERSION_FIELD, PAYLOAD_FIELD));
        if (values.size() < 2 || values.get(0) == null || values.get(1) == null) {
            return Optional.empty();
        }
        String key = RecordKeys.projectionKey(streamId);
        long version = Long.parseLong(values.get(0));
        return Optional.of(codec.decodeProjection(new ProjectionRecord(key, key, version, values.get(1))));
    }

    @Override
    public void put(StudentId streamId, Student student) {
        ProjectionRecord record = codec.encodeProjection(streamId, student);
        Long written = redisTemplate.execute(
            PUT_IF_NEWER,
            List.of(cacheKey(streamId)),
            Long.toString(record.version()),
            record.payload()
        );
        if (written == null || written == 0L) {
            log.debug("Kept newer cached projection for stream={} over version {}", streamId, record.version());
        }
    }

    @Override
    public void evict(StudentId streamId) {
        redisTemplate.delete(cacheKey(streamId));
    }

    @Override
    public void clear() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        if (keys == null || keys.isEmpty()) {
            return;
        }
        redisTemplate.delete(keys);
        log.info("Cleared {} cached projections", keys.size());
    }

    private String cacheKey(StudentId streamId) {
        return keyPrefix + streamId;
    }
}
