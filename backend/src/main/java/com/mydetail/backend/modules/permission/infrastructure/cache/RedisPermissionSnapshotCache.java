package com.mydetail.backend.modules.permission.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

import com.mydetail.backend.global.config.PermissionEngineProperties;
import com.mydetail.backend.modules.permission.application.PermissionSnapshotCache;
import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * 여러 인스턴스가 공유하는 Redis 캐시. 값은 JSON, 만료는 SET EX 로 처리한다.
 * 역직렬화에 실패한 항목은 지우고 miss 로 취급한다.
 */
@Component
@ConditionalOnProperty(name = "app.permissions.cache.type", havingValue = "redis")
public class RedisPermissionSnapshotCache implements PermissionSnapshotCache {

    private static final Logger log = LoggerFactory.getLogger(RedisPermissionSnapshotCache.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisPermissionSnapshotCache(StringRedisTemplate redisTemplate,
                                        ObjectMapper objectMapper,
                                        PermissionEngineProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.cache().redisKeyPrefix();
        log.info("Redis permission snapshot cache initialized (prefix={})", keyPrefix);
    }

    @Override
    public Optional<PermissionSnapshot> get(String principalId) {
        String key = keyFor(principalId);
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, PermissionSnapshot.class));
        } catch (JsonProcessingException ex) {
            log.warn("Evicting unreadable permission snapshot (key={})", key, ex);
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @Override
    public void put(String principalId, PermissionSnapshot snapshot, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("permission snapshot could not be serialized", ex);
        }
        redisTemplate.opsForValue().set(keyFor(principalId), json, ttl);
    }

    @Override
    public void invalidate(String principalId) {
        redisTemplate.delete(keyFor(principalId));
    }

    String keyFor(String principalId) {
        return keyPrefix + principalId;
    }
}
