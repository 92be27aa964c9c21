package com.mydetail.backend.modules.permission.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

import com.mydetail.backend.modules.permission.application.PermissionSnapshotCache;
import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 단일 인스턴스용 메모리 캐시. 개수 제한 없이 항목별 TTL 로만 만료된다.
 */
@Component
@ConditionalOnProperty(name = "app.permissions.cache.type", havingValue = "memory", matchIfMissing = true)
public class CaffeinePermissionSnapshotCache implements PermissionSnapshotCache {

    private static final Logger log = LoggerFactory.getLogger(CaffeinePermissionSnapshotCache.class);

    private final Cache<String, CachedSnapshot> cache;

    public CaffeinePermissionSnapshotCache() {
        this(Ticker.systemTicker());
    }

    CaffeinePermissionSnapshotCache(Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfter(new PerEntryTtl())
                .build();
        log.info("In-memory permission snapshot cache initialized");
    }

    @Override
    public Optional<PermissionSnapshot> get(String principalId) {
        CachedSnapshot cached = cache.getIfPresent(principalId);
        return cached == null ? Optional.empty() : Optional.of(cached.snapshot());
    }

    @Override
    public void put(String principalId, PermissionSnapshot snapshot, Duration ttl) {
        cache.put(principalId, new CachedSnapshot(snapshot, ttl.toNanos()));
    }

    @Override
    public void invalidate(String principalId) {
        cache.invalidate(principalId);
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record CachedSnapshot(PermissionSnapshot snapshot, long ttlNanos) {
    }

    private static final class PerEntryTtl implements Expiry<String, CachedSnapshot> {

        @Override
        public long expireAfterCreate(String key, CachedSnapshot value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedSnapshot value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedSnapshot value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
