package com.mydetail.backend.global.config;

import java.time.Duration;
import java.util.regex.Pattern;

import com.mydetail.backend.modules.permission.domain.ModuleVisibilityPolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 권한 해석 엔진 설정 ({@code app.permissions.*}).
 * 누락된 값은 각 레코드의 compact constructor에서 기본값으로 채운다.
 */
@ConfigurationProperties(prefix = "app.permissions")
public record PermissionEngineProperties(
        Cache cache,
        Fetch fetch,
        Batch batch,
        ModuleVisibilityPolicy emptyModuleVisibility
) {

    public PermissionEngineProperties {
        if (cache == null) {
            cache = Cache.defaults();
        }
        if (fetch == null) {
            fetch = Fetch.defaults();
        }
        if (batch == null) {
            batch = Batch.defaults();
        }
        if (emptyModuleVisibility == null) {
            emptyModuleVisibility = ModuleVisibilityPolicy.VISIBLE_READ_ONLY;
        }
    }

    public static PermissionEngineProperties defaults() {
        return new PermissionEngineProperties(null, null, null, null);
    }

    /**
     * 스냅샷 캐시. type 은 memory(Caffeine) 또는 redis.
     */
    public record Cache(String type, Duration ttl, String redisKeyPrefix) {

        public Cache {
            if (type == null || type.isBlank()) {
                type = "memory";
            }
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                ttl = Duration.ofMinutes(5);
            }
            if (redisKeyPrefix == null || redisKeyPrefix.isBlank()) {
                redisKeyPrefix = "permissions:snapshot:";
            }
        }

        public static Cache defaults() {
            return new Cache(null, null, null);
        }
    }

    /**
     * 역할별 facet 조회 동시성 및 타임아웃.
     * maxConcurrency 는 커넥션 풀 크기 이하로 유지해야 한다.
     */
    public record Fetch(int maxConcurrency, int queueCapacity, Duration storageTimeout, Duration roleDeadline) {

        public Fetch {
            if (maxConcurrency <= 0) {
                maxConcurrency = 8;
            }
            if (queueCapacity <= 0) {
                queueCapacity = 256;
            }
            if (storageTimeout == null || storageTimeout.isZero() || storageTimeout.isNegative()) {
                storageTimeout = Duration.ofSeconds(3);
            }
            if (roleDeadline == null || roleDeadline.isZero() || roleDeadline.isNegative()) {
                roleDeadline = Duration.ofSeconds(10);
            }
        }

        public static Fetch defaults() {
            return new Fetch(0, 0, null, null);
        }

        /** 폴백 경로에서 역할 하나가 순서대로 실행하는 쿼리 수(접근 토글, 모듈 권한, 시스템 권한). */
        public static final int QUERIES_PER_ROLE = 3;

        public int storageTimeoutSeconds() {
            return (int) Math.max(1, storageTimeout.toSeconds());
        }

        public int storageTimeoutMillis() {
            return (int) Math.max(1, storageTimeout.toMillis());
        }

        /** 역할 마감 시간이 이보다 짧으면 마지막 쿼리가 자기 타임아웃 전에 잘린다. */
        public Duration minimumRoleDeadline() {
            return storageTimeout.multipliedBy(QUERIES_PER_ROLE);
        }
    }

    public record Batch(Boolean enabled, String functionName) {

        private static final Pattern SQL_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

        public Batch {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (functionName == null || functionName.isBlank()) {
                functionName = "fn_resolve_principal_facets";
            }
            if (!SQL_IDENTIFIER.matcher(functionName).matches()) {
                throw new IllegalArgumentException("app.permissions.batch.function-name is not a valid SQL identifier: " + functionName);
            }
        }

        public static Batch defaults() {
            return new Batch(null, null);
        }

        public boolean isEnabled() {
            return Boolean.TRUE.equals(enabled);
        }
    }
}
