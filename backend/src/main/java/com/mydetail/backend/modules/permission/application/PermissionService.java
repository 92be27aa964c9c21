package com.mydetail.backend.modules.permission.application;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.UUID;

import com.mydetail.backend.global.config.PermissionEngineProperties;
import com.mydetail.backend.modules.permission.domain.ModuleVisibilityPolicy;
import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;
import com.mydetail.backend.modules.permission.domain.PrincipalIds;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 권한 엔진의 소비자용 진입점.
 * 캐시 장애는 해석 실패로 번지지 않는다. get 실패는 miss, put 실패는 로그만 남긴다.
 */
@Service
public class PermissionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionService.class);

    private final PermissionResolver resolver;
    private final PermissionSnapshotCache cache;
    private final PermissionDiagnostics diagnostics;
    private final Duration ttl;
    private final ModuleVisibilityPolicy emptyModuleVisibility;

    public PermissionService(PermissionResolver resolver,
                             PermissionSnapshotCache cache,
                             PermissionDiagnostics diagnostics,
                             PermissionEngineProperties properties) {
        this.resolver = resolver;
        this.cache = cache;
        this.diagnostics = diagnostics;
        this.ttl = properties.cache().ttl();
        this.emptyModuleVisibility = properties.emptyModuleVisibility();
    }

    public PermissionSnapshot resolve(String principalId) {
        String key = PrincipalIds.parse(principalId).toString();

        Optional<PermissionSnapshot> cached = readCache(key);
        if (cached.isPresent()) {
            diagnostics.cacheResult("hit");
            return cached.get();
        }
        diagnostics.cacheResult("miss");

        // 계산이 끝난 스냅샷만 캐시에 넣는다. 실패하면 예외가 그대로 올라가고 캐시는 건드리지 않는다.
        PermissionSnapshot snapshot = resolver.resolve(key);
        if (snapshot.isDegraded()) {
            // 일부 역할이 빠진 결과는 다음 요청에서 다시 계산한다.
            return snapshot;
        }
        try {
            cache.put(key, snapshot, ttl);
        } catch (RuntimeException ex) {
            log.warn("Failed to cache permission snapshot (principal={})", key, ex);
        }
        return snapshot;
    }

    public PermissionSnapshot resolveUncached(String principalId) {
        return resolver.resolve(principalId);
    }

    public boolean hasSystemCapability(PermissionSnapshot snapshot, String capabilityKey) {
        return snapshot != null && capabilityKey != null && snapshot.hasSystemCapability(capabilityKey);
    }

    public boolean hasModuleCapability(PermissionSnapshot snapshot, String moduleKey, String capabilityKey) {
        return snapshot != null && moduleKey != null && capabilityKey != null
                && snapshot.hasModuleCapability(moduleKey, capabilityKey);
    }

    /**
     * 권한이 하나라도 있는 활성 모듈은 보인다. 권한이 없는 활성 모듈은 정책에 따른다.
     */
    public boolean isModuleVisible(PermissionSnapshot snapshot, String moduleKey) {
        if (snapshot == null || moduleKey == null) {
            return false;
        }
        if (snapshot.isUnrestricted()) {
            return true;
        }
        SortedSet<String> capabilities = snapshot.getModuleCapabilities().get(moduleKey);
        if (capabilities == null) {
            return false;
        }
        return !capabilities.isEmpty() || emptyModuleVisibility == ModuleVisibilityPolicy.VISIBLE_READ_ONLY;
    }

    public List<String> visibleModules(PermissionSnapshot snapshot) {
        if (snapshot == null) {
            return List.of();
        }
        return snapshot.getModuleCapabilities().keySet().stream()
                .filter(module -> isModuleVisible(snapshot, module))
                .toList();
    }

    public ModuleVisibilityPolicy getEmptyModuleVisibility() {
        return emptyModuleVisibility;
    }

    public void invalidate(String principalId) {
        String key = PrincipalIds.parse(principalId).toString();
        cache.invalidate(key);
        log.debug("Permission snapshot invalidated (principal={})", key);
    }

    /**
     * 즉시 무효화하고, 진행 중인 트랜잭션이 있으면 커밋 직후 한 번 더 무효화한다.
     * 커밋 전에 다른 요청이 옛 상태로 스냅샷을 다시 채운 경우를 지우기 위함이다.
     */
    public void invalidateAll(Collection<UUID> principalIds) {
        Set<String> keys = new LinkedHashSet<>();
        for (UUID principalId : principalIds) {
            keys.add(principalId.toString());
        }
        keys.forEach(cache::invalidate);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    for (String key : keys) {
                        try {
                            cache.invalidate(key);
                        } catch (RuntimeException ex) {
                            log.error("[ALERT][Permissions] post-commit invalidation failed (principal={})", key, ex);
                        }
                    }
                }
            });
        }
        if (!keys.isEmpty()) {
            log.info("Permission snapshots invalidated (principals={})", keys.size());
        }
    }

    private Optional<PermissionSnapshot> readCache(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException ex) {
            diagnostics.cacheResult("error");
            log.warn("Permission snapshot cache read failed, resolving directly (principal={})", key, ex);
            return Optional.empty();
        }
    }
}
