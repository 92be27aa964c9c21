package com.mydetail.backend.modules.permission.application;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import com.mydetail.backend.global.config.PermissionEngineConfig;
import com.mydetail.backend.global.config.PermissionEngineProperties;
import com.mydetail.backend.modules.permission.domain.FacetFetchException;
import com.mydetail.backend.modules.permission.domain.FacetName;
import com.mydetail.backend.modules.permission.domain.PermissionErrorKind;
import com.mydetail.backend.modules.permission.domain.PermissionResolutionException;
import com.mydetail.backend.modules.permission.domain.RoleFacets;
import com.mydetail.backend.modules.role.domain.ModuleCapabilityKey;
import com.mydetail.backend.modules.role.infrastructure.persistence.ModuleAccessToggleRepository;
import com.mydetail.backend.modules.role.infrastructure.persistence.RoleModuleGrantRepository;
import com.mydetail.backend.modules.role.infrastructure.persistence.RoleSystemGrantRepository;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * 배치 집계 함수 없이 역할마다 facet 을 세 번의 쿼리로 조회하는 느린 경로.
 *
 * <p>출력은 배치 경로의 역할별 결과와 같아야 한다. 두 경로 모두 {@link RoleFacets#of} 로 조립하므로
 * 비활성 모듈 필터가 한쪽에서만 빠지는 일이 없다.</p>
 *
 * <p>역할별 조회는 {@code permissionFacetExecutor} 에서 병렬로 수행된다. 한 역할의 실패나 타임아웃은
 * 그 역할만 빈 결과로 만들고 다른 역할의 조회는 취소하지 않는다.</p>
 */
@Component
public class FallbackFacetQueryEngine {

    private final ModuleAccessToggleRepository moduleAccessToggleRepository;
    private final RoleSystemGrantRepository roleSystemGrantRepository;
    private final RoleModuleGrantRepository roleModuleGrantRepository;
    private final AsyncTaskExecutor executor;
    private final PermissionDiagnostics diagnostics;
    private final Duration roleDeadline;

    public FallbackFacetQueryEngine(
            ModuleAccessToggleRepository moduleAccessToggleRepository,
            RoleSystemGrantRepository roleSystemGrantRepository,
            RoleModuleGrantRepository roleModuleGrantRepository,
            @Qualifier(PermissionEngineConfig.FACET_EXECUTOR) AsyncTaskExecutor executor,
            PermissionDiagnostics diagnostics,
            PermissionEngineProperties properties
    ) {
        this.moduleAccessToggleRepository = moduleAccessToggleRepository;
        this.roleSystemGrantRepository = roleSystemGrantRepository;
        this.roleModuleGrantRepository = roleModuleGrantRepository;
        this.executor = executor;
        this.diagnostics = diagnostics;
        this.roleDeadline = properties.fetch().roleDeadline();
    }

    public RoleFacets resolveFacetsDirect(Long roleId) {
        List<String> enabledModules = fetch(roleId, FacetName.MODULE_ACCESS,
                () -> moduleAccessToggleRepository.findEnabledModuleKeys(roleId));
        List<String> systemCapabilities = fetch(roleId, FacetName.SYSTEM_CAPABILITIES,
                () -> roleSystemGrantRepository.findCapabilityKeys(roleId));
        List<ModuleCapabilityKey> moduleCapabilities = enabledModules.isEmpty()
                ? List.of()
                : fetch(roleId, FacetName.MODULE_CAPABILITIES,
                        () -> roleModuleGrantRepository.findCapabilitiesInModules(roleId, enabledModules));
        return RoleFacets.of(roleId, enabledModules, systemCapabilities, moduleCapabilities);
    }

    /**
     * 호출 스레드가 인터럽트되면 진행 중인 역할 조회를 모두 취소하고 CANCELLED 로 끝낸다.
     */
    public FacetResolution resolveAll(String principalId, Collection<Long> roleIds) {
        Map<Long, Future<RoleFacets>> futures = new LinkedHashMap<>();
        Map<Long, RoleFacets> facets = new HashMap<>();
        Set<Long> degraded = new HashSet<>();

        try {
            for (Long roleId : roleIds) {
                try {
                    futures.put(roleId, executor.submit(() -> resolveFacetsDirect(roleId)));
                } catch (TaskRejectedException ex) {
                    degrade(principalId, roleId, FacetName.ROLE, PermissionErrorKind.DEPENDENCY_UNAVAILABLE, ex, facets, degraded);
                }
            }

            for (Map.Entry<Long, Future<RoleFacets>> entry : futures.entrySet()) {
                Long roleId = entry.getKey();
                Future<RoleFacets> future = entry.getValue();
                try {
                    facets.put(roleId, future.get(roleDeadline.toMillis(), TimeUnit.MILLISECONDS));
                } catch (TimeoutException ex) {
                    future.cancel(true);
                    degrade(principalId, roleId, FacetName.ROLE, PermissionErrorKind.DEPENDENCY_UNAVAILABLE, ex, facets, degraded);
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause();
                    if (cause instanceof FacetFetchException fetchFailure) {
                        degrade(principalId, roleId, fetchFailure.getFacet(), fetchFailure.getKind(),
                                fetchFailure.getCause(), facets, degraded);
                    } else {
                        degrade(principalId, roleId, FacetName.ROLE, PermissionErrorKind.UNEXPECTED, cause, facets, degraded);
                    }
                } catch (CancellationException ex) {
                    degrade(principalId, roleId, FacetName.ROLE, PermissionErrorKind.CANCELLED, ex, facets, degraded);
                }
            }
        } catch (InterruptedException ex) {
            futures.values().forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new PermissionResolutionException(PermissionErrorKind.CANCELLED, principalId,
                    "permission resolution cancelled by caller", ex);
        }

        return new FacetResolution(facets, degraded);
    }

    private void degrade(String principalId, Long roleId, FacetName facet, PermissionErrorKind kind, Throwable cause,
                         Map<Long, RoleFacets> facets, Set<Long> degraded) {
        diagnostics.roleDegraded(principalId, roleId, facet, kind, cause);
        facets.put(roleId, RoleFacets.empty(roleId));
        degraded.add(roleId);
    }

    private static <T> List<T> fetch(Long roleId, FacetName facet, Supplier<List<T>> query) {
        try {
            return query.get();
        } catch (DataAccessException ex) {
            throw new FacetFetchException(roleId, facet, StorageFailures.classify(ex), ex);
        } catch (RuntimeException ex) {
            throw new FacetFetchException(roleId, facet, PermissionErrorKind.UNEXPECTED, ex);
        }
    }
}
