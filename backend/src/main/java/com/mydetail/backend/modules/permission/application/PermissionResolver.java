package com.mydetail.backend.modules.permission.application;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.mydetail.backend.global.config.PermissionEngineProperties;
import com.mydetail.backend.modules.audit.application.PermissionAuditService;
import com.mydetail.backend.modules.audit.domain.PermissionAuditAction;
import com.mydetail.backend.modules.permission.domain.AggregationUnsupportedException;
import com.mydetail.backend.modules.permission.domain.PermissionErrorKind;
import com.mydetail.backend.modules.permission.domain.PermissionResolutionException;
import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;
import com.mydetail.backend.modules.permission.domain.PrincipalIds;
import com.mydetail.backend.modules.permission.domain.ResolutionPath;
import com.mydetail.backend.modules.permission.domain.RoleDescriptor;
import com.mydetail.backend.modules.permission.domain.RoleFacets;
import com.mydetail.backend.modules.principal.domain.AppPrincipal;
import com.mydetail.backend.modules.principal.infrastructure.persistence.AppPrincipalRepository;
import com.mydetail.backend.modules.role.domain.BoundRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * 캐시를 거치지 않는 권한 해석 파이프라인.
 *
 * <ol>
 *     <li>우회 계정이면 즉시 무제한 스냅샷</li>
 *     <li>역할 집계. 역할이 없으면 빈 스냅샷</li>
 *     <li>역할별 facet 조회 (배치 우선, 실패 시 폴백)</li>
 *     <li>합집합 후 역할 descriptor 첨부</li>
 * </ol>
 *
 * 트랜잭션을 열지 않는다. 폴백 워커가 각자 커넥션을 쓰므로 호출 스레드가 커넥션을 붙잡고 있으면 안 된다.
 */
@Component
public class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final AppPrincipalRepository appPrincipalRepository;
    private final RoleAggregator roleAggregator;
    private final BatchFacetRetriever batchFacetRetriever;
    private final FallbackFacetQueryEngine fallbackFacetQueryEngine;
    private final PermissionDiagnostics diagnostics;
    private final PermissionAuditService auditService;
    private final boolean batchEnabled;

    public PermissionResolver(
            AppPrincipalRepository appPrincipalRepository,
            RoleAggregator roleAggregator,
            BatchFacetRetriever batchFacetRetriever,
            FallbackFacetQueryEngine fallbackFacetQueryEngine,
            PermissionDiagnostics diagnostics,
            PermissionAuditService auditService,
            PermissionEngineProperties properties
    ) {
        this.appPrincipalRepository = appPrincipalRepository;
        this.roleAggregator = roleAggregator;
        this.batchFacetRetriever = batchFacetRetriever;
        this.fallbackFacetQueryEngine = fallbackFacetQueryEngine;
        this.diagnostics = diagnostics;
        this.auditService = auditService;
        this.batchEnabled = properties.batch().isEnabled();
    }

    public PermissionSnapshot resolve(String principalId) {
        UUID id = PrincipalIds.parse(principalId);
        String key = id.toString();
        long started = System.nanoTime();

        AppPrincipal principal = loadPrincipal(id, key);
        if (principal.isBypassAccount()) {
            auditService.record(PermissionAuditAction.BYPASS_GRANTED, "principal", key, null,
                    Map.of("superAdmin", principal.isSuperAdmin(), "supermanager", principal.isSupermanager()));
            return finish(PermissionSnapshot.unrestricted(key), started);
        }

        List<BoundRole> boundRoles = aggregate(key);
        if (boundRoles.isEmpty()) {
            return finish(PermissionSnapshot.empty(key), started);
        }

        List<Long> roleIds = boundRoles.stream()
                .map(BoundRole::roleId)
                .distinct()
                .toList();
        RetrievedFacets retrieved = retrieveFacets(id, key, roleIds);

        PermissionSnapshot.Builder builder = PermissionSnapshot.builder(key).path(retrieved.path());
        for (BoundRole boundRole : boundRoles) {
            builder.role(RoleDescriptor.from(boundRole));
            RoleFacets facets = retrieved.resolution().facets().get(boundRole.roleId());
            if (facets != null) {
                builder.merge(facets);
            }
        }
        retrieved.resolution().degradedRoleIds().forEach(builder::degraded);
        return finish(builder.build(), started);
    }

    private AppPrincipal loadPrincipal(UUID id, String key) {
        try {
            return appPrincipalRepository.findById(id)
                    .orElseThrow(() -> new PermissionResolutionException(PermissionErrorKind.INVALID_ARGUMENT, key,
                            "unknown principal"));
        } catch (DataAccessException ex) {
            throw new PermissionResolutionException(PermissionErrorKind.DEPENDENCY_UNAVAILABLE, key,
                    "principal could not be loaded", ex);
        }
    }

    private List<BoundRole> aggregate(String key) {
        try {
            return roleAggregator.resolveMemberships(key);
        } catch (PermissionResolutionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new PermissionResolutionException(PermissionErrorKind.UNEXPECTED, key, "role aggregation failed", ex);
        }
    }

    private RetrievedFacets retrieveFacets(UUID id, String key, List<Long> roleIds) {
        if (batchEnabled) {
            try {
                Map<Long, RoleFacets> batch = batchFacetRetriever.retrieve(id, roleIds);
                return new RetrievedFacets(ResolutionPath.BATCH, new FacetResolution(batch, Set.of()));
            } catch (AggregationUnsupportedException ex) {
                diagnostics.fallbackUsed(key, ex.getKind(), ex);
            } catch (RuntimeException ex) {
                log.error("Unexpected batch facet retrieval failure (principal={})", key, ex);
                diagnostics.fallbackUsed(key, PermissionErrorKind.UNEXPECTED, ex);
            }
        } else {
            diagnostics.fallbackUsed(key, PermissionErrorKind.AGGREGATION_UNSUPPORTED, null);
        }
        return new RetrievedFacets(ResolutionPath.FALLBACK, fallbackFacetQueryEngine.resolveAll(key, roleIds));
    }

    private PermissionSnapshot finish(PermissionSnapshot snapshot, long started) {
        diagnostics.resolved(snapshot.getResolutionPath(), Duration.ofNanos(System.nanoTime() - started));
        if (snapshot.isDegraded()) {
            log.warn("Permission snapshot degraded (principal={}, excludedRoles={})",
                    snapshot.getPrincipalId(), snapshot.getDegradedRoleIds());
        }
        return snapshot;
    }

    private record RetrievedFacets(ResolutionPath path, FacetResolution resolution) {
    }
}
