package com.mydetail.backend.modules.permission.application;

import java.util.Optional;

import com.mydetail.backend.global.security.AuthenticatedPrincipal;
import com.mydetail.backend.global.security.SecurityUtils;
import com.mydetail.backend.modules.permission.domain.PermissionResolutionException;
import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@code @PreAuthorize("@permissionGuard.hasSystemCapability('manage_roles')")} 형태로 쓰는 인가 헬퍼.
 * 해석에 실패하면 항상 거부한다.
 */
@Component("permissionGuard")
public class PermissionGuard {

    private static final Logger log = LoggerFactory.getLogger(PermissionGuard.class);

    private final PermissionService permissionService;

    public PermissionGuard(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    public boolean hasSystemCapability(String capabilityKey) {
        return currentSnapshot()
                .map(snapshot -> permissionService.hasSystemCapability(snapshot, capabilityKey))
                .orElse(false);
    }

    public boolean hasModuleCapability(String moduleKey, String capabilityKey) {
        return currentSnapshot()
                .map(snapshot -> permissionService.hasModuleCapability(snapshot, moduleKey, capabilityKey))
                .orElse(false);
    }

    public boolean canSeeModule(String moduleKey) {
        return currentSnapshot()
                .map(snapshot -> permissionService.isModuleVisible(snapshot, moduleKey))
                .orElse(false);
    }

    private Optional<PermissionSnapshot> currentSnapshot() {
        Optional<AuthenticatedPrincipal> principal = SecurityUtils.findCurrentPrincipal();
        if (principal.isEmpty()) {
            return Optional.empty();
        }
        String principalId = principal.get().principalId().toString();
        try {
            return Optional.of(permissionService.resolve(principalId));
        } catch (PermissionResolutionException ex) {
            log.warn("Denying access, permissions unavailable (principal={}, kind={})", principalId, ex.getKind());
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.error("Denying access after unexpected resolution failure (principal={})", principalId, ex);
            return Optional.empty();
        }
    }
}
