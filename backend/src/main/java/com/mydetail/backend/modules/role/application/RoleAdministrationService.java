package com.mydetail.backend.modules.role.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.mydetail.backend.global.error.ProblemException;
import com.mydetail.backend.modules.audit.application.PermissionAuditService;
import com.mydetail.backend.modules.audit.domain.PermissionAuditAction;
import com.mydetail.backend.modules.catalog.application.GrantCatalogService;
import com.mydetail.backend.modules.catalog.domain.ModulePermission;
import com.mydetail.backend.modules.catalog.domain.SystemPermission;
import com.mydetail.backend.modules.permission.application.PermissionService;
import com.mydetail.backend.modules.principal.domain.AppPrincipal;
import com.mydetail.backend.modules.principal.infrastructure.persistence.AppPrincipalRepository;
import com.mydetail.backend.modules.role.domain.Membership;
import com.mydetail.backend.modules.role.domain.ModuleAccessToggle;
import com.mydetail.backend.modules.role.domain.Role;
import com.mydetail.backend.modules.role.domain.RoleGrant;
import com.mydetail.backend.modules.role.domain.RoleModuleGrant;
import com.mydetail.backend.modules.role.domain.RoleSystemGrant;
import com.mydetail.backend.modules.role.infrastructure.persistence.MembershipRepository;
import com.mydetail.backend.modules.role.infrastructure.persistence.ModuleAccessToggleRepository;
import com.mydetail.backend.modules.role.infrastructure.persistence.RoleModuleGrantRepository;
import com.mydetail.backend.modules.role.infrastructure.persistence.RoleRepository;
import com.mydetail.backend.modules.role.infrastructure.persistence.RoleSystemGrantRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 역할/멤버십/권한 부여 변경 경로.
 * 모든 변경은 영향받는 사용자의 스냅샷 캐시를 같은 트랜잭션 안에서 무효화하고 감사 이벤트를 남긴다.
 */
@Service
@Transactional
public class RoleAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(RoleAdministrationService.class);

    private final AppPrincipalRepository principalRepository;
    private final RoleRepository roleRepository;
    private final MembershipRepository membershipRepository;
    private final ModuleAccessToggleRepository moduleAccessToggleRepository;
    private final RoleModuleGrantRepository roleModuleGrantRepository;
    private final RoleSystemGrantRepository roleSystemGrantRepository;
    private final GrantCatalogService grantCatalogService;
    private final LegacyRoleGrantImporter legacyRoleGrantImporter;
    private final PermissionService permissionService;
    private final PermissionAuditService auditService;
    private final Clock clock;

    public RoleAdministrationService(
            AppPrincipalRepository principalRepository,
            RoleRepository roleRepository,
            MembershipRepository membershipRepository,
            ModuleAccessToggleRepository moduleAccessToggleRepository,
            RoleModuleGrantRepository roleModuleGrantRepository,
            RoleSystemGrantRepository roleSystemGrantRepository,
            GrantCatalogService grantCatalogService,
            LegacyRoleGrantImporter legacyRoleGrantImporter,
            PermissionService permissionService,
            PermissionAuditService auditService,
            Clock clock
    ) {
        this.principalRepository = principalRepository;
        this.roleRepository = roleRepository;
        this.membershipRepository = membershipRepository;
        this.moduleAccessToggleRepository = moduleAccessToggleRepository;
        this.roleModuleGrantRepository = roleModuleGrantRepository;
        this.roleSystemGrantRepository = roleSystemGrantRepository;
        this.grantCatalogService = grantCatalogService;
        this.legacyRoleGrantImporter = legacyRoleGrantImporter;
        this.permissionService = permissionService;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * 역할을 부여한다. 비활성 멤버십이 이미 있으면 새로 만들지 않고 다시 활성화한다.
     */
    public Membership assignRole(@NonNull UUID principalId, @NonNull Long roleId, Long expectedOrganizationId, UUID actorId) {
        AppPrincipal principal = principalRepository.findById(principalId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "principal.not_found", "사용자를 찾을 수 없습니다."));
        Role role = findRole(roleId);
        if (!role.isActive()) {
            throw new ProblemException(HttpStatus.CONFLICT, "role.inactive", "비활성화된 역할은 부여할 수 없습니다.");
        }
        if (expectedOrganizationId != null && !expectedOrganizationId.equals(role.getOrganization().getId())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "membership.organization_mismatch",
                    "역할이 요청한 조직에 속하지 않습니다.");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<Membership> existing = membershipRepository.findByPrincipalAndRole(principalId, roleId);
        Membership membership;
        if (existing.isPresent()) {
            membership = existing.get();
            if (membership.isActive()) {
                throw new ProblemException(HttpStatus.CONFLICT, "membership.duplicate", "이미 부여된 역할입니다.");
            }
            membership.reactivate(now, actorId);
        } else {
            membership = membershipRepository.save(Membership.bind(principal, role, now, actorId));
        }

        permissionService.invalidateAll(List.of(principalId));
        auditService.record(PermissionAuditAction.MEMBERSHIP_ASSIGNED, "membership", principalId + ":" + roleId, actorId,
                Map.of("organizationId", role.getOrganization().getId(), "roleKey", role.getRoleKey()));
        return membership;
    }

    public void deactivateMembership(@NonNull UUID principalId, @NonNull Long roleId, UUID actorId) {
        Membership membership = membershipRepository.findByPrincipalAndRole(principalId, roleId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "membership.not_found", "부여되지 않은 역할입니다."));
        if (!membership.isActive()) {
            return;
        }
        membership.deactivate(OffsetDateTime.now(clock));

        permissionService.invalidateAll(List.of(principalId));
        auditService.record(PermissionAuditAction.MEMBERSHIP_DEACTIVATED, "membership", principalId + ":" + roleId,
                actorId, Map.of());
    }

    public Role deactivateRole(@NonNull Long roleId, UUID actorId) {
        Role role = findRole(roleId);
        if (role.isActive()) {
            role.deactivate(OffsetDateTime.now(clock));
            afterRoleChange(role, PermissionAuditAction.ROLE_DEACTIVATED, actorId, Map.of());
        }
        return role;
    }

    public Role reactivateRole(@NonNull Long roleId, UUID actorId) {
        Role role = findRole(roleId);
        if (!role.isActive()) {
            role.reactivate();
            afterRoleChange(role, PermissionAuditAction.ROLE_REACTIVATED, actorId, Map.of());
        }
        return role;
    }

    public void setModuleAccess(@NonNull Long roleId, String moduleKey, boolean enabled, UUID actorId) {
        Role role = findRole(roleId);
        String module = applyModuleAccess(role, moduleKey, enabled);
        afterRoleChange(role, PermissionAuditAction.MODULE_ACCESS_CHANGED, actorId,
                Map.of("moduleKey", module, "enabled", enabled));
    }

    public void grantModuleCapability(@NonNull Long roleId, String moduleKey, String capabilityKey, UUID actorId) {
        Role role = findRole(roleId);
        if (applyModuleCapability(role, moduleKey, capabilityKey)) {
            afterRoleChange(role, PermissionAuditAction.MODULE_CAPABILITY_GRANTED, actorId,
                    Map.of("moduleKey", moduleKey, "capabilityKey", capabilityKey));
        }
    }

    public void revokeModuleCapability(@NonNull Long roleId, String moduleKey, String capabilityKey, UUID actorId) {
        Role role = findRole(roleId);
        ModulePermission permission = grantCatalogService.requireModulePermission(moduleKey, capabilityKey);
        Optional<RoleModuleGrant> grant = roleModuleGrantRepository.findByRoleAndPermission(role.getId(), permission.getId());
        if (grant.isEmpty()) {
            return;
        }
        roleModuleGrantRepository.delete(grant.get());
        afterRoleChange(role, PermissionAuditAction.MODULE_CAPABILITY_REVOKED, actorId,
                Map.of("moduleKey", permission.getModuleKey(), "capabilityKey", permission.getPermissionKey()));
    }

    public void grantSystemCapability(@NonNull Long roleId, String capabilityKey, UUID actorId) {
        Role role = findRole(roleId);
        if (applySystemCapability(role, capabilityKey)) {
            afterRoleChange(role, PermissionAuditAction.SYSTEM_CAPABILITY_GRANTED, actorId,
                    Map.of("capabilityKey", capabilityKey));
        }
    }

    public void revokeSystemCapability(@NonNull Long roleId, String capabilityKey, UUID actorId) {
        Role role = findRole(roleId);
        SystemPermission permission = grantCatalogService.requireSystemPermission(capabilityKey);
        Optional<RoleSystemGrant> grant = roleSystemGrantRepository.findByRoleAndPermission(role.getId(), permission.getId());
        if (grant.isEmpty()) {
            return;
        }
        roleSystemGrantRepository.delete(grant.get());
        afterRoleChange(role, PermissionAuditAction.SYSTEM_CAPABILITY_REVOKED, actorId,
                Map.of("capabilityKey", permission.getPermissionKey()));
    }

    /**
     * 정규화된 부여 목록을 한 번에 적용한다. 하나라도 카탈로그 검증에 실패하면 전체가 롤백된다.
     *
     * @return 실제로 상태가 바뀐 항목 수
     */
    public int applyGrants(@NonNull Long roleId, List<RoleGrant> grants, UUID actorId) {
        Role role = findRole(roleId);
        int changed = applyAll(role, grants);
        if (changed > 0) {
            afterRoleChange(role, PermissionAuditAction.ROLE_GRANTS_APPLIED, actorId,
                    Map.of("grants", grants.size(), "changed", changed));
        }
        return changed;
    }

    public int importLegacyGrants(@NonNull Long roleId, JsonNode legacyPermissions, UUID actorId) {
        Role role = findRole(roleId);
        List<RoleGrant> grants = legacyRoleGrantImporter.normalize(legacyPermissions);
        int changed = applyAll(role, grants);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("grants", grants.size());
        detail.put("changed", changed);
        afterRoleChange(role, PermissionAuditAction.LEGACY_GRANTS_IMPORTED, actorId, detail);
        log.info("Legacy grants imported (role={}, grants={}, changed={})", roleId, grants.size(), changed);
        return changed;
    }

    private int applyAll(Role role, List<RoleGrant> grants) {
        int changed = 0;
        for (RoleGrant grant : grants) {
            if (grant instanceof RoleGrant.ModuleAccess access) {
                boolean before = moduleAccessToggleRepository.findByRoleAndModule(role.getId(), access.moduleKey())
                        .map(ModuleAccessToggle::isEnabled)
                        .orElse(false);
                applyModuleAccess(role, access.moduleKey(), access.enabled());
                if (before != access.enabled()) {
                    changed++;
                }
            } else if (grant instanceof RoleGrant.ModuleCapability capability) {
                if (applyModuleCapability(role, capability.moduleKey(), capability.capabilityKey())) {
                    changed++;
                }
            } else if (grant instanceof RoleGrant.SystemCapability capability) {
                if (applySystemCapability(role, capability.capabilityKey())) {
                    changed++;
                }
            } else {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "role.unsupported_grant",
                        "지원하지 않는 권한 부여 형식입니다.");
            }
        }
        return changed;
    }

    private String applyModuleAccess(Role role, String moduleKey, boolean enabled) {
        String module = grantCatalogService.requireModule(moduleKey);
        ModuleAccessToggle toggle = moduleAccessToggleRepository.findByRoleAndModule(role.getId(), module)
                .orElseGet(() -> {
                    ModuleAccessToggle created = new ModuleAccessToggle();
                    created.setRole(role);
                    created.setModuleKey(module);
                    return created;
                });
        toggle.setEnabled(enabled);
        moduleAccessToggleRepository.save(toggle);
        return module;
    }

    private boolean applyModuleCapability(Role role, String moduleKey, String capabilityKey) {
        ModulePermission permission = grantCatalogService.requireModulePermission(moduleKey, capabilityKey);
        if (roleModuleGrantRepository.findByRoleAndPermission(role.getId(), permission.getId()).isPresent()) {
            return false;
        }
        roleModuleGrantRepository.save(new RoleModuleGrant(role, permission));
        return true;
    }

    private boolean applySystemCapability(Role role, String capabilityKey) {
        SystemPermission permission = grantCatalogService.requireSystemPermission(capabilityKey);
        if (roleSystemGrantRepository.findByRoleAndPermission(role.getId(), permission.getId()).isPresent()) {
            return false;
        }
        roleSystemGrantRepository.save(new RoleSystemGrant(role, permission));
        return true;
    }

    private void afterRoleChange(Role role, PermissionAuditAction action, UUID actorId, Map<String, Object> detail) {
        List<UUID> affected = membershipRepository.findPrincipalIdsByRoleId(role.getId());
        permissionService.invalidateAll(affected);
        auditService.record(action, "role", String.valueOf(role.getId()), actorId, detail);
    }

    private Role findRole(@NonNull Long roleId) {
        return roleRepository.findWithOrganization(roleId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "role.not_found", "역할을 찾을 수 없습니다."));
    }
}
