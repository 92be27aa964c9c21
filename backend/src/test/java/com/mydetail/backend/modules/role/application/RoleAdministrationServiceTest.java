package com.mydetail.backend.modules.role.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.mydetail.backend.global.error.ProblemException;
import com.mydetail.backend.modules.audit.application.PermissionAuditService;
import com.mydetail.backend.modules.audit.domain.PermissionAuditAction;
import com.mydetail.backend.modules.catalog.application.GrantCatalogService;
import com.mydetail.backend.modules.catalog.domain.ModulePermission;
import com.mydetail.backend.modules.catalog.domain.SystemPermission;
import com.mydetail.backend.modules.permission.application.PermissionService;
import com.mydetail.backend.modules.principal.domain.AppPrincipal;
import com.mydetail.backend.modules.principal.domain.Organization;
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
import com.mydetail.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class RoleAdministrationServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-01T09:00:00Z");
    private static final UUID PRINCIPAL_ID = UUID.fromString("00000000-0000-0000-0000-000000000801");
    private static final UUID OTHER_PRINCIPAL_ID = UUID.fromString("00000000-0000-0000-0000-000000000802");
    private static final UUID ACTOR_ID = UUID.fromString("00000000-0000-0000-0000-000000000999");
    private static final Long ROLE_ID = 30L;

    @Mock
    private AppPrincipalRepository principalRepository;
    @Mock
    private RoleRepository roleRepository;
    @Mock
    private MembershipRepository membershipRepository;
    @Mock
    private ModuleAccessToggleRepository moduleAccessToggleRepository;
    @Mock
    private RoleModuleGrantRepository roleModuleGrantRepository;
    @Mock
    private RoleSystemGrantRepository roleSystemGrantRepository;
    @Mock
    private GrantCatalogService grantCatalogService;
    @Mock
    private LegacyRoleGrantImporter legacyRoleGrantImporter;
    @Mock
    private PermissionService permissionService;
    @Mock
    private PermissionAuditService auditService;

    private RoleAdministrationService service;
    private AppPrincipal principal;
    private Organization organization;
    private Role role;

    @BeforeEach
    void setUp() {
        service = new RoleAdministrationService(principalRepository, roleRepository, membershipRepository,
                moduleAccessToggleRepository, roleModuleGrantRepository, roleSystemGrantRepository, grantCatalogService,
                legacyRoleGrantImporter, permissionService, auditService, Clock.fixed(NOW, ZoneOffset.UTC));
        principal = TestEntities.principal(PRINCIPAL_ID);
        organization = TestEntities.organization(10L);
        role = TestEntities.role(ROLE_ID, organization, "sales_manager");
    }

    @Test
    @DisplayName("역할 부여는 멤버십을 만들고 해당 사용자 캐시를 무효화한다")
    void assignRole_createsMembership() {
        when(principalRepository.findById(PRINCIPAL_ID)).thenReturn(Optional.of(principal));
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));
        when(membershipRepository.findByPrincipalAndRole(PRINCIPAL_ID, ROLE_ID)).thenReturn(Optional.empty());
        when(membershipRepository.save(any(Membership.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Membership membership = service.assignRole(PRINCIPAL_ID, ROLE_ID, 10L, ACTOR_ID);

        assertThat(membership.isActive()).isTrue();
        assertThat(membership.getOrganization()).isSameAs(organization);
        assertThat(membership.getGrantedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(membership.getGrantedBy()).isEqualTo(ACTOR_ID);
        verify(permissionService).invalidateAll(List.of(PRINCIPAL_ID));
        verify(auditService).record(eq(PermissionAuditAction.MEMBERSHIP_ASSIGNED), eq("membership"),
                eq(PRINCIPAL_ID + ":" + ROLE_ID), eq(ACTOR_ID), anyMap());
    }

    @Test
    @DisplayName("비활성 멤버십이 있으면 새로 만들지 않고 다시 활성화한다")
    void assignRole_reactivatesInactiveMembership() {
        Membership existing = Membership.bind(principal, role, OffsetDateTime.parse("2025-01-01T00:00:00Z"), null);
        existing.deactivate(OffsetDateTime.parse("2025-06-01T00:00:00Z"));
        when(principalRepository.findById(PRINCIPAL_ID)).thenReturn(Optional.of(principal));
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));
        when(membershipRepository.findByPrincipalAndRole(PRINCIPAL_ID, ROLE_ID)).thenReturn(Optional.of(existing));

        Membership membership = service.assignRole(PRINCIPAL_ID, ROLE_ID, null, ACTOR_ID);

        assertThat(membership).isSameAs(existing);
        assertThat(membership.isActive()).isTrue();
        assertThat(membership.getDeactivatedAt()).isNull();
        assertThat(membership.getGrantedBy()).isEqualTo(ACTOR_ID);
        verify(membershipRepository, never()).save(any());
        verify(permissionService).invalidateAll(List.of(PRINCIPAL_ID));
    }

    @Test
    @DisplayName("이미 활성 멤버십이 있으면 409")
    void assignRole_duplicate() {
        Membership existing = Membership.bind(principal, role, OffsetDateTime.parse("2025-01-01T00:00:00Z"), null);
        when(principalRepository.findById(PRINCIPAL_ID)).thenReturn(Optional.of(principal));
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));
        when(membershipRepository.findByPrincipalAndRole(PRINCIPAL_ID, ROLE_ID)).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> service.assignRole(PRINCIPAL_ID, ROLE_ID, null, ACTOR_ID))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "membership.duplicate");
        verifyNoInteractions(permissionService, auditService);
    }

    @Test
    @DisplayName("비활성 역할이나 다른 조직의 역할은 부여할 수 없다")
    void assignRole_rejectsInactiveOrForeignRole() {
        when(principalRepository.findById(PRINCIPAL_ID)).thenReturn(Optional.of(principal));
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));

        assertThatThrownBy(() -> service.assignRole(PRINCIPAL_ID, ROLE_ID, 99L, ACTOR_ID))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "membership.organization_mismatch");

        role.deactivate(OffsetDateTime.parse("2026-01-01T00:00:00Z"));
        assertThatThrownBy(() -> service.assignRole(PRINCIPAL_ID, ROLE_ID, 10L, ACTOR_ID))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "role.inactive");
        verify(membershipRepository, never()).save(any());
    }

    @Test
    @DisplayName("없는 사용자나 역할은 404")
    void assignRole_notFound() {
        when(principalRepository.findById(PRINCIPAL_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.assignRole(PRINCIPAL_ID, ROLE_ID, null, ACTOR_ID))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "principal.not_found");

        when(roleRepository.findWithOrganization(77L)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> service.deactivateRole(77L, ACTOR_ID))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "role.not_found");
    }

    @Test
    @DisplayName("이미 비활성인 멤버십 회수는 아무 일도 하지 않는다")
    void deactivateMembership_isIdempotent() {
        Membership existing = Membership.bind(principal, role, OffsetDateTime.parse("2025-01-01T00:00:00Z"), null);
        when(membershipRepository.findByPrincipalAndRole(PRINCIPAL_ID, ROLE_ID)).thenReturn(Optional.of(existing));

        service.deactivateMembership(PRINCIPAL_ID, ROLE_ID, ACTOR_ID);
        service.deactivateMembership(PRINCIPAL_ID, ROLE_ID, ACTOR_ID);

        assertThat(existing.isActive()).isFalse();
        verify(permissionService).invalidateAll(List.of(PRINCIPAL_ID));
        verify(auditService).record(eq(PermissionAuditAction.MEMBERSHIP_DEACTIVATED), eq("membership"),
                anyString(), eq(ACTOR_ID), anyMap());
    }

    @Test
    @DisplayName("역할 비활성화는 그 역할을 가진 모든 사용자의 캐시를 무효화한다")
    void deactivateRole_invalidatesEveryHolder() {
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));
        when(membershipRepository.findPrincipalIdsByRoleId(ROLE_ID)).thenReturn(List.of(PRINCIPAL_ID, OTHER_PRINCIPAL_ID));

        Role result = service.deactivateRole(ROLE_ID, ACTOR_ID);
        service.deactivateRole(ROLE_ID, ACTOR_ID);

        assertThat(result.isActive()).isFalse();
        verify(permissionService).invalidateAll(List.of(PRINCIPAL_ID, OTHER_PRINCIPAL_ID));
        verify(auditService).record(eq(PermissionAuditAction.ROLE_DEACTIVATED), eq("role"), eq("30"), eq(ACTOR_ID), anyMap());
    }

    @Test
    @DisplayName("모듈 노출 설정은 토글 행이 없으면 새로 만든다")
    void setModuleAccess_createsToggle() {
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));
        when(grantCatalogService.requireModule("sales_orders")).thenReturn("sales_orders");
        when(moduleAccessToggleRepository.findByRoleAndModule(ROLE_ID, "sales_orders")).thenReturn(Optional.empty());
        when(membershipRepository.findPrincipalIdsByRoleId(ROLE_ID)).thenReturn(List.of(PRINCIPAL_ID));

        service.setModuleAccess(ROLE_ID, "sales_orders", true, ACTOR_ID);

        ArgumentCaptor<ModuleAccessToggle> captor = ArgumentCaptor.forClass(ModuleAccessToggle.class);
        verify(moduleAccessToggleRepository).save(captor.capture());
        assertThat(captor.getValue().getRole()).isSameAs(role);
        assertThat(captor.getValue().getModuleKey()).isEqualTo("sales_orders");
        assertThat(captor.getValue().isEnabled()).isTrue();
        verify(permissionService).invalidateAll(List.of(PRINCIPAL_ID));
        verify(auditService).record(PermissionAuditAction.MODULE_ACCESS_CHANGED, "role", "30", ACTOR_ID,
                Map.of("moduleKey", "sales_orders", "enabled", true));
    }

    @Test
    @DisplayName("이미 있는 모듈 권한 부여는 변경도 무효화도 없다")
    void grantModuleCapability_isIdempotent() {
        ModulePermission permission = TestEntities.modulePermission(5L, "sales_orders", "view_orders");
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));
        when(grantCatalogService.requireModulePermission("sales_orders", "view_orders")).thenReturn(permission);
        when(roleModuleGrantRepository.findByRoleAndPermission(ROLE_ID, 5L))
                .thenReturn(Optional.of(new RoleModuleGrant(role, permission)));

        service.grantModuleCapability(ROLE_ID, "sales_orders", "view_orders", ACTOR_ID);

        verify(roleModuleGrantRepository, never()).save(any());
        verifyNoInteractions(permissionService, auditService);
    }

    @Test
    @DisplayName("시스템 권한 회수는 부여 행을 지우고 보유자 캐시를 무효화한다")
    void revokeSystemCapability_deletesGrant() {
        SystemPermission permission = TestEntities.systemPermission(3L, "manage_roles");
        RoleSystemGrant grant = new RoleSystemGrant(role, permission);
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));
        when(grantCatalogService.requireSystemPermission("manage_roles")).thenReturn(permission);
        when(roleSystemGrantRepository.findByRoleAndPermission(ROLE_ID, 3L)).thenReturn(Optional.of(grant));
        when(membershipRepository.findPrincipalIdsByRoleId(ROLE_ID)).thenReturn(List.of(PRINCIPAL_ID));

        service.revokeSystemCapability(ROLE_ID, "manage_roles", ACTOR_ID);

        verify(roleSystemGrantRepository).delete(grant);
        verify(permissionService).invalidateAll(List.of(PRINCIPAL_ID));
    }

    @Test
    @DisplayName("일괄 적용은 실제로 바뀐 항목 수만 센다")
    void applyGrants_countsOnlyChanges() {
        ModulePermission viewOrders = TestEntities.modulePermission(5L, "sales_orders", "view_orders");
        SystemPermission manageRoles = TestEntities.systemPermission(3L, "manage_roles");
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));
        when(grantCatalogService.requireModule("sales_orders")).thenReturn("sales_orders");
        when(moduleAccessToggleRepository.findByRoleAndModule(ROLE_ID, "sales_orders")).thenReturn(Optional.empty());
        when(grantCatalogService.requireModulePermission("sales_orders", "view_orders")).thenReturn(viewOrders);
        when(roleModuleGrantRepository.findByRoleAndPermission(ROLE_ID, 5L)).thenReturn(Optional.empty());
        when(grantCatalogService.requireSystemPermission("manage_roles")).thenReturn(manageRoles);
        when(roleSystemGrantRepository.findByRoleAndPermission(ROLE_ID, 3L))
                .thenReturn(Optional.of(new RoleSystemGrant(role, manageRoles)));
        when(membershipRepository.findPrincipalIdsByRoleId(ROLE_ID)).thenReturn(List.of(PRINCIPAL_ID));

        int changed = service.applyGrants(ROLE_ID, List.of(
                new RoleGrant.ModuleAccess("sales_orders", true),
                new RoleGrant.ModuleCapability("sales_orders", "view_orders"),
                new RoleGrant.SystemCapability("manage_roles")), ACTOR_ID);

        assertThat(changed).isEqualTo(2);
        verify(roleModuleGrantRepository).save(any(RoleModuleGrant.class));
        verify(roleSystemGrantRepository, never()).save(any());
        verify(auditService).record(eq(PermissionAuditAction.ROLE_GRANTS_APPLIED), eq("role"), eq("30"), eq(ACTOR_ID), anyMap());
    }

    @Test
    @DisplayName("카탈로그 검증 실패는 그대로 전파되어 트랜잭션을 롤백시킨다")
    void applyGrants_propagatesCatalogFailure() {
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));
        when(grantCatalogService.requireSystemPermission("launch_rockets"))
                .thenThrow(new ProblemException(HttpStatus.BAD_REQUEST, "catalog.unknown_system_capability"));

        assertThatThrownBy(() -> service.applyGrants(ROLE_ID,
                List.of(new RoleGrant.SystemCapability("launch_rockets")), ACTOR_ID))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "catalog.unknown_system_capability");
        verifyNoInteractions(permissionService, auditService);
    }

    @Test
    @DisplayName("레거시 가져오기는 변경이 없어도 감사 이벤트를 남긴다")
    void importLegacyGrants_auditsEvenWithoutChanges() {
        JsonNode legacy = JsonNodeFactory.instance.objectNode();
        when(roleRepository.findWithOrganization(ROLE_ID)).thenReturn(Optional.of(role));
        when(legacyRoleGrantImporter.normalize(legacy)).thenReturn(List.of());
        when(membershipRepository.findPrincipalIdsByRoleId(ROLE_ID)).thenReturn(List.of());

        int changed = service.importLegacyGrants(ROLE_ID, legacy, ACTOR_ID);

        assertThat(changed).isZero();
        verify(permissionService).invalidateAll(List.of());
        verify(auditService).record(eq(PermissionAuditAction.LEGACY_GRANTS_IMPORTED), eq("role"), eq("30"), eq(ACTOR_ID), anyMap());
    }
}
