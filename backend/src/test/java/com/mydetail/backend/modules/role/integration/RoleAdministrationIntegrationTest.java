package com.mydetail.backend.modules.role.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mydetail.backend.global.error.ProblemException;
import com.mydetail.backend.modules.permission.application.PermissionService;
import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;
import com.mydetail.backend.modules.role.application.RoleAdministrationService;
import com.mydetail.backend.modules.role.domain.Membership;
import com.mydetail.backend.modules.role.domain.RoleGrant;
import com.mydetail.backend.support.AbstractPostgresIntegrationTest;
import com.mydetail.backend.support.PermissionFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class RoleAdministrationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private RoleAdministrationService roleAdministrationService;

    @Autowired
    private PermissionService permissionService;

    @Autowired
    private ObjectMapper objectMapper;

    private PermissionFixtures fixtures;
    private Long dealershipId;
    private Long roleId;
    private UUID principalId;

    @BeforeEach
    void setUp() {
        fixtures = new PermissionFixtures(jdbcTemplate);
        dealershipId = fixtures.organization("Land Rover Nashua");
        roleId = fixtures.role(dealershipId, "lot_manager");
        principalId = fixtures.principal("lot@mydetail.test");
    }

    @Test
    @DisplayName("레거시 문서를 가져오면 카탈로그 기준으로 레벨이 풀리고 보유자 스냅샷에 바로 반영된다")
    void importLegacyGrants() throws Exception {
        roleAdministrationService.assignRole(principalId, roleId, dealershipId, null);
        assertThat(permissionService.resolve(principalId.toString()).getModuleCapabilities()).isEmpty();

        int changed = roleAdministrationService.importLegacyGrants(roleId, objectMapper.readTree("""
                {
                  "sales_orders": "view",
                  "stock": "edit",
                  "reports": "none",
                  "can_access_internal_notes": true,
                  "can_export_reports": true,
                  "system": ["view_audit_logs"]
                }
                """), null);

        PermissionSnapshot snapshot = permissionService.resolve(principalId.toString());
        assertThat(changed).isPositive();
        assertThat(snapshot.getModuleCapabilities()).containsOnlyKeys("sales_orders", "stock");
        assertThat(snapshot.getModuleCapabilities().get("sales_orders"))
                .containsExactly("access_internal_notes", "view_customer_info", "view_orders", "view_pricing");
        assertThat(snapshot.getModuleCapabilities().get("stock"))
                .contains("view_inventory", "add_vehicles", "edit_vehicles", "edit_pricing")
                .doesNotContain("delete_vehicles", "export_data");
        assertThat(snapshot.getSystemCapabilities()).containsExactly("view_audit_logs");

        int reimported = roleAdministrationService.importLegacyGrants(roleId, objectMapper.readTree("""
                {"sales_orders": "view"}
                """), null);
        assertThat(reimported).isZero();
    }

    @Test
    @DisplayName("일괄 적용 중 하나라도 카탈로그에 없으면 아무것도 저장되지 않는다")
    void applyGrantsRollsBackOnUnknownKey() {
        assertThatThrownBy(() -> roleAdministrationService.applyGrants(roleId, List.of(
                new RoleGrant.ModuleAccess("sales_orders", true),
                new RoleGrant.ModuleCapability("sales_orders", "view_orders"),
                new RoleGrant.SystemCapability("launch_rockets")), null))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "catalog.unknown_system_capability");

        Integer toggles = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM role_module_access WHERE role_id = ?", Integer.class, roleId);
        Integer grants = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM role_module_grant WHERE role_id = ?", Integer.class, roleId);
        assertThat(toggles).isZero();
        assertThat(grants).isZero();
    }

    @Test
    @DisplayName("회수한 멤버십을 다시 부여하면 같은 행이 재활성화된다")
    void reassignReactivatesMembership() {
        Membership first = roleAdministrationService.assignRole(principalId, roleId, null, null);
        roleAdministrationService.deactivateMembership(principalId, roleId, null);

        Membership second = roleAdministrationService.assignRole(principalId, roleId, null, null);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.isActive()).isTrue();
        assertThatThrownBy(() -> roleAdministrationService.assignRole(principalId, roleId, null, null))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "membership.duplicate");
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM membership WHERE principal_id = ?", Integer.class, principalId);
        assertThat(rows).isEqualTo(1);
    }
}
