package com.mydetail.backend.support;

import java.util.UUID;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 통합 테스트용 역할 데이터 작성기. 권한 키는 Flyway 로 시드된 카탈로그를 참조한다.
 */
public class PermissionFixtures {

    private final JdbcTemplate jdbcTemplate;

    public PermissionFixtures(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Long organization(String name) {
        return jdbcTemplate.queryForObject("INSERT INTO organization (name) VALUES (?) RETURNING id", Long.class, name);
    }

    public UUID principal(String email) {
        return principal(email, false, false);
    }

    public UUID principal(String email, boolean superAdmin, boolean supermanager) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("""
                INSERT INTO app_principal (id, email, display_name, is_super_admin, is_supermanager)
                VALUES (?, ?, ?, ?, ?)
                """, id, email, email, superAdmin, supermanager);
        return id;
    }

    public Long role(Long organizationId, String roleKey) {
        return jdbcTemplate.queryForObject("""
                INSERT INTO role (organization_id, role_key, display_name) VALUES (?, ?, ?) RETURNING id
                """, Long.class, organizationId, roleKey, roleKey);
    }

    public UUID bind(UUID principalId, Long organizationId, Long roleId) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("""
                INSERT INTO membership (id, principal_id, organization_id, role_id) VALUES (?, ?, ?, ?)
                """, id, principalId, organizationId, roleId);
        return id;
    }

    public void deactivateMembership(UUID membershipId) {
        jdbcTemplate.update("UPDATE membership SET is_active = FALSE, deactivated_at = now() WHERE id = ?", membershipId);
    }

    public void enableModule(Long roleId, String moduleKey) {
        jdbcTemplate.update("""
                INSERT INTO role_module_access (role_id, module_key, is_enabled) VALUES (?, ?, TRUE)
                ON CONFLICT (role_id, module_key) DO UPDATE SET is_enabled = TRUE
                """, roleId, moduleKey);
    }

    public void grantModule(Long roleId, String moduleKey, String capabilityKey) {
        int inserted = jdbcTemplate.update("""
                INSERT INTO role_module_grant (role_id, module_permission_id)
                SELECT ?, mp.id FROM module_permission mp WHERE mp.module_key = ? AND mp.permission_key = ?
                """, roleId, moduleKey, capabilityKey);
        requireCatalogEntry(inserted, moduleKey + ":" + capabilityKey);
    }

    public void grantSystem(Long roleId, String capabilityKey) {
        int inserted = jdbcTemplate.update("""
                INSERT INTO role_system_grant (role_id, system_permission_id)
                SELECT ?, sp.id FROM system_permission sp WHERE sp.permission_key = ?
                """, roleId, capabilityKey);
        requireCatalogEntry(inserted, capabilityKey);
    }

    private static void requireCatalogEntry(int inserted, String key) {
        if (inserted != 1) {
            throw new IllegalStateException("catalog entry missing: " + key);
        }
    }
}
