package com.mydetail.backend.support;

import java.lang.reflect.Field;
import java.util.UUID;

import com.mydetail.backend.modules.catalog.domain.ModulePermission;
import com.mydetail.backend.modules.catalog.domain.SystemPermission;
import com.mydetail.backend.modules.principal.domain.AppPrincipal;
import com.mydetail.backend.modules.principal.domain.Organization;
import com.mydetail.backend.modules.role.domain.Role;

/**
 * 단위 테스트용 엔티티 생성기. 식별자는 JPA 가 채우는 필드라 리플렉션으로 직접 넣는다.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static AppPrincipal principal(UUID id) {
        AppPrincipal principal = new AppPrincipal();
        principal.setEmail(id + "@mydetail.test");
        principal.setDisplayName("user-" + id.toString().substring(0, 8));
        setId(principal, id);
        return principal;
    }

    public static Organization organization(Long id) {
        Organization organization = new Organization();
        organization.setName("dealer-" + id);
        setId(organization, id);
        return organization;
    }

    public static Role role(Long id, Organization organization, String roleKey) {
        Role role = new Role();
        role.setOrganization(organization);
        role.setRoleKey(roleKey);
        role.setDisplayName(roleKey);
        setId(role, id);
        return role;
    }

    public static ModulePermission modulePermission(Long id, String moduleKey, String permissionKey) {
        ModulePermission permission = new ModulePermission();
        permission.setModuleKey(moduleKey);
        permission.setPermissionKey(permissionKey);
        permission.setDisplayName(permissionKey);
        setId(permission, id);
        return permission;
    }

    public static SystemPermission systemPermission(Long id, String permissionKey) {
        SystemPermission permission = new SystemPermission();
        permission.setPermissionKey(permissionKey);
        permission.setDisplayName(permissionKey);
        setId(permission, id);
        return permission;
    }

    public static void setId(Object entity, Object id) {
        try {
            Field idField = entity.getClass().getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(entity, id);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
