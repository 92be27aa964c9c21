package com.mydetail.backend.modules.role.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.mydetail.backend.modules.role.domain.ModuleCapabilityKey;
import com.mydetail.backend.modules.role.domain.RoleModuleGrant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleModuleGrantRepository extends JpaRepository<RoleModuleGrant, Long> {

    /**
     * 활성화된 모듈의 권한만 조회한다. moduleKeys 가 비어 있으면 호출하지 않는다.
     */
    @Query("""
            select new com.mydetail.backend.modules.role.domain.ModuleCapabilityKey(mp.moduleKey, mp.permissionKey)
              from RoleModuleGrant g
              join g.modulePermission mp
             where g.role.id = :roleId
               and mp.moduleKey in :moduleKeys
            """)
    List<ModuleCapabilityKey> findCapabilitiesInModules(@Param("roleId") Long roleId,
                                                        @Param("moduleKeys") Collection<String> moduleKeys);

    @Query("""
            select g
              from RoleModuleGrant g
             where g.role.id = :roleId
               and g.modulePermission.id = :permissionId
            """)
    Optional<RoleModuleGrant> findByRoleAndPermission(@Param("roleId") Long roleId, @Param("permissionId") Long permissionId);
}
