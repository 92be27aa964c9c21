package com.mydetail.backend.modules.role.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.mydetail.backend.modules.role.domain.RoleSystemGrant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleSystemGrantRepository extends JpaRepository<RoleSystemGrant, Long> {

    @Query("""
            select sp.permissionKey
              from RoleSystemGrant g
              join g.systemPermission sp
             where g.role.id = :roleId
            """)
    List<String> findCapabilityKeys(@Param("roleId") Long roleId);

    @Query("""
            select g
              from RoleSystemGrant g
             where g.role.id = :roleId
               and g.systemPermission.id = :permissionId
            """)
    Optional<RoleSystemGrant> findByRoleAndPermission(@Param("roleId") Long roleId, @Param("permissionId") Long permissionId);
}
