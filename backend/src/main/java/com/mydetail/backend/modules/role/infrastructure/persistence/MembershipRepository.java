package com.mydetail.backend.modules.role.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.mydetail.backend.modules.role.domain.BoundRole;
import com.mydetail.backend.modules.role.domain.Membership;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MembershipRepository extends JpaRepository<Membership, UUID> {

    /**
     * 멤버십과 역할이 모두 활성이고 같은 조직에 속한 바인딩만 돌려준다.
     */
    @Query("""
            select new com.mydetail.backend.modules.role.domain.BoundRole(
                       m.id, m.organization.id, r.id, r.roleKey, r.displayName)
              from Membership m
              join m.role r
             where m.principal.id = :principalId
               and m.active = true
               and r.active = true
               and r.organization.id = m.organization.id
            """)
    List<BoundRole> findBoundRoles(@Param("principalId") UUID principalId);

    @Query("""
            select m
              from Membership m
             where m.principal.id = :principalId
               and m.role.id = :roleId
            """)
    Optional<Membership> findByPrincipalAndRole(@Param("principalId") UUID principalId, @Param("roleId") Long roleId);

    @Query("select distinct m.principal.id from Membership m where m.role.id = :roleId")
    List<UUID> findPrincipalIdsByRoleId(@Param("roleId") Long roleId);
}
