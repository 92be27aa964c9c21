package com.mydetail.backend.modules.role.infrastructure.persistence;

import java.util.Optional;

import com.mydetail.backend.modules.role.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, Long> {

    @Query("""
            select r
              from Role r
              join fetch r.organization
             where r.id = :roleId
            """)
    Optional<Role> findWithOrganization(@Param("roleId") Long roleId);
}
