package com.mydetail.backend.modules.role.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.mydetail.backend.modules.role.domain.ModuleAccessToggle;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ModuleAccessToggleRepository extends JpaRepository<ModuleAccessToggle, Long> {

    @Query("""
            select t.moduleKey
              from ModuleAccessToggle t
             where t.role.id = :roleId
               and t.enabled = true
            """)
    List<String> findEnabledModuleKeys(@Param("roleId") Long roleId);

    @Query("select t from ModuleAccessToggle t where t.role.id = :roleId and t.moduleKey = :moduleKey")
    Optional<ModuleAccessToggle> findByRoleAndModule(@Param("roleId") Long roleId, @Param("moduleKey") String moduleKey);
}
