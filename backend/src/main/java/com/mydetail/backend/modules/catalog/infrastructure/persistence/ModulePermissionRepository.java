package com.mydetail.backend.modules.catalog.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.mydetail.backend.modules.catalog.domain.ModulePermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ModulePermissionRepository extends JpaRepository<ModulePermission, Long> {

    Optional<ModulePermission> findByModuleKeyAndPermissionKey(String moduleKey, String permissionKey);

    @Query("""
            select mp
              from ModulePermission mp
             where (:moduleKey is null or mp.moduleKey = :moduleKey)
             order by mp.moduleKey, mp.permissionKey
            """)
    List<ModulePermission> findAllOrdered(@Param("moduleKey") String moduleKey);

    @Query("select distinct mp.moduleKey from ModulePermission mp order by mp.moduleKey")
    List<String> findModuleKeys();

    boolean existsByModuleKey(String moduleKey);
}
