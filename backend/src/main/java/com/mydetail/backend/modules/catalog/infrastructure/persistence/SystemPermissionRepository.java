package com.mydetail.backend.modules.catalog.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.mydetail.backend.modules.catalog.domain.SystemPermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface SystemPermissionRepository extends JpaRepository<SystemPermission, Long> {

    Optional<SystemPermission> findByPermissionKey(String permissionKey);

    @Query("select sp from SystemPermission sp order by sp.category, sp.permissionKey")
    List<SystemPermission> findAllOrdered();
}
