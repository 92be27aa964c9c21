package com.mydetail.backend.modules.principal.infrastructure.persistence;

import java.util.UUID;

import com.mydetail.backend.modules.principal.domain.AppPrincipal;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AppPrincipalRepository extends JpaRepository<AppPrincipal, UUID> {
}
