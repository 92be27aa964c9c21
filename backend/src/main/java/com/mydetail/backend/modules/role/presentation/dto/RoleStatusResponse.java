package com.mydetail.backend.modules.role.presentation.dto;

import java.time.OffsetDateTime;

import com.mydetail.backend.modules.role.domain.Role;

public record RoleStatusResponse(Long roleId, String roleKey, Long organizationId, boolean active, OffsetDateTime deactivatedAt) {

    public static RoleStatusResponse from(Role role) {
        return new RoleStatusResponse(role.getId(), role.getRoleKey(), role.getOrganization().getId(),
                role.isActive(), role.getDeactivatedAt());
    }
}
