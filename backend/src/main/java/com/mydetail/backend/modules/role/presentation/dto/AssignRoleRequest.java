package com.mydetail.backend.modules.role.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record AssignRoleRequest(
        @NotNull UUID principalId,
        Long organizationId
) {
}
