package com.mydetail.backend.modules.role.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record ModuleAccessRequest(@NotNull Boolean enabled) {
}
