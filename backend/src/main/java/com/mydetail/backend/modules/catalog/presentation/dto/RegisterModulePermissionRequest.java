package com.mydetail.backend.modules.catalog.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterModulePermissionRequest(
        @NotBlank @Size(max = 64) String moduleKey,
        @NotBlank @Size(max = 64) String permissionKey,
        @NotBlank @Size(max = 120) String displayName,
        @Size(max = 500) String description
) {
}
