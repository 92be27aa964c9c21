package com.mydetail.backend.modules.catalog.presentation.dto;

import com.mydetail.backend.modules.catalog.domain.ModulePermission;

public record ModulePermissionResponse(String moduleKey, String permissionKey, String displayName, String description) {

    public static ModulePermissionResponse from(ModulePermission permission) {
        return new ModulePermissionResponse(
                permission.getModuleKey(),
                permission.getPermissionKey(),
                permission.getDisplayName(),
                permission.getDescription()
        );
    }
}
