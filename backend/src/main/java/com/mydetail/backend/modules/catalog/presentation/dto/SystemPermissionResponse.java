package com.mydetail.backend.modules.catalog.presentation.dto;

import com.mydetail.backend.modules.catalog.domain.SystemPermission;

public record SystemPermissionResponse(String permissionKey, String displayName, String description, String category) {

    public static SystemPermissionResponse from(SystemPermission permission) {
        return new SystemPermissionResponse(
                permission.getPermissionKey(),
                permission.getDisplayName(),
                permission.getDescription(),
                permission.getCategory()
        );
    }
}
