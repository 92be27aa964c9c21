package com.mydetail.backend.modules.role.presentation.dto;

public record GrantChangeResponse(Long roleId, int changed) {
}
