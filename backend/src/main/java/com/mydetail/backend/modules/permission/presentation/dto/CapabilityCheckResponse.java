package com.mydetail.backend.modules.permission.presentation.dto;

public record CapabilityCheckResponse(String moduleKey, String capabilityKey, boolean granted) {
}
