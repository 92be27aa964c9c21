package com.mydetail.backend.modules.role.domain;

public record ModuleCapabilityKey(String moduleKey, String capabilityKey) {
}
