package com.mydetail.backend.modules.role.domain;

import java.util.UUID;

/**
 * 활성 멤버십 + 활성 역할 조인 결과 한 건.
 */
public record BoundRole(UUID membershipId, Long organizationId, Long roleId, String roleKey, String displayName) {
}
