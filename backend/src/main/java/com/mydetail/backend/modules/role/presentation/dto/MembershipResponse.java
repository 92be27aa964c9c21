package com.mydetail.backend.modules.role.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mydetail.backend.modules.role.domain.Membership;

public record MembershipResponse(
        UUID membershipId,
        UUID principalId,
        Long organizationId,
        Long roleId,
        boolean active,
        OffsetDateTime grantedAt,
        UUID grantedBy
) {

    public static MembershipResponse from(Membership membership) {
        return new MembershipResponse(
                membership.getId(),
                membership.getPrincipal().getId(),
                membership.getOrganization().getId(),
                membership.getRole().getId(),
                membership.isActive(),
                membership.getGrantedAt(),
                membership.getGrantedBy()
        );
    }
}
