package com.mydetail.backend.modules.permission.domain;

import java.util.Comparator;

import com.mydetail.backend.modules.role.domain.BoundRole;

public record RoleDescriptor(Long roleId, String roleKey, String displayName, Long organizationId) {

    static final Comparator<RoleDescriptor> ORDER = Comparator
            .comparing(RoleDescriptor::organizationId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(RoleDescriptor::roleId, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static RoleDescriptor from(BoundRole boundRole) {
        return new RoleDescriptor(boundRole.roleId(), boundRole.roleKey(), boundRole.displayName(), boundRole.organizationId());
    }
}
