package com.mydetail.backend.modules.permission.presentation.dto;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import com.mydetail.backend.modules.permission.domain.ModuleVisibilityPolicy;
import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;
import com.mydetail.backend.modules.permission.domain.RoleDescriptor;

/**
 * UI 게이팅용 스냅샷 응답. 해석 경로 같은 진단 필드는 관리자 응답에만 싣는다.
 */
public record PermissionSnapshotResponse(
        String principalId,
        boolean unrestricted,
        SortedSet<String> systemCapabilities,
        Map<String, SortedSet<String>> moduleCapabilities,
        List<String> visibleModules,
        ModuleVisibilityPolicy emptyModuleVisibility,
        List<RoleDescriptor> roles
) {

    public static PermissionSnapshotResponse of(PermissionSnapshot snapshot, List<String> visibleModules,
                                                ModuleVisibilityPolicy policy) {
        return new PermissionSnapshotResponse(
                snapshot.getPrincipalId(),
                snapshot.isUnrestricted(),
                snapshot.getSystemCapabilities(),
                snapshot.getModuleCapabilities(),
                visibleModules,
                policy,
                snapshot.getRoles()
        );
    }
}
