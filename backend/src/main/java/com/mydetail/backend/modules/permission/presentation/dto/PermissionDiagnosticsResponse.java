package com.mydetail.backend.modules.permission.presentation.dto;

import java.util.SortedSet;

import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;
import com.mydetail.backend.modules.permission.domain.ResolutionPath;

public record PermissionDiagnosticsResponse(
        PermissionSnapshotResponse snapshot,
        ResolutionPath resolutionPath,
        SortedSet<Long> degradedRoleIds
) {

    public static PermissionDiagnosticsResponse of(PermissionSnapshot snapshot, PermissionSnapshotResponse body) {
        return new PermissionDiagnosticsResponse(body, snapshot.getResolutionPath(), snapshot.getDegradedRoleIds());
    }
}
