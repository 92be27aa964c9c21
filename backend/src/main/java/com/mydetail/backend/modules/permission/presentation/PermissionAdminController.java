package com.mydetail.backend.modules.permission.presentation;

import java.util.Map;

import com.mydetail.backend.global.security.SecurityUtils;
import com.mydetail.backend.modules.audit.application.PermissionAuditService;
import com.mydetail.backend.modules.audit.domain.PermissionAuditAction;
import com.mydetail.backend.modules.permission.application.PermissionService;
import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;
import com.mydetail.backend.modules.permission.presentation.dto.PermissionDiagnosticsResponse;
import com.mydetail.backend.modules.permission.presentation.dto.PermissionSnapshotResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/principals/{principalId}/permissions")
@PreAuthorize("@permissionGuard.hasSystemCapability('manage_roles')")
public class PermissionAdminController {

    private final PermissionService permissionService;
    private final PermissionAuditService auditService;

    public PermissionAdminController(PermissionService permissionService, PermissionAuditService auditService) {
        this.permissionService = permissionService;
        this.auditService = auditService;
    }

    @Operation(summary = "사용자 권한 스냅샷 조회", description = "fresh=true 이면 캐시를 거치지 않고 다시 계산한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "400", description = "잘못된 사용자 식별자"),
            @ApiResponse(responseCode = "403", description = "manage_roles 권한 필요")
    })
    @GetMapping
    public PermissionDiagnosticsResponse getSnapshot(@PathVariable String principalId,
                                                     @RequestParam(name = "fresh", defaultValue = "false") boolean fresh) {
        PermissionSnapshot snapshot = fresh
                ? permissionService.resolveUncached(principalId)
                : permissionService.resolve(principalId);
        PermissionSnapshotResponse body = PermissionSnapshotResponse.of(snapshot,
                permissionService.visibleModules(snapshot), permissionService.getEmptyModuleVisibility());
        return PermissionDiagnosticsResponse.of(snapshot, body);
    }

    @Operation(summary = "사용자 권한 캐시 무효화")
    @DeleteMapping("/cache")
    public ResponseEntity<Void> invalidate(@PathVariable String principalId) {
        permissionService.invalidate(principalId);
        auditService.record(PermissionAuditAction.SNAPSHOT_INVALIDATED, "principal", principalId,
                SecurityUtils.getCurrentPrincipalId(), Map.of());
        return ResponseEntity.noContent().build();
    }
}
