package com.mydetail.backend.modules.permission.presentation;

import com.mydetail.backend.global.security.SecurityUtils;
import com.mydetail.backend.modules.permission.application.PermissionService;
import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;
import com.mydetail.backend.modules.permission.presentation.dto.CapabilityCheckResponse;
import com.mydetail.backend.modules.permission.presentation.dto.PermissionSnapshotResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/permissions/me")
public class PermissionController {

    private final PermissionService permissionService;

    public PermissionController(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    @Operation(summary = "내 권한 스냅샷", description = "세션 시작 시 UI 게이팅에 사용하는 전체 권한 목록을 반환한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "503", description = "권한을 불러오지 못함 (권한 없음으로 처리)")
    })
    @GetMapping
    public PermissionSnapshotResponse getMySnapshot() {
        PermissionSnapshot snapshot = currentSnapshot();
        return PermissionSnapshotResponse.of(snapshot, permissionService.visibleModules(snapshot),
                permissionService.getEmptyModuleVisibility());
    }

    @Operation(summary = "모듈 권한 단건 확인")
    @GetMapping("/modules/{moduleKey}/capabilities/{capabilityKey}")
    public CapabilityCheckResponse checkModuleCapability(@PathVariable String moduleKey, @PathVariable String capabilityKey) {
        boolean granted = permissionService.hasModuleCapability(currentSnapshot(), moduleKey, capabilityKey);
        return new CapabilityCheckResponse(moduleKey, capabilityKey, granted);
    }

    @Operation(summary = "시스템 권한 단건 확인")
    @GetMapping("/system/{capabilityKey}")
    public CapabilityCheckResponse checkSystemCapability(@PathVariable String capabilityKey) {
        boolean granted = permissionService.hasSystemCapability(currentSnapshot(), capabilityKey);
        return new CapabilityCheckResponse(null, capabilityKey, granted);
    }

    @Operation(summary = "모듈 노출 여부 확인")
    @GetMapping("/modules/{moduleKey}/visibility")
    public CapabilityCheckResponse checkModuleVisibility(@PathVariable String moduleKey) {
        boolean visible = permissionService.isModuleVisible(currentSnapshot(), moduleKey);
        return new CapabilityCheckResponse(moduleKey, null, visible);
    }

    private PermissionSnapshot currentSnapshot() {
        return permissionService.resolve(SecurityUtils.getCurrentPrincipalId().toString());
    }
}
