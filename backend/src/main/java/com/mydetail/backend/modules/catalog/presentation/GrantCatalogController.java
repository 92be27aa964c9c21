package com.mydetail.backend.modules.catalog.presentation;

import java.util.List;

import com.mydetail.backend.modules.catalog.application.GrantCatalogService;
import com.mydetail.backend.modules.catalog.application.GrantCatalogService.RegisterModulePermissionCommand;
import com.mydetail.backend.modules.catalog.application.GrantCatalogService.RegisterSystemPermissionCommand;
import com.mydetail.backend.modules.catalog.domain.ModulePermission;
import com.mydetail.backend.modules.catalog.domain.SystemPermission;
import com.mydetail.backend.modules.catalog.presentation.dto.ModulePermissionResponse;
import com.mydetail.backend.modules.catalog.presentation.dto.RegisterModulePermissionRequest;
import com.mydetail.backend.modules.catalog.presentation.dto.RegisterSystemPermissionRequest;
import com.mydetail.backend.modules.catalog.presentation.dto.SystemPermissionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class GrantCatalogController {

    private final GrantCatalogService grantCatalogService;

    public GrantCatalogController(GrantCatalogService grantCatalogService) {
        this.grantCatalogService = grantCatalogService;
    }

    @Operation(summary = "시스템 권한 카탈로그 조회")
    @GetMapping("/catalog/system-permissions")
    public List<SystemPermissionResponse> listSystemPermissions() {
        return grantCatalogService.listSystemPermissions().stream()
                .map(SystemPermissionResponse::from)
                .toList();
    }

    @Operation(summary = "모듈 권한 카탈로그 조회", description = "module 파라미터로 특정 모듈만 조회할 수 있다.")
    @GetMapping("/catalog/module-permissions")
    public List<ModulePermissionResponse> listModulePermissions(@RequestParam(name = "module", required = false) String moduleKey) {
        return grantCatalogService.listModulePermissions(moduleKey).stream()
                .map(ModulePermissionResponse::from)
                .toList();
    }

    @Operation(summary = "시스템 권한 등록/수정")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "등록 성공"),
            @ApiResponse(responseCode = "400", description = "키 형식 오류"),
            @ApiResponse(responseCode = "403", description = "manage_all_settings 권한 필요")
    })
    @PreAuthorize("@permissionGuard.hasSystemCapability('manage_all_settings')")
    @PostMapping("/admin/catalog/system-permissions")
    public ResponseEntity<SystemPermissionResponse> registerSystemPermission(@Valid @RequestBody RegisterSystemPermissionRequest request) {
        SystemPermission saved = grantCatalogService.registerSystemPermission(new RegisterSystemPermissionCommand(
                request.permissionKey(), request.displayName(), request.description(), request.category()));
        return ResponseEntity.ok(SystemPermissionResponse.from(saved));
    }

    @Operation(summary = "모듈 권한 등록/수정")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "등록 성공"),
            @ApiResponse(responseCode = "400", description = "키 형식 오류"),
            @ApiResponse(responseCode = "403", description = "manage_all_settings 권한 필요")
    })
    @PreAuthorize("@permissionGuard.hasSystemCapability('manage_all_settings')")
    @PostMapping("/admin/catalog/module-permissions")
    public ResponseEntity<ModulePermissionResponse> registerModulePermission(@Valid @RequestBody RegisterModulePermissionRequest request) {
        ModulePermission saved = grantCatalogService.registerModulePermission(new RegisterModulePermissionCommand(
                request.moduleKey(), request.permissionKey(), request.displayName(), request.description()));
        return ResponseEntity.ok(ModulePermissionResponse.from(saved));
    }
}
