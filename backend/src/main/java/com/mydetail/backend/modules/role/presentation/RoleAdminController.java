package com.mydetail.backend.modules.role.presentation;

import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.mydetail.backend.global.error.ProblemException;
import com.mydetail.backend.global.security.SecurityUtils;
import com.mydetail.backend.modules.role.application.RoleAdministrationService;
import com.mydetail.backend.modules.role.domain.Membership;
import com.mydetail.backend.modules.role.domain.RoleGrant;
import com.mydetail.backend.modules.role.presentation.dto.AssignRoleRequest;
import com.mydetail.backend.modules.role.presentation.dto.GrantChangeResponse;
import com.mydetail.backend.modules.role.presentation.dto.MembershipResponse;
import com.mydetail.backend.modules.role.presentation.dto.ModuleAccessRequest;
import com.mydetail.backend.modules.role.presentation.dto.RoleGrantRequest;
import com.mydetail.backend.modules.role.presentation.dto.RoleStatusResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/roles/{roleId}")
@PreAuthorize("@permissionGuard.hasSystemCapability('manage_roles')")
public class RoleAdminController {

    private final RoleAdministrationService roleAdministrationService;

    public RoleAdminController(RoleAdministrationService roleAdministrationService) {
        this.roleAdministrationService = roleAdministrationService;
    }

    @Operation(summary = "역할 부여", description = "비활성 멤버십이 있으면 다시 활성화한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "부여 성공"),
            @ApiResponse(responseCode = "404", description = "사용자 또는 역할 없음"),
            @ApiResponse(responseCode = "409", description = "이미 부여되었거나 비활성 역할")
    })
    @PostMapping("/memberships")
    public ResponseEntity<MembershipResponse> assignRole(@PathVariable Long roleId, @Valid @RequestBody AssignRoleRequest request) {
        Membership membership = roleAdministrationService.assignRole(request.principalId(), roleId,
                request.organizationId(), currentActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(MembershipResponse.from(membership));
    }

    @Operation(summary = "역할 회수 (멤버십 비활성화)")
    @DeleteMapping("/memberships/{principalId}")
    public ResponseEntity<Void> deactivateMembership(@PathVariable Long roleId, @PathVariable UUID principalId) {
        roleAdministrationService.deactivateMembership(principalId, roleId, currentActor());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "역할 비활성화")
    @PostMapping("/deactivate")
    public RoleStatusResponse deactivateRole(@PathVariable Long roleId) {
        return RoleStatusResponse.from(roleAdministrationService.deactivateRole(roleId, currentActor()));
    }

    @Operation(summary = "역할 재활성화")
    @PostMapping("/reactivate")
    public RoleStatusResponse reactivateRole(@PathVariable Long roleId) {
        return RoleStatusResponse.from(roleAdministrationService.reactivateRole(roleId, currentActor()));
    }

    @Operation(summary = "모듈 노출 설정")
    @PutMapping("/modules/{moduleKey}/access")
    public ResponseEntity<Void> setModuleAccess(@PathVariable Long roleId, @PathVariable String moduleKey,
                                                @Valid @RequestBody ModuleAccessRequest request) {
        roleAdministrationService.setModuleAccess(roleId, moduleKey, request.enabled(), currentActor());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "모듈 권한 부여")
    @PutMapping("/modules/{moduleKey}/capabilities/{capabilityKey}")
    public ResponseEntity<Void> grantModuleCapability(@PathVariable Long roleId, @PathVariable String moduleKey,
                                                      @PathVariable String capabilityKey) {
        roleAdministrationService.grantModuleCapability(roleId, moduleKey, capabilityKey, currentActor());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "모듈 권한 회수")
    @DeleteMapping("/modules/{moduleKey}/capabilities/{capabilityKey}")
    public ResponseEntity<Void> revokeModuleCapability(@PathVariable Long roleId, @PathVariable String moduleKey,
                                                       @PathVariable String capabilityKey) {
        roleAdministrationService.revokeModuleCapability(roleId, moduleKey, capabilityKey, currentActor());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "시스템 권한 부여")
    @PutMapping("/system/{capabilityKey}")
    public ResponseEntity<Void> grantSystemCapability(@PathVariable Long roleId, @PathVariable String capabilityKey) {
        roleAdministrationService.grantSystemCapability(roleId, capabilityKey, currentActor());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "시스템 권한 회수")
    @DeleteMapping("/system/{capabilityKey}")
    public ResponseEntity<Void> revokeSystemCapability(@PathVariable Long roleId, @PathVariable String capabilityKey) {
        roleAdministrationService.revokeSystemCapability(roleId, capabilityKey, currentActor());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "권한 일괄 적용")
    @PostMapping("/grants")
    public GrantChangeResponse applyGrants(@PathVariable Long roleId,
                                           @RequestBody List<RoleGrantRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error", "적용할 권한이 없습니다.");
        }
        List<RoleGrant> grants = requests.stream().map(RoleGrantRequest::toGrant).toList();
        return new GrantChangeResponse(roleId, roleAdministrationService.applyGrants(roleId, grants, currentActor()));
    }

    @Operation(summary = "레거시 권한 문서 가져오기", description = "키 형태와 목록 형태를 모두 받는다. 알 수 없는 형태는 400.")
    @PostMapping("/legacy-grants")
    public GrantChangeResponse importLegacyGrants(@PathVariable Long roleId, @RequestBody JsonNode legacyPermissions) {
        return new GrantChangeResponse(roleId,
                roleAdministrationService.importLegacyGrants(roleId, legacyPermissions, currentActor()));
    }

    private UUID currentActor() {
        return SecurityUtils.getCurrentPrincipalId();
    }
}
