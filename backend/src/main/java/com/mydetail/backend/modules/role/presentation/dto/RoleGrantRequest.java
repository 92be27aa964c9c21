package com.mydetail.backend.modules.role.presentation.dto;

import com.mydetail.backend.global.error.ProblemException;
import com.mydetail.backend.modules.role.domain.RoleGrant;

import org.springframework.http.HttpStatus;

/**
 * 부여 일괄 적용 요청의 한 항목. type 에 따라 필요한 필드가 다르다.
 */
public record RoleGrantRequest(
        GrantType type,
        String moduleKey,
        String capabilityKey,
        Boolean enabled
) {

    public enum GrantType {
        MODULE_ACCESS,
        MODULE_CAPABILITY,
        SYSTEM_CAPABILITY
    }

    public RoleGrant toGrant() {
        if (type == null) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error", "type 은 필수입니다.");
        }
        return switch (type) {
            case MODULE_ACCESS -> new RoleGrant.ModuleAccess(require(moduleKey, "moduleKey"), Boolean.TRUE.equals(enabled));
            case MODULE_CAPABILITY -> new RoleGrant.ModuleCapability(require(moduleKey, "moduleKey"),
                    require(capabilityKey, "capabilityKey"));
            case SYSTEM_CAPABILITY -> new RoleGrant.SystemCapability(require(capabilityKey, "capabilityKey"));
        };
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error", field + " 은 필수입니다.");
        }
        return value.trim();
    }
}
