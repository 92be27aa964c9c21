package com.mydetail.backend.modules.role.domain;

import java.util.Objects;

/**
 * 역할에 적용할 정규화된 권한 부여 단위.
 * 레거시 JSON 권한 문서는 가져오기 단계에서 이 세 가지 형태로만 변환된다.
 */
public interface RoleGrant {

    record ModuleAccess(String moduleKey, boolean enabled) implements RoleGrant {
        public ModuleAccess {
            Objects.requireNonNull(moduleKey, "moduleKey");
        }
    }

    record ModuleCapability(String moduleKey, String capabilityKey) implements RoleGrant {
        public ModuleCapability {
            Objects.requireNonNull(moduleKey, "moduleKey");
            Objects.requireNonNull(capabilityKey, "capabilityKey");
        }
    }

    record SystemCapability(String capabilityKey) implements RoleGrant {
        public SystemCapability {
            Objects.requireNonNull(capabilityKey, "capabilityKey");
        }
    }
}
