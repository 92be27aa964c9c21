package com.mydetail.backend.modules.permission.domain;

public enum FacetName {
    MODULE_ACCESS,
    SYSTEM_CAPABILITIES,
    MODULE_CAPABILITIES,
    /** 특정 facet 으로 좁힐 수 없는 역할 단위 실패 (타임아웃, 거부된 작업 등). */
    ROLE;

    public String tagValue() {
        return name().toLowerCase();
    }
}
