package com.mydetail.backend.modules.permission.domain;

/**
 * 활성화되었지만 기능 권한이 하나도 없는 모듈을 어떻게 노출할지.
 */
public enum ModuleVisibilityPolicy {
    VISIBLE_READ_ONLY,
    HIDDEN
}
