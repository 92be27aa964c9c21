package com.mydetail.backend.modules.permission.domain;

public enum PermissionErrorKind {
    /** 잘못된 principal 식별자. I/O 전에 거부된다. */
    INVALID_ARGUMENT,
    /** 저장소 접근 불가 또는 타임아웃. */
    DEPENDENCY_UNAVAILABLE,
    /** 배치 집계 함수가 없거나 구조적으로 실패. 폴백으로 전환된다. */
    AGGREGATION_UNSUPPORTED,
    UNEXPECTED,
    /** 호출자가 해석을 취소(인터럽트)했다. */
    CANCELLED
}
