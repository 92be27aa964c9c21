package com.mydetail.backend.modules.permission.domain;

/**
 * 스냅샷이 어떤 경로로 계산되었는지. 진단용이며 동등성 비교에 포함되지 않는다.
 */
public enum ResolutionPath {
    BYPASS,
    NO_ROLES,
    BATCH,
    FALLBACK
}
