package com.mydetail.backend.modules.permission.domain;

/**
 * 배치 facet 조회 경로를 쓸 수 없음. 호출자는 폴백 쿼리 엔진으로 전환한다.
 */
public class AggregationUnsupportedException extends RuntimeException {

    private final PermissionErrorKind kind;

    public AggregationUnsupportedException(String message, Throwable cause) {
        this(PermissionErrorKind.AGGREGATION_UNSUPPORTED, message, cause);
    }

    public AggregationUnsupportedException(PermissionErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * 폴백 사유. 구조적 결함이면 AGGREGATION_UNSUPPORTED, 일시 장애면 DEPENDENCY_UNAVAILABLE.
     */
    public PermissionErrorKind getKind() {
        return kind;
    }
}
