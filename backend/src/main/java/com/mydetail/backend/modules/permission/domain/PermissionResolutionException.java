package com.mydetail.backend.modules.permission.domain;

/**
 * 권한 해석 전체 실패. 호출 측은 이 예외를 받으면 어떤 권한도 부여하지 않아야 한다.
 */
public class PermissionResolutionException extends RuntimeException {

    private final PermissionErrorKind kind;
    private final String principalId;

    public PermissionResolutionException(PermissionErrorKind kind, String principalId, String message) {
        this(kind, principalId, message, null);
    }

    public PermissionResolutionException(PermissionErrorKind kind, String principalId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.principalId = principalId;
    }

    public PermissionErrorKind getKind() {
        return kind;
    }

    public String getPrincipalId() {
        return principalId;
    }
}
