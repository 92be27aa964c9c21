package com.mydetail.backend.modules.permission.domain;

/**
 * 역할 하나의 facet 조회 실패. 해당 역할만 제외되고 해석은 계속된다.
 */
public class FacetFetchException extends RuntimeException {

    private final Long roleId;
    private final FacetName facet;
    private final PermissionErrorKind kind;

    public FacetFetchException(Long roleId, FacetName facet, PermissionErrorKind kind, Throwable cause) {
        super("facet " + facet + " failed for role " + roleId + " (" + kind + ")", cause);
        this.roleId = roleId;
        this.facet = facet;
        this.kind = kind;
    }

    public Long getRoleId() {
        return roleId;
    }

    public FacetName getFacet() {
        return facet;
    }

    public PermissionErrorKind getKind() {
        return kind;
    }
}
