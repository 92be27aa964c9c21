package com.mydetail.backend.modules.role.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.mydetail.backend.global.jpa.AbstractTimestampedEntity;
import com.mydetail.backend.modules.principal.domain.AppPrincipal;
import com.mydetail.backend.modules.principal.domain.Organization;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Principal - Organization - Role 바인딩. 감사 요건상 행을 지우지 않고 비활성화만 한다.
 */
@Entity
@Table(name = "membership")
public class Membership extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "principal_id", nullable = false, updatable = false)
    private AppPrincipal principal;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "organization_id", nullable = false, updatable = false)
    private Organization organization;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id", nullable = false, updatable = false)
    private Role role;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "granted_at", nullable = false)
    private OffsetDateTime grantedAt;

    @Column(name = "granted_by", columnDefinition = "uuid")
    private UUID grantedBy;

    @Column(name = "deactivated_at")
    private OffsetDateTime deactivatedAt;

    protected Membership() {
    }

    /**
     * 역할이 속한 조직과 멤버십 조직이 다르면 생성하지 않는다.
     */
    public static Membership bind(AppPrincipal principal, Role role, OffsetDateTime grantedAt, UUID grantedBy) {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(role, "role");
        Membership membership = new Membership();
        membership.principal = principal;
        membership.role = role;
        membership.organization = role.getOrganization();
        membership.grantedAt = grantedAt;
        membership.grantedBy = grantedBy;
        return membership;
    }

    public UUID getId() {
        return id;
    }

    public AppPrincipal getPrincipal() {
        return principal;
    }

    public Organization getOrganization() {
        return organization;
    }

    public Role getRole() {
        return role;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getGrantedAt() {
        return grantedAt;
    }

    public UUID getGrantedBy() {
        return grantedBy;
    }

    public OffsetDateTime getDeactivatedAt() {
        return deactivatedAt;
    }

    public void deactivate(OffsetDateTime now) {
        this.active = false;
        this.deactivatedAt = now;
    }

    public void reactivate(OffsetDateTime now, UUID actor) {
        this.active = true;
        this.deactivatedAt = null;
        this.grantedAt = now;
        this.grantedBy = actor;
    }
}
