package com.mydetail.backend.modules.role.domain;

import java.time.OffsetDateTime;

import com.mydetail.backend.global.jpa.AbstractTimestampedEntity;
import com.mydetail.backend.modules.principal.domain.Organization;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * 조직 범위의 권한 묶음. 삭제하지 않고 is_active 로 비활성화한다.
 */
@Entity
@Table(name = "role")
public class Role extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "organization_id", nullable = false, updatable = false)
    private Organization organization;

    @Column(name = "role_key", nullable = false, length = 64)
    private String roleKey;

    @Column(name = "display_name", nullable = false, length = 120)
    private String displayName;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "deactivated_at")
    private OffsetDateTime deactivatedAt;

    public Long getId() {
        return id;
    }

    public Organization getOrganization() {
        return organization;
    }

    public void setOrganization(Organization organization) {
        this.organization = organization;
    }

    public String getRoleKey() {
        return roleKey;
    }

    public void setRoleKey(String roleKey) {
        this.roleKey = roleKey;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getDeactivatedAt() {
        return deactivatedAt;
    }

    public void deactivate(OffsetDateTime now) {
        this.active = false;
        this.deactivatedAt = now;
    }

    public void reactivate() {
        this.active = true;
        this.deactivatedAt = null;
    }
}
