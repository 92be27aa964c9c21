package com.mydetail.backend.modules.principal.domain;

import java.util.UUID;

import com.mydetail.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * 인증된 사용자. 우회 플래그(super admin, supermanager)는 역할 해석보다 먼저 평가된다.
 */
@Entity
@Table(name = "app_principal")
public class AppPrincipal extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, length = 255)
    private String email;

    @Column(name = "display_name", length = 120)
    private String displayName;

    @Column(name = "is_super_admin", nullable = false)
    private boolean superAdmin;

    @Column(name = "is_supermanager", nullable = false)
    private boolean supermanager;

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public boolean isSuperAdmin() {
        return superAdmin;
    }

    public void setSuperAdmin(boolean superAdmin) {
        this.superAdmin = superAdmin;
    }

    public boolean isSupermanager() {
        return supermanager;
    }

    public void setSupermanager(boolean supermanager) {
        this.supermanager = supermanager;
    }

    public boolean isBypassAccount() {
        return superAdmin || supermanager;
    }
}
