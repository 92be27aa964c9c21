package com.mydetail.backend.modules.role.domain;

import com.mydetail.backend.global.jpa.AbstractTimestampedEntity;
import com.mydetail.backend.modules.catalog.domain.ModulePermission;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "role_module_grant")
public class RoleModuleGrant extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id", nullable = false, updatable = false)
    private Role role;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "module_permission_id", nullable = false, updatable = false)
    private ModulePermission modulePermission;

    protected RoleModuleGrant() {
    }

    public RoleModuleGrant(Role role, ModulePermission modulePermission) {
        this.role = role;
        this.modulePermission = modulePermission;
    }

    public Long getId() {
        return id;
    }

    public Role getRole() {
        return role;
    }

    public ModulePermission getModulePermission() {
        return modulePermission;
    }
}
