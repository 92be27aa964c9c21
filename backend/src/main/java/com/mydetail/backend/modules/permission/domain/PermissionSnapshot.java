package com.mydetail.backend.modules.permission.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 한 principal 의 권한을 특정 시점에 고정한 불변 뷰.
 *
 * <p>모든 컬렉션은 정렬되어 있어 같은 입력이면 직렬화 결과도 같다.
 * {@link #getResolutionPath()} 와 {@link #getDegradedRoleIds()} 는 진단 정보라 equals/hashCode 에서 제외한다.</p>
 */
public final class PermissionSnapshot {

    private final String principalId;
    private final boolean unrestricted;
    private final SortedSet<String> systemCapabilities;
    private final SortedMap<String, SortedSet<String>> moduleCapabilities;
    private final List<RoleDescriptor> roles;
    private final ResolutionPath resolutionPath;
    private final SortedSet<Long> degradedRoleIds;

    @JsonCreator
    public PermissionSnapshot(
            @JsonProperty("principalId") String principalId,
            @JsonProperty("unrestricted") boolean unrestricted,
            @JsonProperty("systemCapabilities") Collection<String> systemCapabilities,
            @JsonProperty("moduleCapabilities") Map<String, ? extends Collection<String>> moduleCapabilities,
            @JsonProperty("roles") Collection<RoleDescriptor> roles,
            @JsonProperty("resolutionPath") ResolutionPath resolutionPath,
            @JsonProperty("degradedRoleIds") Collection<Long> degradedRoleIds
    ) {
        this.principalId = Objects.requireNonNull(principalId, "principalId");
        this.unrestricted = unrestricted;
        this.systemCapabilities = Collections.unmodifiableSortedSet(
                systemCapabilities == null ? new TreeSet<>() : new TreeSet<>(systemCapabilities));
        SortedMap<String, SortedSet<String>> modules = new TreeMap<>();
        if (moduleCapabilities != null) {
            moduleCapabilities.forEach((module, capabilities) -> modules.put(module,
                    Collections.unmodifiableSortedSet(capabilities == null ? new TreeSet<>() : new TreeSet<>(capabilities))));
        }
        this.moduleCapabilities = Collections.unmodifiableSortedMap(modules);
        List<RoleDescriptor> sortedRoles = roles == null ? new ArrayList<>() : new ArrayList<>(roles);
        sortedRoles.sort(RoleDescriptor.ORDER);
        this.roles = Collections.unmodifiableList(sortedRoles);
        this.resolutionPath = resolutionPath;
        this.degradedRoleIds = Collections.unmodifiableSortedSet(
                degradedRoleIds == null ? new TreeSet<>() : new TreeSet<>(degradedRoleIds));
    }

    /**
     * super admin / supermanager 용. 역할 조회 없이 모든 권한을 가진 것으로 본다.
     */
    public static PermissionSnapshot unrestricted(String principalId) {
        return new PermissionSnapshot(principalId, true, null, null, null, ResolutionPath.BYPASS, null);
    }

    public static PermissionSnapshot empty(String principalId) {
        return new PermissionSnapshot(principalId, false, null, null, null, ResolutionPath.NO_ROLES, null);
    }

    public static Builder builder(String principalId) {
        return new Builder(principalId);
    }

    public String getPrincipalId() {
        return principalId;
    }

    public boolean isUnrestricted() {
        return unrestricted;
    }

    public SortedSet<String> getSystemCapabilities() {
        return systemCapabilities;
    }

    public SortedMap<String, SortedSet<String>> getModuleCapabilities() {
        return moduleCapabilities;
    }

    public List<RoleDescriptor> getRoles() {
        return roles;
    }

    public ResolutionPath getResolutionPath() {
        return resolutionPath;
    }

    public SortedSet<Long> getDegradedRoleIds() {
        return degradedRoleIds;
    }

    public boolean hasSystemCapability(String capabilityKey) {
        return unrestricted || systemCapabilities.contains(capabilityKey);
    }

    public boolean hasModuleCapability(String moduleKey, String capabilityKey) {
        if (unrestricted) {
            return true;
        }
        Set<String> capabilities = moduleCapabilities.get(moduleKey);
        return capabilities != null && capabilities.contains(capabilityKey);
    }

    /**
     * 하나 이상의 역할에서 모듈이 활성화되어 있는지. 권한 유무와 무관하다.
     */
    public boolean isModuleEnabled(String moduleKey) {
        return unrestricted || moduleCapabilities.containsKey(moduleKey);
    }

    @JsonIgnore
    public boolean isDegraded() {
        return !degradedRoleIds.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PermissionSnapshot that)) {
            return false;
        }
        return unrestricted == that.unrestricted
                && principalId.equals(that.principalId)
                && systemCapabilities.equals(that.systemCapabilities)
                && moduleCapabilities.equals(that.moduleCapabilities)
                && roles.equals(that.roles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(principalId, unrestricted, systemCapabilities, moduleCapabilities, roles);
    }

    @Override
    public String toString() {
        return "PermissionSnapshot{principalId=" + principalId
                + ", unrestricted=" + unrestricted
                + ", system=" + systemCapabilities
                + ", modules=" + moduleCapabilities
                + ", roles=" + roles.size()
                + ", path=" + resolutionPath
                + ", degraded=" + degradedRoleIds + "}";
    }

    /**
     * 역할별 facet 을 합집합으로 누적한다. 같은 모듈이 여러 역할에서 오면 권한 집합을 합친다.
     */
    public static final class Builder {

        private final String principalId;
        private final Set<String> systemCapabilities = new TreeSet<>();
        private final Map<String, Set<String>> moduleCapabilities = new TreeMap<>();
        private final List<RoleDescriptor> roles = new ArrayList<>();
        private final Set<Long> degradedRoleIds = new TreeSet<>();
        private ResolutionPath resolutionPath;

        private Builder(String principalId) {
            this.principalId = principalId;
        }

        public Builder merge(RoleFacets facets) {
            systemCapabilities.addAll(facets.systemCapabilities());
            facets.moduleCapabilities().forEach((module, capabilities) ->
                    moduleCapabilities.computeIfAbsent(module, key -> new TreeSet<>()).addAll(capabilities));
            return this;
        }

        public Builder role(RoleDescriptor descriptor) {
            roles.add(descriptor);
            return this;
        }

        public Builder degraded(Long roleId) {
            degradedRoleIds.add(roleId);
            return this;
        }

        public Builder path(ResolutionPath path) {
            this.resolutionPath = path;
            return this;
        }

        public PermissionSnapshot build() {
            return new PermissionSnapshot(principalId, false, systemCapabilities, moduleCapabilities, roles,
                    resolutionPath, degradedRoleIds);
        }
    }
}
