package com.mydetail.backend.modules.permission.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.mydetail.backend.modules.role.domain.ModuleCapabilityKey;

/**
 * 역할 하나가 기여하는 세 가지 facet.
 * moduleCapabilities 의 키 집합은 항상 enabledModules 와 같다. 권한이 없는 활성 모듈은 빈 집합으로 남는다.
 */
public record RoleFacets(
        Long roleId,
        Set<String> enabledModules,
        Set<String> systemCapabilities,
        Map<String, Set<String>> moduleCapabilities
) {

    public RoleFacets {
        enabledModules = Collections.unmodifiableSet(new TreeSet<>(enabledModules));
        systemCapabilities = Collections.unmodifiableSet(new TreeSet<>(systemCapabilities));
        Map<String, Set<String>> copy = new TreeMap<>();
        moduleCapabilities.forEach((module, capabilities) ->
                copy.put(module, Collections.unmodifiableSet(new TreeSet<>(capabilities))));
        moduleCapabilities = Collections.unmodifiableMap(copy);
    }

    /**
     * 배치 경로와 폴백 경로가 공유하는 조립 규칙.
     * 비활성 모듈에 대한 권한 행은 존재하더라도 버린다.
     */
    public static RoleFacets of(Long roleId,
                                Collection<String> enabledModules,
                                Collection<String> systemCapabilities,
                                Collection<ModuleCapabilityKey> moduleCapabilities) {
        Set<String> enabled = new TreeSet<>(enabledModules);
        Map<String, Set<String>> byModule = new TreeMap<>();
        for (String module : enabled) {
            byModule.put(module, new TreeSet<>());
        }
        for (ModuleCapabilityKey key : moduleCapabilities) {
            Set<String> capabilities = byModule.get(key.moduleKey());
            if (capabilities != null) {
                capabilities.add(key.capabilityKey());
            }
        }
        return new RoleFacets(roleId, enabled, new TreeSet<>(systemCapabilities), byModule);
    }

    public static RoleFacets empty(Long roleId) {
        return new RoleFacets(roleId, Set.of(), Set.of(), Map.of());
    }
}
