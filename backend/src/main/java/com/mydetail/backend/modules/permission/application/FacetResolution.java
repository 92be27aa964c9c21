package com.mydetail.backend.modules.permission.application;

import java.util.Map;
import java.util.Set;

import com.mydetail.backend.modules.permission.domain.RoleFacets;

/**
 * 역할별 facet 조회 결과. 실패한 역할은 facets 에 빈 값으로, degradedRoleIds 에 id 로 남는다.
 */
public record FacetResolution(Map<Long, RoleFacets> facets, Set<Long> degradedRoleIds) {

    public FacetResolution {
        facets = Map.copyOf(facets);
        degradedRoleIds = Set.copyOf(degradedRoleIds);
    }
}
