package com.mydetail.backend.modules.permission.application;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;

import com.mydetail.backend.modules.permission.domain.AggregationUnsupportedException;
import com.mydetail.backend.modules.permission.domain.RoleFacets;

/**
 * 한 번의 왕복으로 principal 의 모든 역할 facet 을 가져오는 최적화 경로.
 */
public interface BatchFacetRetriever {

    /**
     * @param roleIds 역할 집계기가 돌려준 역할. 결과는 이 역할들로 제한되고, 누락된 역할은 빈 facet 을 갖는다.
     * @throws AggregationUnsupportedException 배치 경로를 쓸 수 없을 때. 호출자는 폴백한다.
     */
    Map<Long, RoleFacets> retrieve(UUID principalId, Collection<Long> roleIds);
}
