package com.mydetail.backend.modules.permission.application;

import java.time.Duration;
import java.util.Optional;

import com.mydetail.backend.modules.permission.domain.PermissionSnapshot;

/**
 * principal 별 스냅샷 캐시. 같은 키에 대한 put/invalidate 경합은 마지막 호출이 이긴다.
 */
public interface PermissionSnapshotCache {

    Optional<PermissionSnapshot> get(String principalId);

    void put(String principalId, PermissionSnapshot snapshot, Duration ttl);

    void invalidate(String principalId);
}
