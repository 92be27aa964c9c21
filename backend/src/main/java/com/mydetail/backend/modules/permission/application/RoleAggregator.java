package com.mydetail.backend.modules.permission.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.mydetail.backend.modules.permission.domain.PermissionErrorKind;
import com.mydetail.backend.modules.permission.domain.PermissionResolutionException;
import com.mydetail.backend.modules.permission.domain.PrincipalIds;
import com.mydetail.backend.modules.role.domain.BoundRole;
import com.mydetail.backend.modules.role.infrastructure.persistence.MembershipRepository;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * principal 의 활성 역할 바인딩을 모든 조직에 걸쳐 찾는다.
 * 재시도하지 않는다. 실패는 그대로 호출자에게 전달되어 전체 실패(권한 없음)가 된다.
 */
@Component
public class RoleAggregator {

    private final MembershipRepository membershipRepository;

    public RoleAggregator(MembershipRepository membershipRepository) {
        this.membershipRepository = membershipRepository;
    }

    public List<BoundRole> resolveMemberships(String principalId) {
        UUID id = PrincipalIds.parse(principalId);
        List<BoundRole> rows;
        try {
            rows = membershipRepository.findBoundRoles(id);
        } catch (DataAccessException ex) {
            throw new PermissionResolutionException(PermissionErrorKind.DEPENDENCY_UNAVAILABLE, principalId,
                    "memberships could not be loaded", ex);
        }

        // 같은 (조직, 역할) 에 대한 중복 멤버십은 한 번만 센다
        Map<List<Long>, BoundRole> unique = new LinkedHashMap<>();
        for (BoundRole row : rows) {
            unique.putIfAbsent(List.of(row.organizationId(), row.roleId()), row);
        }
        return new ArrayList<>(unique.values());
    }
}
