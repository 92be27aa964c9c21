package com.mydetail.backend.modules.permission.application;

import java.time.Duration;

import com.mydetail.backend.modules.permission.domain.FacetName;
import com.mydetail.backend.modules.permission.domain.PermissionErrorKind;
import com.mydetail.backend.modules.permission.domain.ResolutionPath;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 운영자용 신호. 폴백 사용과 역할 단위 부분 실패는 모두 카운터와 WARN 로그로 남긴다.
 */
@Component
public class PermissionDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(PermissionDiagnostics.class);

    static final String FALLBACK_COUNTER = "permission.resolution.fallback";
    static final String ROLE_FAILURE_COUNTER = "permission.resolution.role_failure";
    static final String RESOLUTION_TIMER = "permission.resolution";
    static final String CACHE_COUNTER = "permission.cache";

    private final MeterRegistry meterRegistry;

    public PermissionDiagnostics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void fallbackUsed(String principalId, PermissionErrorKind reason, Throwable cause) {
        Counter.builder(FALLBACK_COUNTER)
                .description("Resolutions served by the per-role fallback query engine")
                .tag("reason", reason.name().toLowerCase())
                .register(meterRegistry)
                .increment();
        log.warn("[ALERT][Permissions] batch facet retrieval unavailable, using fallback (principal={}, reason={}, cause={})",
                principalId, reason, cause == null ? "-" : cause.getMessage());
    }

    public void roleDegraded(String principalId, Long roleId, FacetName facet, PermissionErrorKind kind, Throwable cause) {
        Counter.builder(ROLE_FAILURE_COUNTER)
                .description("Roles excluded from a resolution because a facet could not be fetched")
                .tag("facet", facet.tagValue())
                .tag("kind", kind.name().toLowerCase())
                .register(meterRegistry)
                .increment();
        log.warn("[ALERT][Permissions] role excluded from resolution (principal={}, role={}, facet={}, kind={})",
                principalId, roleId, facet.tagValue(), kind, cause);
    }

    public void resolved(ResolutionPath path, Duration elapsed) {
        Timer.builder(RESOLUTION_TIMER)
                .description("Uncached permission resolution latency")
                .tag("path", path.name().toLowerCase())
                .register(meterRegistry)
                .record(elapsed);
    }

    public void cacheResult(String result) {
        Counter.builder(CACHE_COUNTER)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
