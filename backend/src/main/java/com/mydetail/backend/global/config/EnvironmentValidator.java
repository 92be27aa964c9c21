package com.mydetail.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 필수 설정과 권한 엔진 설정을 검증한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_JWT_SECRET_LENGTH = 32;

    private final Environment environment;
    private final PermissionEngineProperties properties;

    public EnvironmentValidator(Environment environment, PermissionEngineProperties properties) {
        this.environment = environment;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("환경 설정 검증 실패: " + String.join("; ", problems));
        }

        if (!properties.batch().isEnabled()) {
            // 느린 경로가 기본값이 되면 운영자가 알아야 한다
            log.warn("[ALERT][Permissions] batch facet retrieval disabled, every resolve uses the fallback query engine");
        }
        log.info("Permission engine ready (cache={}, ttl={}, maxConcurrency={}, emptyModuleVisibility={})",
                properties.cache().type(),
                properties.cache().ttl(),
                properties.fetch().maxConcurrency(),
                properties.emptyModuleVisibility());
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : new String[]{"spring.datasource.url", "jwt.secret"}) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " 누락");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank() && secret.length() < MIN_JWT_SECRET_LENGTH)
                .ifPresent(secret -> problems.add("jwt.secret: " + MIN_JWT_SECRET_LENGTH + "자 이상이어야 합니다"));

        String cacheType = properties.cache().type();
        if (!"memory".equalsIgnoreCase(cacheType) && !"redis".equalsIgnoreCase(cacheType)) {
            problems.add("app.permissions.cache.type: memory 또는 redis 여야 합니다 (" + cacheType + ")");
        }
        PermissionEngineProperties.Fetch fetch = properties.fetch();
        if (fetch.roleDeadline().compareTo(fetch.minimumRoleDeadline()) < 0) {
            problems.add("app.permissions.fetch.role-deadline 은 storage-timeout x "
                    + PermissionEngineProperties.Fetch.QUERIES_PER_ROLE + " (" + fetch.minimumRoleDeadline()
                    + ") 보다 짧을 수 없습니다");
        }
        return problems;
    }
}
