package com.mydetail.backend.global.config;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 권한 엔진 공용 빈.
 */
@Configuration
public class PermissionEngineConfig {

    public static final String FACET_EXECUTOR = "permissionFacetExecutor";

    static final String JPA_QUERY_TIMEOUT = "jakarta.persistence.query.timeout";

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    /**
     * 모든 JPA 쿼리에 storage-timeout 을 밀리초 단위 기본 타임아웃으로 건다.
     */
    @Bean
    public HibernatePropertiesCustomizer storageTimeoutHibernateCustomizer(PermissionEngineProperties properties) {
        int timeoutMillis = properties.fetch().storageTimeoutMillis();
        return hibernateProperties -> hibernateProperties.put(JPA_QUERY_TIMEOUT, timeoutMillis);
    }

    /**
     * 고정 크기 풀. 큐가 가득 차면 호출 스레드에서 직접 실행해 팬아웃이 커넥션 풀을 넘지 않게 한다.
     */
    @Bean(name = FACET_EXECUTOR)
    public AsyncTaskExecutor permissionFacetExecutor(PermissionEngineProperties properties) {
        PermissionEngineProperties.Fetch fetch = properties.fetch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fetch.maxConcurrency());
        executor.setMaxPoolSize(fetch.maxConcurrency());
        executor.setQueueCapacity(fetch.queueCapacity());
        executor.setThreadNamePrefix("perm-facet-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
