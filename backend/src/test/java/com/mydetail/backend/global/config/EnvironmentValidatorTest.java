package com.mydetail.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    @Test
    @DisplayName("필수 설정이 모두 있으면 문제가 없다")
    void validEnvironment() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/mydetail")
                .withProperty("jwt.secret", SECRET);

        EnvironmentValidator validator = new EnvironmentValidator(environment, PermissionEngineProperties.defaults());

        assertThat(validator.collectProblems()).isEmpty();
        validator.validateEnvironment();
    }

    @Test
    @DisplayName("누락되거나 짧은 비밀키, 잘못된 캐시 종류와 마감 시간을 모두 모아 보고한다")
    void collectsEveryProblem() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", "short");
        PermissionEngineProperties properties = new PermissionEngineProperties(
                new PermissionEngineProperties.Cache("memcached", null, null),
                new PermissionEngineProperties.Fetch(4, 16, Duration.ofSeconds(5), Duration.ofSeconds(2)),
                null,
                null);

        EnvironmentValidator validator = new EnvironmentValidator(environment, properties);

        assertThat(validator.collectProblems())
                .hasSize(4)
                .anySatisfy(problem -> assertThat(problem).startsWith("spring.datasource.url"))
                .anySatisfy(problem -> assertThat(problem).startsWith("jwt.secret: 32"))
                .anySatisfy(problem -> assertThat(problem).contains("memcached"))
                .anySatisfy(problem -> assertThat(problem).contains("role-deadline"));
        assertThatThrownBy(validator::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("환경 설정 검증 실패");
    }

    @Test
    @DisplayName("역할 마감 시간은 폴백 쿼리 세 번의 타임아웃을 모두 담을 수 있어야 한다")
    void roleDeadline_mustCoverSequentialFallbackQueries() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/mydetail")
                .withProperty("jwt.secret", SECRET);

        EnvironmentValidator tooShort = new EnvironmentValidator(environment, withFetch(Duration.ofSeconds(2), Duration.ofSeconds(2)));
        EnvironmentValidator justEnough = new EnvironmentValidator(environment, withFetch(Duration.ofSeconds(2), Duration.ofSeconds(6)));

        assertThat(tooShort.collectProblems())
                .singleElement()
                .satisfies(problem -> assertThat(problem).contains("role-deadline").contains("PT6S"));
        assertThat(justEnough.collectProblems()).isEmpty();
    }

    private static PermissionEngineProperties withFetch(Duration storageTimeout, Duration roleDeadline) {
        return new PermissionEngineProperties(null,
                new PermissionEngineProperties.Fetch(4, 16, storageTimeout, roleDeadline), null, null);
    }
}
