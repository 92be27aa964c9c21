package com.mydetail.backend.modules.permission.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class PrincipalIdsTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "not-a-uuid", "1-2-3-4-5"})
    @DisplayName("비어 있거나 정규 UUID 가 아니면 INVALID_ARGUMENT")
    void parse_rejectsMalformedIds(String raw) {
        assertThatThrownBy(() -> PrincipalIds.parse(raw))
                .isInstanceOf(PermissionResolutionException.class)
                .extracting(ex -> ((PermissionResolutionException) ex).getKind())
                .isEqualTo(PermissionErrorKind.INVALID_ARGUMENT);
    }

    @Test
    @DisplayName("앞뒤 공백은 허용한다")
    void parse_trimsWhitespace() {
        UUID id = UUID.randomUUID();

        assertThat(PrincipalIds.parse("  " + id + " ")).isEqualTo(id);
    }
}
