package com.mydetail.backend.modules.role.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mydetail.backend.global.error.ProblemException;
import com.mydetail.backend.modules.catalog.application.GrantCatalogService;
import com.mydetail.backend.modules.role.domain.RoleGrant;
import com.mydetail.backend.modules.role.domain.RoleGrant.ModuleAccess;
import com.mydetail.backend.modules.role.domain.RoleGrant.ModuleCapability;
import com.mydetail.backend.modules.role.domain.RoleGrant.SystemCapability;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class LegacyRoleGrantImporterTest {

    private static final List<String> ORDER_CAPABILITIES = List.of(
            "view_orders", "create_orders", "change_status", "delete_orders", "view_pricing", "access_internal_notes");

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private GrantCatalogService grantCatalogService;

    private LegacyRoleGrantImporter importer;

    @BeforeEach
    void setUp() {
        importer = new LegacyRoleGrantImporter(grantCatalogService);
    }

    @Test
    @DisplayName("키 형태: view 레벨은 view_ 권한만, system 배열은 시스템 권한으로 바뀐다")
    void keyedForm_viewLevelAndSystemArray() throws Exception {
        stubKnownModules();
        when(grantCatalogService.capabilityKeysOf("sales_orders")).thenReturn(ORDER_CAPABILITIES);

        List<RoleGrant> grants = importer.normalize(json("""
                {"sales_orders": "view", "system": ["manage_roles"]}
                """));

        assertThat(grants).containsExactly(
                new ModuleAccess("sales_orders", true),
                new ModuleCapability("sales_orders", "view_orders"),
                new ModuleCapability("sales_orders", "view_pricing"),
                new SystemCapability("manage_roles"));
    }

    @Test
    @DisplayName("delete 레벨은 편집 계열 접두사와 delete_ 권한을 포함한다")
    void deleteLevel_includesEditAndDeletePrefixes() throws Exception {
        stubKnownModules();
        when(grantCatalogService.capabilityKeysOf("sales_orders")).thenReturn(ORDER_CAPABILITIES);

        List<RoleGrant> grants = importer.normalize(json("""
                {"sales_orders": "DELETE"}
                """));

        assertThat(grants).containsExactlyInAnyOrder(
                new ModuleAccess("sales_orders", true),
                new ModuleCapability("sales_orders", "view_orders"),
                new ModuleCapability("sales_orders", "create_orders"),
                new ModuleCapability("sales_orders", "change_status"),
                new ModuleCapability("sales_orders", "delete_orders"),
                new ModuleCapability("sales_orders", "view_pricing"));
    }

    @Test
    @DisplayName("세부 플래그는 같은 문서에서 열린 모듈에만 적용된다")
    void granularFlags_applyOnlyToEnabledModules() throws Exception {
        stubKnownModules();
        when(grantCatalogService.capabilityKeysOf("sales_orders")).thenReturn(ORDER_CAPABILITIES);

        List<RoleGrant> grants = importer.normalize(json("""
                {"sales_orders": "view", "service_orders": "none", "can_access_internal_notes": true, "can_delete_orders": false}
                """));

        assertThat(grants).containsExactly(
                new ModuleAccess("sales_orders", true),
                new ModuleAccess("service_orders", false),
                new ModuleCapability("sales_orders", "view_orders"),
                new ModuleCapability("sales_orders", "view_pricing"),
                new ModuleCapability("sales_orders", "access_internal_notes"));
    }

    @Test
    @DisplayName("목록 형태: 레벨 객체와 '모듈:권한', 'system:권한' 문자열을 함께 받는다")
    void listForm_mixedEntries() throws Exception {
        stubKnownModules();
        when(grantCatalogService.capabilityKeysOf("stock")).thenReturn(List.of("view_inventory", "edit_inventory"));

        List<RoleGrant> grants = importer.normalize(json("""
                [{"module": "stock", "level": "view"}, "reports:export_reports", "system:view_audit_logs"]
                """));

        assertThat(grants).containsExactly(
                new ModuleAccess("stock", true),
                new ModuleAccess("reports", true),
                new ModuleCapability("stock", "view_inventory"),
                new ModuleCapability("reports", "export_reports"),
                new SystemCapability("view_audit_logs"));
    }

    @Test
    @DisplayName("같은 모듈이 열림과 닫힘으로 모두 나오면 열림이 이긴다")
    void enableWinsOverDisable() throws Exception {
        stubKnownModules();
        when(grantCatalogService.capabilityKeysOf("stock")).thenReturn(List.of("view_inventory"));

        List<RoleGrant> grants = importer.normalize(json("""
                [{"module": "stock", "level": "none"}, {"module": "stock", "level": "view"}, {"module": "stock", "level": "none"}]
                """));

        assertThat(grants).containsExactly(
                new ModuleAccess("stock", true),
                new ModuleCapability("stock", "view_inventory"));
    }

    @Test
    @DisplayName("알 수 없는 형태는 추측하지 않고 400 으로 거절한다")
    void unrecognizedShapes_areRejected() throws Exception {
        assertUnrecognized(json("\"sales_orders\""));
        assertUnrecognized(json("{\"can_fly\": true}"));
        assertUnrecognized(json("{\"system\": \"manage_roles\"}"));
        assertUnrecognized(json("[\"stock\"]"));
        assertUnrecognized(json("[42]"));
        assertUnrecognized(json("[{\"module\": \"stock\"}]"));
        assertUnrecognized(null);
    }

    @Test
    @DisplayName("알 수 없는 레벨 이름은 거절한다")
    void unknownLevel_isRejected() throws Exception {
        stubKnownModules();

        assertUnrecognized(json("{\"stock\": \"owner\"}"));
    }

    @Test
    @DisplayName("카탈로그에 없는 모듈은 카탈로그 오류를 그대로 전달한다")
    void unknownModule_propagatesCatalogError() throws Exception {
        when(grantCatalogService.requireModule("spaceships"))
                .thenThrow(new ProblemException(HttpStatus.BAD_REQUEST, "catalog.unknown_module"));

        assertThatThrownBy(() -> importer.normalize(json("{\"spaceships\": \"view\"}")))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "catalog.unknown_module");
    }

    private void assertUnrecognized(JsonNode legacy) {
        assertThatThrownBy(() -> importer.normalize(legacy))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", LegacyRoleGrantImporter.UNRECOGNIZED);
    }

    private void stubKnownModules() {
        when(grantCatalogService.requireModule(anyString())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }
}
