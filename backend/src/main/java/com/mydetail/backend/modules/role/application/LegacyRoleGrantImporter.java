package com.mydetail.backend.modules.role.application;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import com.fasterxml.jackson.databind.JsonNode;
import com.mydetail.backend.global.error.ProblemException;
import com.mydetail.backend.modules.catalog.application.GrantCatalogService;
import com.mydetail.backend.modules.role.domain.RoleGrant;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * 역할별 레거시 권한 JSON 을 정규화된 {@link RoleGrant} 목록으로 바꾼다.
 *
 * <p>지원 형태:
 * <ul>
 *     <li>키 형태: {@code {"sales_orders": "edit", "system": ["manage_roles"], "can_view_pricing": true}}</li>
 *     <li>목록 형태: {@code [{"module": "sales_orders", "level": "edit"}, "stock:view_inventory", "system:view_audit_logs"]}</li>
 * </ul>
 * 레벨은 카탈로그에 등록된 모듈 권한 키의 접두사로 풀어낸다. 알 수 없는 형태는 추측하지 않고 400 으로 거절한다.
 */
@Component
public class LegacyRoleGrantImporter {

    static final String UNRECOGNIZED = "role.legacy_unrecognized";

    private static final String SYSTEM_FIELD = "system";
    private static final String GRANULAR_PREFIX = "can_";

    private static final List<String> ORDER_MODULES = List.of("sales_orders", "service_orders", "recon_orders", "car_wash");

    private static final Map<String, GranularTarget> GRANULAR_FLAGS = Map.of(
            "can_view_pricing", new GranularTarget(ORDER_MODULES, "view_pricing"),
            "can_access_internal_notes", new GranularTarget(ORDER_MODULES, "access_internal_notes"),
            "can_delete_orders", new GranularTarget(ORDER_MODULES, "delete_orders"),
            "can_change_order_status", new GranularTarget(ORDER_MODULES, "change_status"),
            "can_export_reports", new GranularTarget(List.of("reports"), "export_reports")
    );

    private static final List<String> EDIT_PREFIXES = List.of("create_", "edit_", "change_", "add_", "send_", "assign_");

    private final GrantCatalogService grantCatalogService;

    public LegacyRoleGrantImporter(GrantCatalogService grantCatalogService) {
        this.grantCatalogService = grantCatalogService;
    }

    public List<RoleGrant> normalize(JsonNode legacy) {
        if (legacy == null || legacy.isNull() || legacy.isMissingNode()) {
            throw unrecognized("권한 문서가 비어 있습니다.");
        }
        Accumulator accumulator = new Accumulator();
        if (legacy.isObject()) {
            readKeyed(legacy, accumulator);
        } else if (legacy.isArray()) {
            readList(legacy, accumulator);
        } else {
            throw unrecognized("권한 문서는 객체 또는 배열이어야 합니다.");
        }
        return accumulator.toGrants();
    }

    private void readKeyed(JsonNode legacy, Accumulator accumulator) {
        Map<String, Boolean> granularFlags = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = legacy.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();

            if (SYSTEM_FIELD.equals(name)) {
                readSystemArray(value, accumulator);
            } else if (name.startsWith(GRANULAR_PREFIX)) {
                if (!value.isBoolean() || !GRANULAR_FLAGS.containsKey(name)) {
                    throw unrecognized("알 수 없는 세부 권한 플래그입니다: " + name);
                }
                granularFlags.put(name, value.booleanValue());
            } else if (value.isTextual()) {
                applyLevel(name, value.textValue(), accumulator);
            } else {
                throw unrecognized("모듈 " + name + " 의 레벨은 문자열이어야 합니다.");
            }
        }
        // 세부 플래그는 같은 문서에서 열린 모듈에만 적용한다.
        granularFlags.forEach((flag, granted) -> {
            if (!granted) {
                return;
            }
            GranularTarget target = GRANULAR_FLAGS.get(flag);
            for (String module : target.modules()) {
                if (accumulator.isEnabled(module) && grantCatalogService.capabilityKeysOf(module).contains(target.capabilityKey())) {
                    accumulator.capability(module, target.capabilityKey());
                }
            }
        });
    }

    private void readList(JsonNode legacy, Accumulator accumulator) {
        for (JsonNode entry : legacy) {
            if (entry.isObject()) {
                JsonNode module = entry.get("module");
                JsonNode level = entry.get("level");
                if (module == null || !module.isTextual() || level == null || !level.isTextual()) {
                    throw unrecognized("목록 항목에는 module 과 level 문자열이 필요합니다.");
                }
                applyLevel(module.textValue(), level.textValue(), accumulator);
            } else if (entry.isTextual()) {
                applyQualifiedKey(entry.textValue(), accumulator);
            } else {
                throw unrecognized("목록 항목은 객체 또는 문자열이어야 합니다.");
            }
        }
    }

    private void readSystemArray(JsonNode value, Accumulator accumulator) {
        if (!value.isArray()) {
            throw unrecognized("system 항목은 문자열 배열이어야 합니다.");
        }
        for (JsonNode key : value) {
            if (!key.isTextual() || key.textValue().isBlank()) {
                throw unrecognized("system 항목은 문자열 배열이어야 합니다.");
            }
            accumulator.system(key.textValue().trim());
        }
    }

    private void applyQualifiedKey(String qualified, Accumulator accumulator) {
        int separator = qualified.indexOf(':');
        if (separator <= 0 || separator == qualified.length() - 1) {
            throw unrecognized("'모듈:권한' 형식이 아닙니다: " + qualified);
        }
        String scope = qualified.substring(0, separator).trim();
        String key = qualified.substring(separator + 1).trim();
        if (SYSTEM_FIELD.equals(scope)) {
            accumulator.system(key);
            return;
        }
        String module = grantCatalogService.requireModule(scope);
        accumulator.enable(module);
        accumulator.capability(module, key);
    }

    private void applyLevel(String moduleKey, String rawLevel, Accumulator accumulator) {
        String module = grantCatalogService.requireModule(moduleKey);
        LegacyLevel level = LegacyLevel.parse(rawLevel);
        if (level == LegacyLevel.NONE) {
            accumulator.disable(module);
            return;
        }
        accumulator.enable(module);
        grantCatalogService.capabilityKeysOf(module).stream()
                .filter(level.includes())
                .forEach(capability -> accumulator.capability(module, capability));
    }

    private static ProblemException unrecognized(String detail) {
        return new ProblemException(HttpStatus.BAD_REQUEST, UNRECOGNIZED, detail);
    }

    private enum LegacyLevel {
        NONE,
        VIEW,
        EDIT,
        DELETE,
        ADMIN;

        static LegacyLevel parse(String raw) {
            if (raw == null) {
                throw unrecognized("레벨이 비어 있습니다.");
            }
            try {
                return valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw unrecognized("알 수 없는 레거시 레벨입니다: " + raw);
            }
        }

        Predicate<String> includes() {
            Predicate<String> view = key -> key.startsWith("view_");
            Predicate<String> edit = view.or(key -> EDIT_PREFIXES.stream().anyMatch(key::startsWith));
            return switch (this) {
                case NONE -> key -> false;
                case VIEW -> view;
                case EDIT -> edit;
                case DELETE -> edit.or(key -> key.startsWith("delete_"));
                case ADMIN -> key -> true;
            };
        }
    }

    private record GranularTarget(List<String> modules, String capabilityKey) {
    }

    /**
     * 같은 모듈이 여러 번 나오면 한 번이라도 열린 쪽을 따른다.
     */
    private static final class Accumulator {

        private final Map<String, Boolean> access = new LinkedHashMap<>();
        private final Set<RoleGrant> capabilities = new LinkedHashSet<>();

        void enable(String module) {
            access.put(module, true);
        }

        void disable(String module) {
            access.putIfAbsent(module, false);
        }

        boolean isEnabled(String module) {
            return Boolean.TRUE.equals(access.get(module));
        }

        void capability(String module, String capabilityKey) {
            capabilities.add(new RoleGrant.ModuleCapability(module, capabilityKey));
        }

        void system(String capabilityKey) {
            capabilities.add(new RoleGrant.SystemCapability(capabilityKey));
        }

        List<RoleGrant> toGrants() {
            List<RoleGrant> grants = new ArrayList<>();
            access.forEach((module, enabled) -> grants.add(new RoleGrant.ModuleAccess(module, enabled)));
            grants.addAll(capabilities);
            return grants;
        }
    }
}
