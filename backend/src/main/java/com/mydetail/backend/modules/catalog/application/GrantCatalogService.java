package com.mydetail.backend.modules.catalog.application;

import java.util.List;
import java.util.regex.Pattern;

import com.mydetail.backend.global.error.ProblemException;
import com.mydetail.backend.modules.catalog.domain.ModulePermission;
import com.mydetail.backend.modules.catalog.domain.SystemPermission;
import com.mydetail.backend.modules.catalog.infrastructure.persistence.ModulePermissionRepository;
import com.mydetail.backend.modules.catalog.infrastructure.persistence.SystemPermissionRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 권한 키 카탈로그. 해석 경로에서는 읽지 않고, 부여 시 키 검증에만 쓴다.
 */
@Service
@Transactional(readOnly = true)
public class GrantCatalogService {

    private static final Pattern KEY_PATTERN = Pattern.compile("[a-z][a-z0-9_]{1,63}");

    private final SystemPermissionRepository systemPermissionRepository;
    private final ModulePermissionRepository modulePermissionRepository;

    public GrantCatalogService(SystemPermissionRepository systemPermissionRepository,
                               ModulePermissionRepository modulePermissionRepository) {
        this.systemPermissionRepository = systemPermissionRepository;
        this.modulePermissionRepository = modulePermissionRepository;
    }

    public List<SystemPermission> listSystemPermissions() {
        return systemPermissionRepository.findAllOrdered();
    }

    public List<ModulePermission> listModulePermissions(String moduleKey) {
        String filter = (moduleKey == null || moduleKey.isBlank()) ? null : moduleKey.trim();
        return modulePermissionRepository.findAllOrdered(filter);
    }

    public List<String> listModuleKeys() {
        return modulePermissionRepository.findModuleKeys();
    }

    public List<String> capabilityKeysOf(String moduleKey) {
        return modulePermissionRepository.findAllOrdered(requireModule(moduleKey)).stream()
                .map(ModulePermission::getPermissionKey)
                .toList();
    }

    @Transactional
    public SystemPermission registerSystemPermission(RegisterSystemPermissionCommand command) {
        String key = requireKey(command.permissionKey(), "permissionKey");
        SystemPermission permission = systemPermissionRepository.findByPermissionKey(key)
                .orElseGet(() -> {
                    SystemPermission created = new SystemPermission();
                    created.setPermissionKey(key);
                    return created;
                });
        permission.setDisplayName(requireText(command.displayName(), "displayName"));
        permission.setDescription(command.description());
        permission.setCategory(command.category());
        return systemPermissionRepository.save(permission);
    }

    @Transactional
    public ModulePermission registerModulePermission(RegisterModulePermissionCommand command) {
        String moduleKey = requireKey(command.moduleKey(), "moduleKey");
        String permissionKey = requireKey(command.permissionKey(), "permissionKey");
        ModulePermission permission = modulePermissionRepository.findByModuleKeyAndPermissionKey(moduleKey, permissionKey)
                .orElseGet(() -> {
                    ModulePermission created = new ModulePermission();
                    created.setModuleKey(moduleKey);
                    created.setPermissionKey(permissionKey);
                    return created;
                });
        permission.setDisplayName(requireText(command.displayName(), "displayName"));
        permission.setDescription(command.description());
        return modulePermissionRepository.save(permission);
    }

    public SystemPermission requireSystemPermission(String permissionKey) {
        return systemPermissionRepository.findByPermissionKey(normalize(permissionKey))
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "catalog.unknown_system_capability",
                        "등록되지 않은 시스템 권한입니다: " + permissionKey));
    }

    public ModulePermission requireModulePermission(String moduleKey, String permissionKey) {
        return modulePermissionRepository.findByModuleKeyAndPermissionKey(normalize(moduleKey), normalize(permissionKey))
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "catalog.unknown_module_capability",
                        "등록되지 않은 모듈 권한입니다: " + moduleKey + ":" + permissionKey));
    }

    public String requireModule(String moduleKey) {
        String normalized = normalize(moduleKey);
        if (normalized == null || !modulePermissionRepository.existsByModuleKey(normalized)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "catalog.unknown_module",
                    "등록되지 않은 모듈입니다: " + moduleKey);
        }
        return normalized;
    }

    private static String normalize(String key) {
        return key == null ? null : key.trim();
    }

    private static String requireKey(String key, String field) {
        String normalized = normalize(key);
        if (normalized == null || !KEY_PATTERN.matcher(normalized).matches()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "catalog.invalid_key",
                    field + " 은 소문자, 숫자, 밑줄로 구성된 2~64자여야 합니다.");
        }
        return normalized;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "catalog.missing_field", field + " 은 필수입니다.");
        }
        return value.trim();
    }

    public record RegisterSystemPermissionCommand(String permissionKey, String displayName, String description, String category) {
    }

    public record RegisterModulePermissionCommand(String moduleKey, String permissionKey, String displayName, String description) {
    }
}
