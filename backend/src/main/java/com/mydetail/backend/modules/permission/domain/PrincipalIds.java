package com.mydetail.backend.modules.permission.domain;

import java.util.UUID;

public final class PrincipalIds {

    private PrincipalIds() {
    }

    /**
     * 비어 있거나 UUID 형식이 아니면 I/O 없이 INVALID_ARGUMENT 로 거부한다.
     */
    public static UUID parse(String principalId) {
        if (principalId == null || principalId.isBlank()) {
            throw new PermissionResolutionException(PermissionErrorKind.INVALID_ARGUMENT, principalId,
                    "principal id must not be empty");
        }
        String trimmed = principalId.trim();
        UUID parsed;
        try {
            parsed = UUID.fromString(trimmed);
        } catch (IllegalArgumentException ex) {
            throw new PermissionResolutionException(PermissionErrorKind.INVALID_ARGUMENT, principalId,
                    "principal id is not a valid identifier", ex);
        }
        // UUID.fromString 은 "1-2-3-4-5" 같은 축약형도 받아들인다
        if (!parsed.toString().equalsIgnoreCase(trimmed)) {
            throw new PermissionResolutionException(PermissionErrorKind.INVALID_ARGUMENT, principalId,
                    "principal id is not a canonical identifier");
        }
        return parsed;
    }
}
