package com.mydetail.backend.global.security;

import java.util.UUID;

public record AuthenticatedPrincipal(UUID principalId, String email) {
}
