package com.mydetail.backend.global.security;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 외부 인증 서버가 발급한 HS256 액세스 토큰을 검증한다. 발급은 하지 않는다.
 * subject 는 principal id(UUID), email 클레임은 선택.
 */
@Component
public class AccessTokenVerifier {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public AccessTokenVerifier(@Value("${jwt.secret}") String secret) {
        this.secretKey = toKey(secret);
    }

    public AuthenticatedPrincipal verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            UUID principalId = UUID.fromString(claims.getSubject());
            return new AuthenticatedPrincipal(principalId, claims.get("email", String.class));
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    static SecretKey toKey(String secret) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
