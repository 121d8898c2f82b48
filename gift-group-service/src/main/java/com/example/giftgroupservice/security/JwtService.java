package com.example.giftgroupservice.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Verifies access tokens issued by the identity service (HS256, shared secret).
 */
@Service
@Slf4j
public class JwtService {

    private static final String USER_ID_CLAIM = "userId";

    private final SecretKey signingKey;

    public JwtService(@Value("${jwt.secret}") String jwtSecret) {
        this.signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Resolve the caller's user id from a token.
     * The userId claim wins; the subject is the fallback.
     *
     * @return empty if the token is invalid, expired or carries no numeric user id
     */
    public Optional<Long> resolveUserId(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Object userId = claims.get(USER_ID_CLAIM);
            String raw = userId != null ? userId.toString() : claims.getSubject();
            if (raw == null) {
                log.warn("JWT without userId claim or subject");
                return Optional.empty();
            }
            return Optional.of(Long.parseLong(raw));
        } catch (JwtException e) {
            log.warn("Invalid JWT token: {}", e.getMessage());
            return Optional.empty();
        } catch (NumberFormatException e) {
            log.warn("JWT user id is not numeric: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
