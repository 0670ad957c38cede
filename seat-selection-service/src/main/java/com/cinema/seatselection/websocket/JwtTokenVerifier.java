package com.cinema.seatselection.websocket;

import com.cinema.seatselection.exception.AuthenticationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Verifies HMAC-signed bearer tokens issued by the account service.
 * The user id is read from the {@code id} or {@code userId} claim, falling back
 * to the subject.
 */
@Component
@Slf4j
public class JwtTokenVerifier {

    private final SecretKey signingKey;

    public JwtTokenVerifier(@Value("${seat-selection.auth.jwt-secret}") String jwtSecret) {
        this.signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    public AuthenticatedUser verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("Authentication token is required");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException("Invalid authentication token", e);
        }

        Long userId = userIdOf(claims);
        if (userId == null) {
            throw new AuthenticationException("Authentication token carries no user id");
        }
        return new AuthenticatedUser(userId, claims.get("email", String.class), claims.get("role", String.class));
    }

    private Long userIdOf(Claims claims) {
        for (String claim : new String[]{"id", "userId"}) {
            Object value = claims.get(claim);
            if (value instanceof Number) {
                return ((Number) value).longValue();
            }
            if (value instanceof String && ((String) value).matches("\\d+")) {
                return Long.valueOf((String) value);
            }
        }
        String subject = claims.getSubject();
        if (subject != null && subject.matches("\\d+")) {
            return Long.valueOf(subject);
        }
        return null;
    }
}
