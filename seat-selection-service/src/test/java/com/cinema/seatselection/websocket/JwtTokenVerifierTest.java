package com.cinema.seatselection.websocket;

import com.cinema.seatselection.exception.AuthenticationException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenVerifierTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hmac-sha256";

    private final SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
    private final JwtTokenVerifier verifier = new JwtTokenVerifier(SECRET);

    @Test
    void verify_IdClaim_ReturnsUser() {
        String token = Jwts.builder()
            .claim("id", 42)
            .claim("email", "viewer@example.com")
            .claim("role", "USER")
            .signWith(key)
            .compact();

        AuthenticatedUser user = verifier.verify(token);

        assertEquals(42L, user.getUserId());
        assertEquals("viewer@example.com", user.getEmail());
        assertEquals("USER", user.getRole());
    }

    @Test
    void verify_NumericSubject_UsedWhenNoIdClaim() {
        String token = Jwts.builder().subject("7").signWith(key).compact();

        assertEquals(7L, verifier.verify(token).getUserId());
    }

    @Test
    void verify_NoUserId_Rejected() {
        String token = Jwts.builder().subject("someone").signWith(key).compact();

        assertThrows(AuthenticationException.class, () -> verifier.verify(token));
    }

    @Test
    void verify_WrongKey_Rejected() {
        SecretKey otherKey = Keys.hmacShaKeyFor("another-secret-key-that-is-also-long-enough!".getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder().claim("id", 1).signWith(otherKey).compact();

        assertThrows(AuthenticationException.class, () -> verifier.verify(token));
    }

    @Test
    void verify_Expired_Rejected() {
        String token = Jwts.builder()
            .claim("id", 1)
            .expiration(new Date(System.currentTimeMillis() - 60_000))
            .signWith(key)
            .compact();

        assertThrows(AuthenticationException.class, () -> verifier.verify(token));
    }

    @Test
    void verify_MissingOrGarbage_Rejected() {
        assertThrows(AuthenticationException.class, () -> verifier.verify(null));
        assertThrows(AuthenticationException.class, () -> verifier.verify(""));
        assertThrows(AuthenticationException.class, () -> verifier.verify("not.a.jwt"));
    }
}
