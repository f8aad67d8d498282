package com.example.eventrelay.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class JwtIdentityResolverTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final long FUTURE = NOW.getEpochSecond() + 3600;

    private JwtIdentityResolver resolver;

    @BeforeEach
    public void setup() {
        resolver = new JwtIdentityResolver(new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC), TestTokens.SECRET);
    }

    @Test
    public void testValidAccessToken() {
        Optional<Identity> identity = resolver.resolve(TestTokens.access("user-1", FUTURE));

        assertTrue(identity.isPresent());
        assertEquals("user-1", identity.get().userId());
        assertEquals("user-1@example.com", identity.get().email());
    }

    @Test
    public void testBearerPrefixAccepted() {
        assertTrue(resolver.resolve("Bearer " + TestTokens.access("user-1", FUTURE)).isPresent());
    }

    @Test
    public void testExpiredToken() {
        assertTrue(resolver.resolve(TestTokens.access("user-1", NOW.getEpochSecond() - 1)).isEmpty());
        assertTrue(resolver.resolve(TestTokens.access("user-1", NOW.getEpochSecond())).isEmpty());
    }

    @Test
    public void testWrongSecret() {
        String token = TestTokens.sign(Map.of("alg", "HS256"),
                Map.of("userId", "u", "type", "access", "exp", FUTURE), "another-secret-of-sufficient-length");

        assertTrue(resolver.resolve(token).isEmpty());
    }

    @Test
    public void testRefreshTokenRejected() {
        String token = TestTokens.sign(Map.of("userId", "u", "type", "refresh", "exp", FUTURE));

        assertTrue(resolver.resolve(token).isEmpty());
    }

    @Test
    public void testInactiveUserRejected() {
        String token = TestTokens.sign(Map.of("userId", "u", "type", "access", "exp", FUTURE, "isActive", false));

        assertTrue(resolver.resolve(token).isEmpty());
    }

    @Test
    public void testAlgorithmMustBeHs256() {
        String token = TestTokens.sign(Map.of("alg", "none"),
                Map.of("userId", "u", "type", "access", "exp", FUTURE), TestTokens.SECRET);

        assertTrue(resolver.resolve(token).isEmpty());
    }

    @Test
    public void testGarbageNeverThrows() {
        assertTrue(resolver.resolve(null).isEmpty());
        assertTrue(resolver.resolve("").isEmpty());
        assertTrue(resolver.resolve("a.b").isEmpty());
        assertTrue(resolver.resolve("!!!.@@@.###").isEmpty());
        assertTrue(resolver.resolve("Bearer ").isEmpty());
    }
}
