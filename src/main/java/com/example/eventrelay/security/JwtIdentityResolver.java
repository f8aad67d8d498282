package com.example.eventrelay.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;

/**
 * HS256 访问令牌解析。
 * 校验签名、过期时间、令牌类型（必须为 access）以及用户启用状态。
 */
@Component
@Slf4j
public class JwtIdentityResolver implements IdentityResolver {

    private static final String HMAC_SHA256 = "HmacSHA256";
    private static final String BEARER_PREFIX = "Bearer ";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final byte[] secret;

    public JwtIdentityResolver(ObjectMapper objectMapper, Clock clock,
            @Value("${app.auth.jwt-secret}") String secret) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Optional<Identity> resolve(String credential) {
        if (credential == null || credential.isBlank()) {
            return Optional.empty();
        }
        String token = credential.trim();
        if (token.startsWith(BEARER_PREFIX)) {
            token = token.substring(BEARER_PREFIX.length()).trim();
        }

        try {
            String[] parts = token.split("\\.");
            if (parts.length != 3) {
                log.debug("[Identity] Malformed token");
                return Optional.empty();
            }

            JsonNode header = decode(parts[0]);
            if (!"HS256".equals(header.path("alg").asText())) {
                log.debug("[Identity] Unsupported algorithm: {}", header.path("alg").asText());
                return Optional.empty();
            }

            // 常量时间比较签名
            byte[] expected = sign(parts[0] + "." + parts[1]);
            byte[] actual = Base64.getUrlDecoder().decode(parts[2]);
            if (!MessageDigest.isEqual(expected, actual)) {
                log.debug("[Identity] Invalid token signature");
                return Optional.empty();
            }

            JsonNode claims = decode(parts[1]);
            if (claims.hasNonNull("exp") && clock.instant().getEpochSecond() >= claims.get("exp").asLong()) {
                log.debug("[Identity] Token expired");
                return Optional.empty();
            }
            if (!"access".equals(claims.path("type").asText())) {
                log.debug("[Identity] Invalid token type");
                return Optional.empty();
            }
            if (!claims.path("isActive").asBoolean(true)) {
                log.debug("[Identity] Inactive user");
                return Optional.empty();
            }

            String userId = claims.path("userId").asText(null);
            if (userId == null || userId.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Identity(userId,
                    claims.path("email").asText(null),
                    claims.path("name").asText(null)));
        } catch (Exception e) {
            log.debug("[Identity] Token validation error: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private JsonNode decode(String segment) throws java.io.IOException {
        return objectMapper.readTree(Base64.getUrlDecoder().decode(segment));
    }

    private byte[] sign(String data) throws java.security.GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_SHA256);
        mac.init(new SecretKeySpec(secret, HMAC_SHA256));
        return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
    }
}
