package com.matchmate.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.HexFormat;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues opaque URL-safe bearer tokens and derives the hash under which they are stored.
 */
@Service
public class SessionTokenService {

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;
    private final Duration sessionTtl;
    private final Clock clock;

    public SessionTokenService(
            @Value("${matchmate.session.ttl:P7D}") Duration sessionTtl,
            Clock clock
    ) {
        this(new SecureRandom(), sessionTtl, clock);
    }

    SessionTokenService(SecureRandom secureRandom, Duration sessionTtl, Clock clock) {
        if (sessionTtl.isNegative() || sessionTtl.isZero()) {
            throw new IllegalArgumentException("matchmate.session.ttl must be positive");
        }
        this.secureRandom = secureRandom;
        this.sessionTtl = sessionTtl;
        this.clock = clock;
    }

    public IssuedToken issue() {
        byte[] raw = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(raw);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
        OffsetDateTime issuedAt = OffsetDateTime.now(clock);
        return new IssuedToken(token, hash(token), issuedAt, issuedAt.plus(sessionTtl));
    }

    public String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public record IssuedToken(String token, String tokenHash, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }
}
