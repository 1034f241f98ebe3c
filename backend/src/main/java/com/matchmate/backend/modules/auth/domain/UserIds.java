package com.matchmate.backend.modules.auth.domain;

import java.util.Optional;
import java.util.UUID;

/**
 * Parses user ids arriving as strings on the wire.
 */
public final class UserIds {

    private UserIds() {
    }

    public static Optional<UUID> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
