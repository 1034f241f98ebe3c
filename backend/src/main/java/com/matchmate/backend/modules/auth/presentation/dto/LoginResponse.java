package com.matchmate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record LoginResponse(String token, String tokenType, OffsetDateTime expiresAt, LoginUser user) {

    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public record LoginUser(UUID id, String name, String email) {
    }
}
