package com.matchmate.backend.global.security;

import java.util.UUID;

public record SessionAuthenticationPrincipal(UUID userId, String email) {
}
