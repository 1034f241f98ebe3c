package com.matchmate.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record SignupResponse(UUID id, String email, String name) {
}
