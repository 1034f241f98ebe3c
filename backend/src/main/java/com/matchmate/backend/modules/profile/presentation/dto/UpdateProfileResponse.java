package com.matchmate.backend.modules.profile.presentation.dto;

public record UpdateProfileResponse(boolean updated) {
}
