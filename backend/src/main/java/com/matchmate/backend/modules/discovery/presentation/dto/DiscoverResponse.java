package com.matchmate.backend.modules.discovery.presentation.dto;

import java.util.List;

import com.matchmate.backend.modules.profile.presentation.dto.ProfileResponse;

public record DiscoverResponse(List<ProfileResponse> profiles) {
}
