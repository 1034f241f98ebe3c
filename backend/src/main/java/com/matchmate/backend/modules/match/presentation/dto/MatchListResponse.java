package com.matchmate.backend.modules.match.presentation.dto;

import java.util.List;

import com.matchmate.backend.modules.profile.presentation.dto.ProfileResponse;

public record MatchListResponse(List<ProfileResponse> matches) {
}
