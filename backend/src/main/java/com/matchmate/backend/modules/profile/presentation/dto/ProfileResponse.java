package com.matchmate.backend.modules.profile.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

import com.matchmate.backend.modules.auth.domain.AppUser;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Profile view of a user. Never carries the credential hash.
 */
public record ProfileResponse(
        String id,
        String name,
        String email,
        String gender,
        LocalDate dateOfBirth,
        String location,
        String bio,
        List<String> interests,
        List<String> photos,
        @JsonProperty("is_active") boolean isActive,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ProfileResponse from(AppUser user) {
        return new ProfileResponse(
                user.getId() != null ? user.getId().toString() : null,
                user.getName(),
                user.getEmail(),
                user.getGender(),
                user.getDateOfBirth(),
                user.getLocation(),
                user.getBio(),
                List.copyOf(user.getInterests()),
                List.copyOf(user.getPhotos()),
                user.isActive(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
