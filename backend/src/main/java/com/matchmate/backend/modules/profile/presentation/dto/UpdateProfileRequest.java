package com.matchmate.backend.modules.profile.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;

/**
 * Partial profile update; a {@code null} field leaves the stored value untouched.
 */
public record UpdateProfileRequest(
        @Size(min = 1, max = 100) String name,
        @Size(max = 50) String gender,
        @Past(message = "date_of_birth must be in the past") LocalDate dateOfBirth,
        @Size(max = 200) String location,
        @Size(max = 2000) String bio,
        @Size(max = 50) List<@NotBlank String> interests,
        @Size(max = 20) List<@NotBlank String> photos
) {

    public boolean isEmpty() {
        return name == null
                && gender == null
                && dateOfBirth == null
                && location == null
                && bio == null
                && interests == null
                && photos == null;
    }
}
