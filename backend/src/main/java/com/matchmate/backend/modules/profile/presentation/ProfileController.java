package com.matchmate.backend.modules.profile.presentation;

import com.matchmate.backend.global.security.SecurityUtils;
import com.matchmate.backend.modules.profile.application.ProfileService;
import com.matchmate.backend.modules.profile.presentation.dto.ProfileResponse;
import com.matchmate.backend.modules.profile.presentation.dto.UpdateProfileRequest;
import com.matchmate.backend.modules.profile.presentation.dto.UpdateProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Profiles")
public class ProfileController {

    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping("/me")
    @Operation(summary = "Current user's profile")
    public ResponseEntity<ProfileResponse> currentUser() {
        return ResponseEntity.ok(profileService.loadOwnProfile(SecurityUtils.getCurrentUserId()));
    }

    @PutMapping("/me")
    @Operation(summary = "Partially update the current user's profile")
    public ResponseEntity<UpdateProfileResponse> updateCurrentUser(@Valid @RequestBody UpdateProfileRequest request) {
        boolean updated = profileService.updateProfile(SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.ok(new UpdateProfileResponse(updated));
    }

    @GetMapping("/profile/{userId}")
    @Operation(summary = "Public profile of any user")
    public ResponseEntity<ProfileResponse> publicProfile(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(profileService.loadPublicProfile(userId));
    }
}
