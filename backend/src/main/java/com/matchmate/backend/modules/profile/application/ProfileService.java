package com.matchmate.backend.modules.profile.application;

import java.util.UUID;

import com.matchmate.backend.global.error.ProblemException;
import com.matchmate.backend.modules.auth.domain.AppUser;
import com.matchmate.backend.modules.auth.domain.UserIds;
import com.matchmate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.matchmate.backend.modules.profile.presentation.dto.ProfileResponse;
import com.matchmate.backend.modules.profile.presentation.dto.UpdateProfileRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ProfileService {

    static final String USER_NOT_FOUND = "USER_NOT_FOUND";

    private final AppUserRepository appUserRepository;

    public ProfileService(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    @Transactional(readOnly = true)
    public ProfileResponse loadOwnProfile(UUID userId) {
        return ProfileResponse.from(findUser(userId));
    }

    @Transactional(readOnly = true)
    public ProfileResponse loadPublicProfile(String rawUserId) {
        UUID userId = UserIds.parse(rawUserId)
                .orElseThrow(() -> ProblemException.notFound(USER_NOT_FOUND, "User not found"));
        return ProfileResponse.from(findUser(userId));
    }

    /**
     * Applies the supplied fields only.
     *
     * @return {@code false} when the request carried no field at all
     */
    public boolean updateProfile(UUID userId, UpdateProfileRequest request) {
        if (request == null || request.isEmpty()) {
            return false;
        }
        AppUser user = findUser(userId);
        if (request.name() != null) {
            user.setName(request.name().trim());
        }
        if (request.gender() != null) {
            user.setGender(request.gender());
        }
        if (request.dateOfBirth() != null) {
            user.setDateOfBirth(request.dateOfBirth());
        }
        if (request.location() != null) {
            user.setLocation(request.location());
        }
        if (request.bio() != null) {
            user.setBio(request.bio());
        }
        if (request.interests() != null) {
            user.setInterests(request.interests());
        }
        if (request.photos() != null) {
            user.setPhotos(request.photos());
        }
        appUserRepository.save(user);
        return true;
    }

    private AppUser findUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound(USER_NOT_FOUND, "User not found"));
    }
}
