package com.matchmate.backend.modules.match.application;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.matchmate.backend.modules.auth.domain.AppUser;
import com.matchmate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.matchmate.backend.modules.match.domain.UserMatch;
import com.matchmate.backend.modules.match.infrastructure.persistence.MatchRepository;
import com.matchmate.backend.modules.profile.presentation.dto.ProfileResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class MatchService {

    private final MatchRepository matchRepository;
    private final AppUserRepository appUserRepository;

    public MatchService(MatchRepository matchRepository, AppUserRepository appUserRepository) {
        this.matchRepository = matchRepository;
        this.appUserRepository = appUserRepository;
    }

    /**
     * Partner profiles of every match involving the user, oldest match first.
     * Partners whose account no longer exists are left out.
     */
    public List<ProfileResponse> listMatches(UUID userId) {
        List<UUID> partnerIds = matchRepository.findAllInvolving(userId).stream()
                .map(UserMatch::getPair)
                .map(pair -> pair.partnerOf(userId))
                .distinct()
                .toList();
        if (partnerIds.isEmpty()) {
            return List.of();
        }

        Map<UUID, AppUser> partners = appUserRepository.findAllById(partnerIds).stream()
                .collect(Collectors.toMap(AppUser::getId, Function.identity()));

        return partnerIds.stream()
                .map(partners::get)
                .filter(Objects::nonNull)
                .map(ProfileResponse::from)
                .toList();
    }
}
