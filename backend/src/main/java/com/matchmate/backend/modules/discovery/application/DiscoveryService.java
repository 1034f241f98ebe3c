package com.matchmate.backend.modules.discovery.application;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.matchmate.backend.global.error.ProblemException;
import com.matchmate.backend.modules.auth.domain.AppUser;
import com.matchmate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.matchmate.backend.modules.profile.presentation.dto.ProfileResponse;
import com.matchmate.backend.modules.swipe.application.SwipeLedger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Surfaces candidates the requester has not swiped on yet.
 *
 * <p>The scan is capped before filtering: only the first {@code scanLimit} users in store
 * order are looked at, so fewer candidates than exist may come back.
 */
@Service
@Transactional(readOnly = true)
public class DiscoveryService {

    private final AppUserRepository appUserRepository;
    private final SwipeLedger swipeLedger;
    private final CandidateRankingStrategy rankingStrategy;
    private final int scanLimit;

    public DiscoveryService(
            AppUserRepository appUserRepository,
            SwipeLedger swipeLedger,
            CandidateRankingStrategy rankingStrategy,
            @Value("${matchmate.discovery.scan-limit:50}") int scanLimit
    ) {
        if (scanLimit < 1) {
            throw new IllegalArgumentException("matchmate.discovery.scan-limit must be at least 1");
        }
        this.appUserRepository = appUserRepository;
        this.swipeLedger = swipeLedger;
        this.rankingStrategy = rankingStrategy;
        this.scanLimit = scanLimit;
    }

    public List<ProfileResponse> discover(UUID requesterId) {
        AppUser requester = appUserRepository.findById(requesterId)
                .orElseThrow(() -> ProblemException.unauthorized("USER_NOT_FOUND"));

        Set<UUID> excluded = new HashSet<>(swipeLedger.swipedTargets(requesterId));
        excluded.add(requesterId);

        List<AppUser> candidates = appUserRepository.findAll(PageRequest.of(0, scanLimit)).getContent().stream()
                .filter(user -> !excluded.contains(user.getId()))
                .toList();

        return rankingStrategy.rank(requester, candidates).stream()
                .map(ProfileResponse::from)
                .toList();
    }
}
