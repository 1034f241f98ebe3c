package com.matchmate.backend.modules.swipe.application;

import java.util.UUID;

import com.matchmate.backend.global.error.ProblemException;
import com.matchmate.backend.modules.auth.domain.UserIds;
import com.matchmate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.matchmate.backend.modules.match.application.MatchEngine;
import com.matchmate.backend.modules.match.domain.MatchOutcome;
import com.matchmate.backend.modules.swipe.domain.SwipeAction;
import com.matchmate.backend.modules.swipe.presentation.dto.SwipeRequest;
import com.matchmate.backend.modules.swipe.presentation.dto.SwipeResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SwipeService {

    static final String INVALID_SWIPE_ACTION = "INVALID_SWIPE_ACTION";
    static final String SELF_SWIPE_NOT_ALLOWED = "SELF_SWIPE_NOT_ALLOWED";
    static final String USER_NOT_FOUND = "USER_NOT_FOUND";

    private static final Logger log = LoggerFactory.getLogger(SwipeService.class);

    private final SwipeLedger swipeLedger;
    private final MatchEngine matchEngine;
    private final AppUserRepository appUserRepository;

    public SwipeService(SwipeLedger swipeLedger, MatchEngine matchEngine, AppUserRepository appUserRepository) {
        this.swipeLedger = swipeLedger;
        this.matchEngine = matchEngine;
        this.appUserRepository = appUserRepository;
    }

    /**
     * Records the swipe, then evaluates it for a mutual like.
     */
    public SwipeResponse swipe(UUID actorId, SwipeRequest request) {
        SwipeAction action = SwipeAction.fromWire(request.action())
                .orElseThrow(() -> ProblemException.badRequest(INVALID_SWIPE_ACTION, "Invalid action"));

        UUID targetId = UserIds.parse(request.targetId())
                .filter(appUserRepository::existsById)
                .orElseThrow(() -> ProblemException.notFound(USER_NOT_FOUND, "Target user not found"));

        if (targetId.equals(actorId)) {
            throw ProblemException.badRequest(SELF_SWIPE_NOT_ALLOWED, "Users cannot swipe on themselves");
        }

        swipeLedger.recordSwipe(actorId, targetId, action);
        MatchOutcome outcome = matchEngine.evaluateSwipe(actorId, targetId, action);

        log.debug("Swipe {} by {} on {} matched={}", action.wireValue(), actorId, targetId, outcome.matched());
        return SwipeResponse.recorded(outcome.matched());
    }
}
