package com.matchmate.backend.modules.swipe.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.matchmate.backend.modules.swipe.domain.Swipe;
import com.matchmate.backend.modules.swipe.domain.SwipeAction;
import com.matchmate.backend.modules.swipe.infrastructure.persistence.SwipeRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only record of swipe decisions.
 */
@Service
@Transactional
public class SwipeLedger {

    private final SwipeRepository swipeRepository;
    private final Clock clock;

    public SwipeLedger(SwipeRepository swipeRepository, Clock clock) {
        this.swipeRepository = swipeRepository;
        this.clock = clock;
    }

    /**
     * Appends a new record. Earlier swipes on the same target are neither checked nor replaced.
     */
    public Swipe recordSwipe(UUID actorId, UUID targetId, SwipeAction action) {
        Swipe swipe = new Swipe(actorId, targetId, action, OffsetDateTime.now(clock));
        return swipeRepository.save(swipe);
    }

    @Transactional(readOnly = true)
    public boolean hasLiked(UUID actorId, UUID targetId) {
        return swipeRepository.existsByActorIdAndTargetIdAndAction(actorId, targetId, SwipeAction.LIKE);
    }

    /**
     * Distinct targets the actor has swiped on, whatever the action.
     */
    @Transactional(readOnly = true)
    public Set<UUID> swipedTargets(UUID actorId) {
        return swipeRepository.findTargetIdsByActorId(actorId);
    }
}
