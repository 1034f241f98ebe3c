package com.matchmate.backend.modules.match.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.matchmate.backend.modules.match.domain.MatchOutcome;
import com.matchmate.backend.modules.match.domain.MatchPair;
import com.matchmate.backend.modules.match.infrastructure.persistence.MatchRepository;
import com.matchmate.backend.modules.swipe.application.SwipeLedger;
import com.matchmate.backend.modules.swipe.domain.SwipeAction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Derives mutual-match state from the swipe ledger.
 *
 * <p>Per unordered pair the states are no-signal, one-sided-like and matched. A {@code pass}
 * never changes the state and never blocks a later {@code like}; matched is terminal.
 * Match rows are keyed by the canonical {@link MatchPair} and inserted with
 * insert-if-absent, so a pair holds at most one row.
 *
 * <p>The reciprocal lookup runs under a transaction-scoped lock on the pair. Two reciprocal likes
 * racing each other are thereby evaluated one after the other, and the second one sees the first
 * once it has committed.
 */
@Service
@Transactional
public class MatchEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final SwipeLedger swipeLedger;
    private final MatchRepository matchRepository;
    private final Clock clock;

    public MatchEngine(SwipeLedger swipeLedger, MatchRepository matchRepository, Clock clock) {
        this.swipeLedger = swipeLedger;
        this.matchRepository = matchRepository;
        this.clock = clock;
    }

    /**
     * Evaluates a swipe that has just been recorded.
     */
    public MatchOutcome evaluateSwipe(UUID actorId, UUID targetId, SwipeAction action) {
        if (action != SwipeAction.LIKE) {
            return MatchOutcome.noMatch();
        }

        MatchPair pair = MatchPair.of(actorId, targetId);
        matchRepository.lockPair(pair.lockKey());
        if (!swipeLedger.hasLiked(targetId, actorId)) {
            return MatchOutcome.noMatch();
        }

        int inserted = matchRepository.insertIfAbsent(
                UUID.randomUUID(),
                pair.low(),
                pair.high(),
                actorId,
                OffsetDateTime.now(clock)
        );
        if (inserted > 0) {
            log.info("Match created between {} and {}", pair.low(), pair.high());
        }
        return MatchOutcome.matched(inserted > 0);
    }

    /**
     * Order of the arguments is irrelevant.
     */
    @Transactional(readOnly = true)
    public boolean isMatched(UUID first, UUID second) {
        if (first.equals(second)) {
            return false;
        }
        MatchPair pair = MatchPair.of(first, second);
        return matchRepository.existsByUserLowIdAndUserHighId(pair.low(), pair.high());
    }
}
