package com.matchmate.backend.modules.match.domain;

/**
 * Result of evaluating a swipe. {@code created} is only true for the call that inserted the match row.
 */
public record MatchOutcome(boolean matched, boolean created) {

    private static final MatchOutcome NO_MATCH = new MatchOutcome(false, false);

    public MatchOutcome {
        if (created && !matched) {
            throw new IllegalArgumentException("created implies matched");
        }
    }

    public static MatchOutcome noMatch() {
        return NO_MATCH;
    }

    public static MatchOutcome matched(boolean created) {
        return new MatchOutcome(true, created);
    }
}
