package com.matchmate.backend.modules.match.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Unordered pair of users in canonical form: {@code low} sorts before {@code high} by the
 * lexicographic order of their string ids, which is also the byte order PostgreSQL uses for uuid.
 */
public record MatchPair(UUID low, UUID high) {

    public MatchPair {
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(high, "high");
        if (compare(low, high) >= 0) {
            throw new IllegalArgumentException("MatchPair requires low < high");
        }
    }

    public static MatchPair of(UUID first, UUID second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        int order = compare(first, second);
        if (order == 0) {
            throw new IllegalArgumentException("A user cannot be matched with themselves");
        }
        return order < 0 ? new MatchPair(first, second) : new MatchPair(second, first);
    }

    public boolean contains(UUID userId) {
        return low.equals(userId) || high.equals(userId);
    }

    public UUID partnerOf(UUID userId) {
        if (low.equals(userId)) {
            return high;
        }
        if (high.equals(userId)) {
            return low;
        }
        throw new IllegalArgumentException("User " + userId + " is not part of " + this);
    }

    /**
     * Key for a PostgreSQL advisory lock scoped to this pair. Distinct pairs may collide,
     * which only serializes them needlessly.
     */
    public long lockKey() {
        return 31L * fold(low) + fold(high);
    }

    private static long fold(UUID id) {
        return id.getMostSignificantBits() ^ id.getLeastSignificantBits();
    }

    private static int compare(UUID a, UUID b) {
        return a.toString().compareTo(b.toString());
    }
}
