package com.matchmate.backend.modules.match;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import com.matchmate.backend.modules.match.domain.MatchPair;

import org.junit.jupiter.api.Test;

class MatchPairTest {

    private static final UUID ALICE = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID BOB = UUID.fromString("00000000-0000-0000-0000-000000000002");

    @Test
    void bothOrderingsProduceTheSamePair() {
        MatchPair forward = MatchPair.of(ALICE, BOB);
        MatchPair backward = MatchPair.of(BOB, ALICE);

        assertThat(forward).isEqualTo(backward);
        assertThat(forward.low()).isEqualTo(ALICE);
        assertThat(forward.high()).isEqualTo(BOB);
    }

    @Test
    void ordersByStringFormNotBySignedUuidComparison() {
        UUID highBitSet = UUID.fromString("80000000-0000-0000-0000-000000000000");
        UUID lowBitSet = UUID.fromString("10000000-0000-0000-0000-000000000000");
        assertThat(highBitSet.compareTo(lowBitSet)).isNegative();

        MatchPair pair = MatchPair.of(highBitSet, lowBitSet);

        assertThat(pair.low()).isEqualTo(lowBitSet);
        assertThat(pair.high()).isEqualTo(highBitSet);
    }

    @Test
    void rejectsSelfPair() {
        assertThatThrownBy(() -> MatchPair.of(ALICE, ALICE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonCanonicalConstruction() {
        assertThatThrownBy(() -> new MatchPair(BOB, ALICE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void partnerOfReturnsTheOtherSide() {
        MatchPair pair = MatchPair.of(BOB, ALICE);

        assertThat(pair.partnerOf(ALICE)).isEqualTo(BOB);
        assertThat(pair.partnerOf(BOB)).isEqualTo(ALICE);
        assertThat(pair.contains(ALICE)).isTrue();
        assertThatThrownBy(() -> pair.partnerOf(UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lockKeyDoesNotDependOnArgumentOrder() {
        UUID first = UUID.fromString("7f000000-0000-0000-0000-000000000001");
        UUID second = UUID.fromString("80000000-0000-0000-0000-000000000002");

        assertThat(MatchPair.of(first, second).lockKey()).isEqualTo(MatchPair.of(second, first).lockKey());
    }
}
