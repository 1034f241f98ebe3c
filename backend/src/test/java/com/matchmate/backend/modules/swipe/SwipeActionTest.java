package com.matchmate.backend.modules.swipe;

import static org.assertj.core.api.Assertions.assertThat;

import com.matchmate.backend.modules.swipe.domain.SwipeAction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SwipeActionTest {

    @Test
    void parsesWireValues() {
        assertThat(SwipeAction.fromWire("like")).contains(SwipeAction.LIKE);
        assertThat(SwipeAction.fromWire("pass")).contains(SwipeAction.PASS);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " like", "Like", "PASS", "superlike", "block"})
    void rejectsAnythingElse(String raw) {
        assertThat(SwipeAction.fromWire(raw)).isEmpty();
    }

    @Test
    void rejectsNull() {
        assertThat(SwipeAction.fromWire(null)).isEmpty();
    }
}
