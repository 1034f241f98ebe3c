package com.matchmate.backend.modules.swipe.domain;

import java.util.Optional;

public enum SwipeAction {
    LIKE("like"),
    PASS("pass");

    private final String wireValue;

    SwipeAction(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Exact, case-sensitive match on {@code like} / {@code pass}.
     */
    public static Optional<SwipeAction> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (SwipeAction action : values()) {
            if (action.wireValue.equals(raw)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
