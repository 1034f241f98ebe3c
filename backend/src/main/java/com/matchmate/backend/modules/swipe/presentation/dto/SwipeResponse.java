package com.matchmate.backend.modules.swipe.presentation.dto;

public record SwipeResponse(boolean ok, boolean match) {

    public static SwipeResponse recorded(boolean match) {
        return new SwipeResponse(true, match);
    }
}
