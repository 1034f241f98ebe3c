package com.matchmate.backend.modules.swipe.presentation.dto;

import jakarta.validation.constraints.NotNull;

/**
 * {@code action} is only required to be present here; its value is checked by the swipe service.
 */
public record SwipeRequest(
        @NotNull(message = "target_id is required") String targetId,
        @NotNull(message = "action is required") String action
) {
}
