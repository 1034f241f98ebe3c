package com.matchmate.backend.modules.swipe.presentation;

import com.matchmate.backend.global.security.SecurityUtils;
import com.matchmate.backend.modules.swipe.application.SwipeService;
import com.matchmate.backend.modules.swipe.presentation.dto.SwipeRequest;
import com.matchmate.backend.modules.swipe.presentation.dto.SwipeResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Swipes")
public class SwipeController {

    private final SwipeService swipeService;

    public SwipeController(SwipeService swipeService) {
        this.swipeService = swipeService;
    }

    @PostMapping("/swipe")
    @Operation(summary = "Like or pass on a candidate", description = "match is true once both users liked each other")
    public ResponseEntity<SwipeResponse> swipe(@Valid @RequestBody SwipeRequest request) {
        return ResponseEntity.ok(swipeService.swipe(SecurityUtils.getCurrentUserId(), request));
    }
}
