package com.matchmate.backend.modules.match.presentation;

import com.matchmate.backend.global.security.SecurityUtils;
import com.matchmate.backend.modules.match.application.MatchService;
import com.matchmate.backend.modules.match.presentation.dto.MatchListResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Matches")
public class MatchController {

    private final MatchService matchService;

    public MatchController(MatchService matchService) {
        this.matchService = matchService;
    }

    @GetMapping("/matches")
    @Operation(summary = "Profiles of everyone the current user has matched with")
    public ResponseEntity<MatchListResponse> matches() {
        return ResponseEntity.ok(new MatchListResponse(matchService.listMatches(SecurityUtils.getCurrentUserId())));
    }
}
