package com.matchmate.backend.modules.discovery.presentation;

import com.matchmate.backend.global.security.SecurityUtils;
import com.matchmate.backend.modules.discovery.application.DiscoveryService;
import com.matchmate.backend.modules.discovery.presentation.dto.DiscoverResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Discovery")
public class DiscoveryController {

    private final DiscoveryService discoveryService;

    public DiscoveryController(DiscoveryService discoveryService) {
        this.discoveryService = discoveryService;
    }

    @GetMapping("/discover")
    @Operation(summary = "Candidates the current user has not swiped on yet")
    public ResponseEntity<DiscoverResponse> discover() {
        return ResponseEntity.ok(new DiscoverResponse(discoveryService.discover(SecurityUtils.getCurrentUserId())));
    }
}
