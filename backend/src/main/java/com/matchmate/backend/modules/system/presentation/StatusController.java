package com.matchmate.backend.modules.system.presentation;

import com.matchmate.backend.modules.system.application.DiagnosticsService;
import com.matchmate.backend.modules.system.presentation.dto.DiagnosticsResponse;
import com.matchmate.backend.modules.system.presentation.dto.RootResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Status")
public class StatusController {

    static final String ROOT_MESSAGE = "Matchmate API running";

    private final DiagnosticsService diagnosticsService;

    public StatusController(DiagnosticsService diagnosticsService) {
        this.diagnosticsService = diagnosticsService;
    }

    @GetMapping("/")
    public RootResponse root() {
        return new RootResponse(ROOT_MESSAGE);
    }

    @GetMapping("/test")
    @Operation(summary = "Backend and database diagnostics")
    public DiagnosticsResponse diagnostics() {
        return diagnosticsService.diagnose();
    }
}
