package com.matchmate.backend.modules.system.presentation.dto;

public record RootResponse(String message) {
}
