package com.matchmate.backend.modules.auth.presentation;

import com.matchmate.backend.modules.auth.application.AuthService;
import com.matchmate.backend.modules.auth.presentation.dto.LoginRequest;
import com.matchmate.backend.modules.auth.presentation.dto.LoginResponse;
import com.matchmate.backend.modules.auth.presentation.dto.SignupRequest;
import com.matchmate.backend.modules.auth.presentation.dto.SignupResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth", description = "Account creation and bearer sessions")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/signup")
    @Operation(summary = "Create an account")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.ok(authService.signup(request));
    }

    @PostMapping("/auth/login")
    @Operation(summary = "Exchange credentials for a 7-day bearer token")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }
}
