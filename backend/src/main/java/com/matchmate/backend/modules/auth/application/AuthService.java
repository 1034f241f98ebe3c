package com.matchmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;

import com.matchmate.backend.global.error.ProblemException;
import com.matchmate.backend.global.security.SessionAuthenticationPrincipal;
import com.matchmate.backend.modules.auth.application.SessionTokenService.IssuedToken;
import com.matchmate.backend.modules.auth.domain.AppUser;
import com.matchmate.backend.modules.auth.domain.UserSession;
import com.matchmate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.matchmate.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.matchmate.backend.modules.auth.presentation.dto.LoginRequest;
import com.matchmate.backend.modules.auth.presentation.dto.LoginResponse;
import com.matchmate.backend.modules.auth.presentation.dto.SignupRequest;
import com.matchmate.backend.modules.auth.presentation.dto.SignupResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    static final String EMAIL_ALREADY_REGISTERED = "EMAIL_ALREADY_REGISTERED";
    static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository appUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final SessionTokenService sessionTokenService;
    private final Clock clock;

    public AuthService(
            AppUserRepository appUserRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            SessionTokenService sessionTokenService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.sessionTokenService = sessionTokenService;
        this.clock = clock;
    }

    public SignupResponse signup(SignupRequest request) {
        String email = normalizeEmail(request.email());
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.badRequest(EMAIL_ALREADY_REGISTERED, "Email already registered");
        }

        AppUser user = new AppUser();
        user.setName(request.name().trim());
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setActive(true);

        AppUser saved;
        try {
            saved = appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent signup got past the existence check; the unique index decides
            throw ProblemException.badRequest(EMAIL_ALREADY_REGISTERED, "Email already registered");
        }

        log.info("Registered user {}", saved.getId());
        return new SignupResponse(saved.getId(), saved.getEmail(), saved.getName());
    }

    public LoginResponse login(LoginRequest request) {
        String email = normalizeEmail(request.email());
        AppUser user = appUserRepository.findByEmailIgnoreCase(email)
                .orElseThrow(() -> rejectCredentials(email));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw rejectCredentials(email);
        }

        IssuedToken issued = sessionTokenService.issue();
        UserSession session = new UserSession();
        session.setUser(user);
        session.setTokenHash(issued.tokenHash());
        session.setIssuedAt(issued.issuedAt());
        session.setExpiresAt(issued.expiresAt());
        userSessionRepository.save(session);

        log.info("Issued session for user {} valid until {}", user.getId(), issued.expiresAt());
        return new LoginResponse(
                issued.token(),
                LoginResponse.DEFAULT_TOKEN_TYPE,
                issued.expiresAt(),
                new LoginResponse.LoginUser(user.getId(), user.getName(), user.getEmail())
        );
    }

    @Transactional(readOnly = true)
    public Optional<SessionAuthenticationPrincipal> resolveSession(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return Optional.empty();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userSessionRepository.findActiveByTokenHash(sessionTokenService.hash(rawToken), now)
                .map(UserSession::getUser)
                .map(user -> new SessionAuthenticationPrincipal(user.getId(), user.getEmail()));
    }

    private ProblemException rejectCredentials(String email) {
        log.warn("Rejected login attempt for {}", email);
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS, "Invalid credentials");
    }

    private String normalizeEmail(String rawEmail) {
        return rawEmail == null ? "" : rawEmail.trim().toLowerCase(Locale.ROOT);
    }
}
