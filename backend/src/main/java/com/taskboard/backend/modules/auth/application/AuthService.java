package com.taskboard.backend.modules.auth.application;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.domain.UserSession;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.taskboard.backend.modules.auth.presentation.dto.LoginRequest;
import com.taskboard.backend.modules.auth.presentation.dto.LoginResponse;
import com.taskboard.backend.modules.auth.presentation.dto.LogoutRequest;
import com.taskboard.backend.modules.auth.presentation.dto.RefreshRequest;
import com.taskboard.backend.modules.auth.presentation.dto.RegisterRequest;
import com.taskboard.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.taskboard.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.taskboard.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String REASON_EXPIRED = "EXPIRED";
    static final String REASON_ROTATED = "ROTATED";
    static final String REASON_LOGOUT = "LOGOUT";
    static final String REASON_DEVICE_MISMATCH = "DEVICE_MISMATCH";
    static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final AppUserRepository appUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthService(
            AppUserRepository appUserRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    public UserProfileResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "email is already registered");
        }

        AppUser user = new AppUser();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFirstName(request.firstName().trim());
        user.setLastName(request.lastName().trim());
        user.setTimezone(resolveTimezone(request.timezone()));

        AppUser saved = appUserRepository.save(user);
        log.info("Registered user {}", saved.getId());
        return UserProfileResponse.from(saved);
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(AuthService::invalidCredentials);

        if (!user.canLogin()) {
            throw invalidCredentials();
        }
        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw invalidCredentials();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        user.setLastLoginAt(now);
        revokeExpiredSessions(user.getId(), now);

        String refreshToken = generateRefreshToken();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user.getId(), user.getEmail(), refreshToken);
        persistSession(user, refreshToken, tokens, normalizeDeviceId(request.deviceId()));

        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }

    /**
     * Rotates a refresh token. Revocations made before a rejection are kept.
     */
    @Transactional(noRollbackFor = ResponseStatusException.class)
    public LoginResponse refresh(RefreshRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findByRefreshTokenHash(RefreshTokenHasher.hash(request.refreshToken()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN"));

        if (session.isRevoked()) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }

        if (!session.getExpiresAt().isAfter(now)) {
            revokeSession(session, REASON_EXPIRED, now);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_EXPIRED");
        }

        String requestDeviceId = normalizeDeviceId(request.deviceId());
        String sessionDeviceId = normalizeDeviceId(session.getDeviceId());
        if (sessionDeviceId != null && requestDeviceId != null && !Objects.equals(sessionDeviceId, requestDeviceId)) {
            revokeSession(session, REASON_DEVICE_MISMATCH, now);
            log.warn("Refresh token device mismatch for user {}", session.getUser().getId());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_DEVICE_MISMATCH");
        }

        AppUser user = session.getUser();
        if (!user.canLogin()) {
            revokeSession(session, REASON_USER_INACTIVE, now);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "USER_INACTIVE");
        }

        // one refresh token, one use
        revokeSession(session, REASON_ROTATED, now);
        revokeExpiredSessions(user.getId(), now);

        String refreshToken = generateRefreshToken();
        String effectiveDeviceId = requestDeviceId != null ? requestDeviceId : sessionDeviceId;
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user.getId(), user.getEmail(), refreshToken);
        persistSession(user, refreshToken, tokens, effectiveDeviceId);

        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }

    public void logout(LogoutRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        // unknown tokens get the same response
        userSessionRepository.revokeByRefreshTokenHash(RefreshTokenHasher.hash(request.refreshToken()), now, REASON_LOGOUT);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        return UserProfileResponse.from(loadActiveUser(userId));
    }

    public UserProfileResponse updateProfile(UUID userId, UpdateProfileRequest request) {
        AppUser user = loadActiveUser(userId);

        String email = request.email() != null ? normalizeEmail(request.email()) : null;
        if (email != null && !email.equalsIgnoreCase(user.getEmail()) && appUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "email is already registered");
        }
        String timezone = request.timezone() != null ? resolveTimezone(request.timezone()) : null;

        // all inputs are valid past this point
        if (email != null) {
            user.setEmail(email);
        }
        if (request.firstName() != null) {
            user.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName().trim());
        }
        if (timezone != null) {
            user.setTimezone(timezone);
        }
        return UserProfileResponse.from(appUserRepository.save(user));
    }

    @Transactional(readOnly = true)
    public AppUser loadActiveUser(UUID userId) {
        return appUserRepository.findById(userId)
                .filter(user -> !user.isDeleted())
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "user not found"));
    }

    private void revokeSession(UserSession session, String reason, OffsetDateTime now) {
        session.setRevokedAt(now);
        session.setRevokedReason(reason);
        userSessionRepository.save(session);
    }

    private void persistSession(AppUser user, String refreshToken, TokenPairResponse tokens, String deviceId) {
        OffsetDateTime issuedAt = tokens.issuedAt();

        UserSession session = new UserSession();
        session.setUser(user);
        session.setRefreshTokenHash(RefreshTokenHasher.hash(refreshToken));
        session.setIssuedAt(issuedAt);
        session.setExpiresAt(issuedAt.plusSeconds(tokens.refreshExpiresIn()));
        session.setDeviceId(deviceId);

        userSessionRepository.save(session);
    }

    private void revokeExpiredSessions(UUID userId, OffsetDateTime now) {
        userSessionRepository.revokeExpiredSessions(userId, now, REASON_EXPIRED);
    }

    private static String generateRefreshToken() {
        return UUID.randomUUID() + "." + UUID.randomUUID();
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static String resolveTimezone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return AppUser.DEFAULT_TIMEZONE;
        }
        try {
            return ZoneId.of(timezone.trim()).getId();
        } catch (DateTimeException ex) {
            throw ProblemException.unprocessable("INVALID_TIMEZONE", "unknown timezone: " + timezone);
        }
    }

    static String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > DEVICE_ID_MAX_LENGTH) {
            return trimmed.substring(0, DEVICE_ID_MAX_LENGTH);
        }
        return trimmed;
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "invalid email or password");
    }
}
