package com.taskboard.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.taskboard.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class SessionMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceScheduler.class);

    private final UserSessionRepository userSessionRepository;
    private final Clock clock;

    public SessionMaintenanceScheduler(UserSessionRepository userSessionRepository, Clock clock) {
        this.userSessionRepository = userSessionRepository;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.auth.session-cleanup-interval:PT15M}")
    @Transactional
    public void revokeExpiredSessions() {
        int revoked = userSessionRepository.revokeAllExpiredSessions(OffsetDateTime.now(clock), AuthService.REASON_EXPIRED);
        if (revoked > 0) {
            log.info("Revoked {} expired user sessions", revoked);
        }
    }
}
