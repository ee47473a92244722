package com.taskboard.backend.modules.activity.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.taskboard.backend.global.web.PageResponse;
import com.taskboard.backend.global.web.Pagination;
import com.taskboard.backend.modules.activity.domain.ActivityEventType;
import com.taskboard.backend.modules.activity.domain.ActivityLog;
import com.taskboard.backend.modules.activity.infrastructure.persistence.ActivityLogRepository;
import com.taskboard.backend.modules.activity.presentation.dto.ActivityResponse;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.team.application.TeamAccessPolicy;
import com.taskboard.backend.modules.team.domain.TeamRole;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ActivityLogService {

    private final ActivityLogRepository activityLogRepository;
    private final TeamAccessPolicy teamAccessPolicy;
    private final EntityManager entityManager;
    private final Clock clock;

    public ActivityLogService(
            ActivityLogRepository activityLogRepository,
            TeamAccessPolicy teamAccessPolicy,
            EntityManager entityManager,
            Clock clock
    ) {
        this.activityLogRepository = activityLogRepository;
        this.teamAccessPolicy = teamAccessPolicy;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Transactional
    public void record(ActivityCommand command) {
        Objects.requireNonNull(command.eventType(), "eventType is required");
        Objects.requireNonNull(command.teamId(), "teamId is required");

        ActivityLog entry = new ActivityLog();
        entry.setEventType(command.eventType());
        entry.setTeamId(command.teamId());
        entry.setProjectId(command.projectId());
        entry.setTaskId(command.taskId());
        entry.setCreatedAt(OffsetDateTime.now(clock));

        if (command.actorUserId() != null) {
            entry.setActor(entityManager.getReference(AppUser.class, command.actorUserId()));
        }
        if (command.detail() != null && !command.detail().isEmpty()) {
            entry.setDetail(new LinkedHashMap<>(command.detail()));
        }

        activityLogRepository.save(entry);
    }

    @Transactional(readOnly = true)
    public PageResponse<ActivityResponse> listTeamActivity(UUID teamId, UUID actorId, int page, int size) {
        teamAccessPolicy.requireRole(teamId, actorId, TeamRole.VIEWER);
        return PageResponse.from(
                activityLogRepository.findByTeamIdNewestFirst(teamId, Pagination.of(page, size)),
                ActivityResponse::from
        );
    }

    public record ActivityCommand(
            ActivityEventType eventType,
            UUID teamId,
            UUID actorUserId,
            UUID projectId,
            UUID taskId,
            Map<String, Object> detail
    ) {

        public static ActivityCommand team(ActivityEventType type, UUID teamId, UUID actorUserId, Map<String, Object> detail) {
            return new ActivityCommand(type, teamId, actorUserId, null, null, detail);
        }

        public static ActivityCommand project(ActivityEventType type, UUID teamId, UUID projectId, UUID actorUserId,
                                              Map<String, Object> detail) {
            return new ActivityCommand(type, teamId, actorUserId, projectId, null, detail);
        }

        public static ActivityCommand task(ActivityEventType type, UUID teamId, UUID projectId, UUID taskId,
                                           UUID actorUserId, Map<String, Object> detail) {
            return new ActivityCommand(type, teamId, actorUserId, projectId, taskId, detail);
        }
    }
}
