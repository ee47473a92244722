package com.taskboard.backend.modules.activity.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.taskboard.backend.modules.activity.domain.ActivityEventType;
import com.taskboard.backend.modules.activity.domain.ActivityLog;
import com.taskboard.backend.modules.auth.presentation.dto.UserSummaryResponse;

public record ActivityResponse(
        UUID id,
        ActivityEventType eventType,
        UUID teamId,
        UUID projectId,
        UUID taskId,
        UserSummaryResponse actor,
        Map<String, Object> detail,
        OffsetDateTime createdAt
) {

    public static ActivityResponse from(ActivityLog log) {
        return new ActivityResponse(
                log.getId(),
                log.getEventType(),
                log.getTeamId(),
                log.getProjectId(),
                log.getTaskId(),
                UserSummaryResponse.from(log.getActor()),
                log.getDetail() != null ? log.getDetail() : Map.of(),
                log.getCreatedAt()
        );
    }
}
