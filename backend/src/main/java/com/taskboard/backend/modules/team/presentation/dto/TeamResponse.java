package com.taskboard.backend.modules.team.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskboard.backend.modules.task.domain.TaskPriority;
import com.taskboard.backend.modules.team.domain.Team;
import com.taskboard.backend.modules.team.domain.TeamRole;

public record TeamResponse(
        UUID id,
        String name,
        String slug,
        String description,
        boolean active,
        boolean allowPublicSignup,
        TaskPriority defaultTaskPriority,
        TeamRole myRole,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static TeamResponse from(Team team, TeamRole myRole) {
        return new TeamResponse(
                team.getId(),
                team.getName(),
                team.getSlug(),
                team.getDescription(),
                team.isActive(),
                team.isAllowPublicSignup(),
                team.getDefaultTaskPriority(),
                myRole,
                team.getCreatedAt(),
                team.getUpdatedAt()
        );
    }
}
