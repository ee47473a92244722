package com.taskboard.backend.modules.project.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskboard.backend.modules.project.domain.Project;
import com.taskboard.backend.modules.project.domain.ProjectStatus;

public record ProjectResponse(
        UUID id,
        UUID teamId,
        String name,
        String description,
        ProjectStatus status,
        OffsetDateTime startDate,
        OffsetDateTime endDate,
        boolean active,
        String color,
        int position,
        Integer estimatedHours,
        boolean overdue,
        Long durationDays,
        Long daysRemaining,
        long taskCount,
        long completedTaskCount,
        double completionPercentage,
        UUID createdBy,
        UUID updatedBy,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ProjectResponse from(Project project, long taskCount, long completedTaskCount, OffsetDateTime now) {
        double completion = taskCount == 0 ? 0.0 : (completedTaskCount * 100.0) / taskCount;
        return new ProjectResponse(
                project.getId(),
                project.getTeam().getId(),
                project.getName(),
                project.getDescription(),
                project.getStatus(),
                project.getStartDate(),
                project.getEndDate(),
                project.isActive(),
                project.getColor(),
                project.getPosition(),
                project.getEstimatedHours(),
                project.isOverdue(now),
                project.getDurationDays(),
                project.getDaysRemaining(now),
                taskCount,
                completedTaskCount,
                completion,
                project.getCreatedBy(),
                project.getUpdatedBy(),
                project.getCreatedAt(),
                project.getUpdatedAt()
        );
    }
}
