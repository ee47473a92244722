package com.taskboard.backend.modules.task.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.taskboard.backend.modules.task.domain.TaskPriority;
import com.taskboard.backend.modules.task.domain.TaskStatus;

public record TaskResponse(
        UUID id,
        UUID teamId,
        UUID projectId,
        UUID creatorId,
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        int priorityScore,
        OffsetDateTime dueDate,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt,
        int position,
        Integer estimatedHours,
        Integer actualHours,
        boolean archived,
        boolean overdue,
        Long daysUntilDue,
        boolean blocked,
        long blockingTasksCount,
        List<UUID> assigneeIds,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
