package com.taskboard.backend.modules.task.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskboard.backend.modules.task.domain.TaskPriority;
import com.taskboard.backend.modules.task.domain.TaskStatus;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged. A status runs through the usual transition rules.
 */
public record UpdateTaskRequest(
        @Size(min = 1, max = 255) String title,
        @Size(max = 10000) String description,
        UUID projectId,
        TaskStatus status,
        TaskPriority priority,
        OffsetDateTime dueDate,
        @PositiveOrZero Integer position,
        @PositiveOrZero Integer estimatedHours,
        @PositiveOrZero Integer actualHours
) {
}
