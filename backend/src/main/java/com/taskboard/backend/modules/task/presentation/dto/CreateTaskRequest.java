package com.taskboard.backend.modules.task.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.taskboard.backend.modules.task.domain.TaskPriority;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateTaskRequest(
        @NotBlank(message = "title is required") @Size(max = 255) String title,
        @Size(max = 10000) String description,
        UUID projectId,
        TaskPriority priority,
        OffsetDateTime dueDate,
        @PositiveOrZero Integer position,
        @PositiveOrZero Integer estimatedHours,
        @Size(max = 50) List<@NotNull UUID> assigneeIds
) {
}
