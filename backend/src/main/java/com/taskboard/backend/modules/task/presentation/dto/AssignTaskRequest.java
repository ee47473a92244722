package com.taskboard.backend.modules.task.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record AssignTaskRequest(
        @NotNull(message = "userId is required") UUID userId
) {
}
