package com.taskboard.backend.modules.task.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record AddDependencyRequest(
        @NotNull(message = "prerequisiteTaskId is required") UUID prerequisiteTaskId
) {
}
