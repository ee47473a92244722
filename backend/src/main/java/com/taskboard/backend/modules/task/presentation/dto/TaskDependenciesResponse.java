package com.taskboard.backend.modules.task.presentation.dto;

import java.util.List;
import java.util.UUID;

public record TaskDependenciesResponse(
        UUID taskId,
        List<TaskReference> prerequisites,
        List<TaskReference> dependents,
        boolean blocked
) {
}
