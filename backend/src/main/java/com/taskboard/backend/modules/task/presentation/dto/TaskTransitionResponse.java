package com.taskboard.backend.modules.task.presentation.dto;

import java.util.List;
import java.util.UUID;

/**
 * @param unblockedTaskIds dependents that no longer have an open prerequisite after this transition
 */
public record TaskTransitionResponse(
        TaskResponse task,
        List<UUID> unblockedTaskIds
) {
}
