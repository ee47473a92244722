package com.taskboard.backend.modules.task.application;

import java.util.UUID;

import com.taskboard.backend.modules.task.domain.TaskPriority;
import com.taskboard.backend.modules.task.domain.TaskStatus;

public record TaskSearchFilter(
        UUID projectId,
        TaskStatus status,
        TaskPriority priority,
        UUID assigneeId,
        boolean includeArchived
) {

    public static TaskSearchFilter none() {
        return new TaskSearchFilter(null, null, null, null, false);
    }
}
