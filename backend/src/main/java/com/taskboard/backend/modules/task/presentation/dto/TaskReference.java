package com.taskboard.backend.modules.task.presentation.dto;

import java.util.UUID;

import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.domain.TaskStatus;

public record TaskReference(
        UUID id,
        String title,
        TaskStatus status
) {

    public static TaskReference from(Task task) {
        return new TaskReference(task.getId(), task.getTitle(), task.getStatus());
    }
}
