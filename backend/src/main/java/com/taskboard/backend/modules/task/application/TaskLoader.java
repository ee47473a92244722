package com.taskboard.backend.modules.task.application;

import java.util.UUID;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository;

import org.springframework.stereotype.Component;

@Component
public class TaskLoader {

    private final TaskRepository taskRepository;

    public TaskLoader(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    public Task loadActive(UUID taskId) {
        return taskRepository.findActiveById(taskId)
                .orElseThrow(() -> ProblemException.notFound("TASK_NOT_FOUND", "task not found"));
    }
}
