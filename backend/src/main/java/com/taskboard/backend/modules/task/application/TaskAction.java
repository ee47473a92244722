package com.taskboard.backend.modules.task.application;

import com.taskboard.backend.modules.task.domain.TaskStatus;

public enum TaskAction {
    START(TaskStatus.IN_PROGRESS),
    SUBMIT_FOR_REVIEW(TaskStatus.IN_REVIEW),
    COMPLETE(TaskStatus.DONE),
    CANCEL(TaskStatus.CANCELLED),
    REOPEN(TaskStatus.TODO);

    private final TaskStatus target;

    TaskAction(TaskStatus target) {
        this.target = target;
    }

    public TaskStatus getTarget() {
        return target;
    }
}
