package com.taskboard.backend.modules.task.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Task lifecycle. Active statuses are TODO, IN_PROGRESS and IN_REVIEW; DONE and CANCELLED are completed.
 */
public enum TaskStatus {
    TODO,
    IN_PROGRESS,
    IN_REVIEW,
    DONE,
    CANCELLED;

    public static Set<TaskStatus> activeStatuses() {
        return EnumSet.of(TODO, IN_PROGRESS, IN_REVIEW);
    }

    public static Set<TaskStatus> completedStatuses() {
        return EnumSet.of(DONE, CANCELLED);
    }

    public boolean isActive() {
        return this == TODO || this == IN_PROGRESS || this == IN_REVIEW;
    }

    public boolean isCompleted() {
        return this == DONE || this == CANCELLED;
    }

    /**
     * Statuses a blocked task may not enter.
     */
    public boolean requiresUnblocked() {
        return this == IN_PROGRESS || this == IN_REVIEW || this == DONE;
    }

    public Set<TaskStatus> allowedTargets() {
        return switch (this) {
            case TODO -> EnumSet.of(IN_PROGRESS, DONE, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(IN_REVIEW, DONE, CANCELLED);
            case IN_REVIEW -> EnumSet.of(IN_PROGRESS, DONE, CANCELLED);
            case DONE, CANCELLED -> EnumSet.of(TODO);
        };
    }

    public boolean canTransitionTo(TaskStatus target) {
        return target != null && allowedTargets().contains(target);
    }
}
