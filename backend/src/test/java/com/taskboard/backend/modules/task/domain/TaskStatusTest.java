package com.taskboard.backend.modules.task.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class TaskStatusTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "TODO, IN_PROGRESS",
            "TODO, DONE",
            "TODO, CANCELLED",
            "IN_PROGRESS, IN_REVIEW",
            "IN_PROGRESS, DONE",
            "IN_REVIEW, IN_PROGRESS",
            "IN_REVIEW, DONE",
            "DONE, TODO",
            "CANCELLED, TODO"
    })
    void allowsLifecycleTransitions(TaskStatus from, TaskStatus to) {
        assertThat(from.canTransitionTo(to)).isTrue();
    }

    @ParameterizedTest(name = "{0} -/-> {1}")
    @CsvSource({
            "TODO, IN_REVIEW",
            "DONE, IN_PROGRESS",
            "DONE, CANCELLED",
            "CANCELLED, DONE",
            "IN_REVIEW, TODO"
    })
    void rejectsSkippedOrBackwardTransitions(TaskStatus from, TaskStatus to) {
        assertThat(from.canTransitionTo(to)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(TaskStatus.class)
    void neverTransitionsToItselfOrNull(TaskStatus status) {
        assertThat(status.canTransitionTo(status)).isFalse();
        assertThat(status.canTransitionTo(null)).isFalse();
    }

    @Test
    @DisplayName("active and completed statuses partition the lifecycle")
    void activeAndCompletedArePartition() {
        for (TaskStatus status : TaskStatus.values()) {
            assertThat(status.isActive()).isNotEqualTo(status.isCompleted());
            assertThat(TaskStatus.activeStatuses().contains(status)).isEqualTo(status.isActive());
            assertThat(TaskStatus.completedStatuses().contains(status)).isEqualTo(status.isCompleted());
        }
    }

    @Test
    void blockedTasksMayOnlyBeCancelledOrReset() {
        assertThat(TaskStatus.IN_PROGRESS.requiresUnblocked()).isTrue();
        assertThat(TaskStatus.DONE.requiresUnblocked()).isTrue();
        assertThat(TaskStatus.CANCELLED.requiresUnblocked()).isFalse();
        assertThat(TaskStatus.TODO.requiresUnblocked()).isFalse();
    }

    @Test
    void priorityComparesByScore() {
        assertThat(TaskPriority.URGENT.isHigherThan(TaskPriority.HIGH)).isTrue();
        assertThat(TaskPriority.LOW.isHigherThan(TaskPriority.MEDIUM)).isFalse();
    }
}
