package com.taskboard.backend.modules.task.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskboard.backend.modules.auth.presentation.dto.UserSummaryResponse;
import com.taskboard.backend.modules.task.domain.TaskAssignment;

public record TaskAssignmentResponse(
        UUID taskId,
        UserSummaryResponse assignee,
        OffsetDateTime assignedAt,
        UUID assignedBy
) {

    public static TaskAssignmentResponse from(TaskAssignment assignment) {
        return new TaskAssignmentResponse(
                assignment.getTask().getId(),
                UserSummaryResponse.from(assignment.getAssignee()),
                assignment.getAssignedAt(),
                assignment.getAssignedBy() != null ? assignment.getAssignedBy().getId() : null
        );
    }
}
