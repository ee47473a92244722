package com.taskboard.backend.modules.team.presentation.dto;

import com.taskboard.backend.modules.task.domain.TaskPriority;
import com.taskboard.backend.modules.team.domain.TeamSlugs;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateTeamRequest(
        @NotBlank(message = "name is required") @Size(max = 100) String name,
        @Size(max = 100) @Pattern(regexp = TeamSlugs.PATTERN, message = "slug must be lowercase letters, digits and dashes") String slug,
        @Size(max = 2000) String description,
        Boolean allowPublicSignup,
        TaskPriority defaultTaskPriority
) {
}
