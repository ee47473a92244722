package com.taskboard.backend.modules.team.presentation.dto;

import com.taskboard.backend.modules.team.domain.TeamRole;

import jakarta.validation.constraints.NotNull;

public record ChangeMemberRoleRequest(
        @NotNull(message = "role is required") TeamRole role
) {
}
