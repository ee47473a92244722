package com.taskboard.backend.modules.team.presentation.dto;

import java.util.UUID;

import com.taskboard.backend.modules.team.domain.TeamRole;

import jakarta.validation.constraints.Email;

/**
 * Identifies the invitee by {@code userId} or {@code email}; userId wins when both are present.
 */
public record InviteMemberRequest(
        UUID userId,
        @Email String email,
        TeamRole role
) {
}
