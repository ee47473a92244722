package com.taskboard.backend.modules.team.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskboard.backend.modules.auth.presentation.dto.UserSummaryResponse;
import com.taskboard.backend.modules.team.domain.TeamMembership;
import com.taskboard.backend.modules.team.domain.TeamRole;

public record TeamMemberResponse(
        UUID membershipId,
        UUID teamId,
        UserSummaryResponse user,
        TeamRole role,
        String status,
        OffsetDateTime invitedAt,
        OffsetDateTime joinedAt,
        UUID invitedBy
) {

    public static final String STATUS_ACTIVE = "ACTIVE";
    public static final String STATUS_PENDING = "PENDING";

    public static TeamMemberResponse from(TeamMembership membership) {
        return new TeamMemberResponse(
                membership.getId(),
                membership.getTeam().getId(),
                UserSummaryResponse.from(membership.getUser()),
                membership.getRole(),
                membership.isPending() ? STATUS_PENDING : STATUS_ACTIVE,
                membership.getInvitedAt(),
                membership.getJoinedAt(),
                membership.getInvitedBy() != null ? membership.getInvitedBy().getId() : null
        );
    }
}
