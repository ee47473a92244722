package com.taskboard.backend.modules.team.application;

import java.util.UUID;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.team.domain.Team;
import com.taskboard.backend.modules.team.domain.TeamMembership;
import com.taskboard.backend.modules.team.domain.TeamRole;
import com.taskboard.backend.modules.team.infrastructure.persistence.TeamMembershipRepository;
import com.taskboard.backend.modules.team.infrastructure.persistence.TeamRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves the acting user's membership in a team and enforces the minimum role for an operation.
 */
@Component
@Transactional(readOnly = true)
public class TeamAccessPolicy {

    private final TeamRepository teamRepository;
    private final TeamMembershipRepository membershipRepository;

    public TeamAccessPolicy(TeamRepository teamRepository, TeamMembershipRepository membershipRepository) {
        this.teamRepository = teamRepository;
        this.membershipRepository = membershipRepository;
    }

    public Team loadTeam(UUID teamId) {
        return teamRepository.findActiveById(teamId)
                .orElseThrow(() -> ProblemException.notFound("TEAM_NOT_FOUND", "team not found"));
    }

    /**
     * @return the actor's active membership, whose role is at least {@code required}
     */
    public TeamMembership requireRole(UUID teamId, UUID userId, TeamRole required) {
        loadTeam(teamId);
        TeamMembership membership = membershipRepository.findByTeamIdAndUserId(teamId, userId)
                .filter(TeamMembership::isActive)
                .orElseThrow(() -> ProblemException.forbidden("TEAM_ACCESS_DENIED", "not a member of this team"));
        if (!membership.getRole().isAtLeast(required)) {
            throw ProblemException.forbidden(
                    "INSUFFICIENT_TEAM_ROLE",
                    "requires " + required + " role, current role is " + membership.getRole()
            );
        }
        return membership;
    }

    public boolean isActiveMember(UUID teamId, UUID userId) {
        return membershipRepository.existsActiveMembership(teamId, userId);
    }
}
