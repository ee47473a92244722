package com.taskboard.backend.modules.team.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.activity.application.ActivityLogService;
import com.taskboard.backend.modules.activity.application.ActivityLogService.ActivityCommand;
import com.taskboard.backend.modules.activity.domain.ActivityEventType;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskAssignmentRepository;
import com.taskboard.backend.modules.team.domain.Team;
import com.taskboard.backend.modules.team.domain.TeamMembership;
import com.taskboard.backend.modules.team.domain.TeamRole;
import com.taskboard.backend.modules.team.domain.TeamSlugs;
import com.taskboard.backend.modules.team.infrastructure.persistence.TeamMembershipRepository;
import com.taskboard.backend.modules.team.infrastructure.persistence.TeamRepository;
import com.taskboard.backend.modules.team.presentation.dto.ChangeMemberRoleRequest;
import com.taskboard.backend.modules.team.presentation.dto.CreateTeamRequest;
import com.taskboard.backend.modules.team.presentation.dto.InviteMemberRequest;
import com.taskboard.backend.modules.team.presentation.dto.TeamMemberResponse;
import com.taskboard.backend.modules.team.presentation.dto.TeamResponse;
import com.taskboard.backend.modules.team.presentation.dto.UpdateTeamRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class TeamService {

    private static final Logger log = LoggerFactory.getLogger(TeamService.class);

    private final TeamRepository teamRepository;
    private final TeamMembershipRepository membershipRepository;
    private final AppUserRepository appUserRepository;
    private final TaskAssignmentRepository taskAssignmentRepository;
    private final TeamAccessPolicy accessPolicy;
    private final ActivityLogService activityLogService;
    private final Clock clock;

    public TeamService(
            TeamRepository teamRepository,
            TeamMembershipRepository membershipRepository,
            AppUserRepository appUserRepository,
            TaskAssignmentRepository taskAssignmentRepository,
            TeamAccessPolicy accessPolicy,
            ActivityLogService activityLogService,
            Clock clock
    ) {
        this.teamRepository = teamRepository;
        this.membershipRepository = membershipRepository;
        this.appUserRepository = appUserRepository;
        this.taskAssignmentRepository = taskAssignmentRepository;
        this.accessPolicy = accessPolicy;
        this.activityLogService = activityLogService;
        this.clock = clock;
    }

    public TeamResponse createTeam(UUID actorId, CreateTeamRequest request) {
        AppUser actor = loadUser(actorId);
        String slug = StringUtils.hasText(request.slug()) ? request.slug() : TeamSlugs.fromName(request.name());
        if (teamRepository.existsBySlug(slug)) {
            throw ProblemException.conflict("TEAM_SLUG_TAKEN", "slug '" + slug + "' is already in use");
        }

        Team team = new Team();
        team.setName(request.name().trim());
        team.setSlug(slug);
        team.setDescription(request.description());
        team.setAllowPublicSignup(Boolean.TRUE.equals(request.allowPublicSignup()));
        if (request.defaultTaskPriority() != null) {
            team.setDefaultTaskPriority(request.defaultTaskPriority());
        }
        Team saved = teamRepository.save(team);

        OffsetDateTime now = OffsetDateTime.now(clock);
        membershipRepository.save(TeamMembership.joined(actor, saved, TeamRole.OWNER, now));
        log.info("Team {} created by {}", saved.getId(), actorId);
        return TeamResponse.from(saved, TeamRole.OWNER);
    }

    @Transactional(readOnly = true)
    public List<TeamResponse> listMyTeams(UUID actorId) {
        return membershipRepository.findActiveByUserId(actorId).stream()
                .map(membership -> TeamResponse.from(membership.getTeam(), membership.getRole()))
                .toList();
    }

    @Transactional(readOnly = true)
    public TeamResponse getTeam(UUID teamId, UUID actorId) {
        TeamMembership membership = accessPolicy.requireRole(teamId, actorId, TeamRole.VIEWER);
        return TeamResponse.from(membership.getTeam(), membership.getRole());
    }

    public TeamResponse updateTeam(UUID teamId, UUID actorId, UpdateTeamRequest request) {
        TeamMembership membership = accessPolicy.requireRole(teamId, actorId, TeamRole.ADMIN);
        Team team = membership.getTeam();

        if (request.slug() != null && !request.slug().equals(team.getSlug())) {
            if (teamRepository.existsBySlug(request.slug())) {
                throw ProblemException.conflict("TEAM_SLUG_TAKEN", "slug '" + request.slug() + "' is already in use");
            }
            team.setSlug(request.slug());
        }
        if (request.name() != null) {
            team.setName(request.name().trim());
        }
        if (request.description() != null) {
            team.setDescription(request.description());
        }
        if (request.allowPublicSignup() != null) {
            team.setAllowPublicSignup(request.allowPublicSignup());
        }
        if (request.defaultTaskPriority() != null) {
            team.setDefaultTaskPriority(request.defaultTaskPriority());
        }
        return TeamResponse.from(teamRepository.save(team), membership.getRole());
    }

    public void deleteTeam(UUID teamId, UUID actorId) {
        TeamMembership membership = accessPolicy.requireRole(teamId, actorId, TeamRole.OWNER);
        Team team = membership.getTeam();
        team.softDelete(OffsetDateTime.now(clock));
        teamRepository.save(team);
        log.info("Team {} deleted by {}", teamId, actorId);
    }

    @Transactional(readOnly = true)
    public List<TeamMemberResponse> listMembers(UUID teamId, UUID actorId) {
        accessPolicy.requireRole(teamId, actorId, TeamRole.VIEWER);
        return membershipRepository.findVisibleByTeamId(teamId).stream()
                .sorted(Comparator.comparing((TeamMembership m) -> m.getRole().getLevel()).reversed())
                .map(TeamMemberResponse::from)
                .toList();
    }

    public TeamMemberResponse inviteMember(UUID teamId, UUID actorId, InviteMemberRequest request) {
        TeamMembership actorMembership = accessPolicy.requireRole(teamId, actorId, TeamRole.ADMIN);
        TeamRole role = request.role() != null ? request.role() : TeamRole.MEMBER;
        if (role.outranks(actorMembership.getRole())) {
            throw ProblemException.forbidden("ROLE_ESCALATION_DENIED", "cannot grant a role above your own");
        }

        AppUser invitee = resolveInvitee(request);
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<TeamMembership> existing = membershipRepository.findByTeamIdAndUserId(teamId, invitee.getId());

        TeamMembership membership;
        if (existing.isPresent()) {
            membership = existing.get();
            if (!membership.isDeleted()) {
                throw ProblemException.conflict("MEMBERSHIP_EXISTS", "user is already a member or invited");
            }
            membership.reinvite(role, actorMembership.getUser(), now);
        } else {
            membership = TeamMembership.invited(invitee, actorMembership.getTeam(), role, actorMembership.getUser(), now);
        }
        TeamMembership saved = membershipRepository.save(membership);

        activityLogService.record(ActivityCommand.team(
                ActivityEventType.TEAM_MEMBER_ADDED,
                teamId,
                actorId,
                Map.of("userId", invitee.getId().toString(), "role", role.name(), "status", TeamMemberResponse.STATUS_PENDING)
        ));
        return TeamMemberResponse.from(saved);
    }

    public TeamMemberResponse acceptInvitation(UUID teamId, UUID actorId) {
        TeamMembership membership = loadPendingInvitation(teamId, actorId);
        membership.accept(OffsetDateTime.now(clock));
        TeamMembership saved = membershipRepository.save(membership);

        activityLogService.record(ActivityCommand.team(
                ActivityEventType.TEAM_MEMBER_ADDED,
                teamId,
                actorId,
                Map.of("userId", actorId.toString(), "role", saved.getRole().name(), "status", TeamMemberResponse.STATUS_ACTIVE)
        ));
        return TeamMemberResponse.from(saved);
    }

    public void declineInvitation(UUID teamId, UUID actorId) {
        TeamMembership membership = loadPendingInvitation(teamId, actorId);
        membership.softDelete(OffsetDateTime.now(clock));
        membershipRepository.save(membership);
    }

    public TeamMemberResponse joinTeam(UUID teamId, UUID actorId) {
        Team team = accessPolicy.loadTeam(teamId);
        Optional<TeamMembership> existing = membershipRepository.findByTeamIdAndUserId(teamId, actorId);
        if (existing.isPresent() && existing.get().isActive()) {
            throw ProblemException.conflict("MEMBERSHIP_EXISTS", "already a member of this team");
        }
        if (!team.isAllowPublicSignup()) {
            throw ProblemException.forbidden("TEAM_INVITE_ONLY", "team requires an invitation");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        TeamMembership membership;
        if (existing.isPresent() && existing.get().isPending()) {
            // joining publicly ignores the role the pending invitation offered
            membership = existing.get();
            membership.setRole(TeamRole.MEMBER);
            membership.accept(now);
        } else if (existing.isPresent()) {
            membership = existing.get();
            membership.reinvite(TeamRole.MEMBER, null, now);
            membership.accept(now);
        } else {
            membership = TeamMembership.joined(loadUser(actorId), team, TeamRole.MEMBER, now);
        }
        TeamMembership saved = membershipRepository.save(membership);

        activityLogService.record(ActivityCommand.team(
                ActivityEventType.TEAM_MEMBER_ADDED,
                teamId,
                actorId,
                Map.of("userId", actorId.toString(), "role", saved.getRole().name(), "status", TeamMemberResponse.STATUS_ACTIVE)
        ));
        return TeamMemberResponse.from(saved);
    }

    public TeamMemberResponse changeMemberRole(UUID teamId, UUID targetUserId, UUID actorId, ChangeMemberRoleRequest request) {
        TeamMembership actorMembership = accessPolicy.requireRole(teamId, actorId, TeamRole.ADMIN);
        TeamMembership target = loadVisibleMembership(teamId, targetUserId);
        TeamRole newRole = request.role();
        TeamRole previousRole = target.getRole();

        requireOutranks(actorMembership, target);
        if (newRole.outranks(actorMembership.getRole())) {
            throw ProblemException.forbidden("ROLE_ESCALATION_DENIED", "cannot grant a role above your own");
        }
        if (previousRole == newRole) {
            return TeamMemberResponse.from(target);
        }
        if (isLastActiveOwner(target)) {
            throw ProblemException.conflict("LAST_OWNER", "team must keep at least one owner");
        }

        target.setRole(newRole);
        TeamMembership saved = membershipRepository.save(target);
        activityLogService.record(ActivityCommand.team(
                ActivityEventType.TEAM_MEMBER_ROLE_CHANGED,
                teamId,
                actorId,
                Map.of("userId", targetUserId.toString(), "from", previousRole.name(), "to", newRole.name())
        ));
        return TeamMemberResponse.from(saved);
    }

    public void removeMember(UUID teamId, UUID targetUserId, UUID actorId) {
        boolean leaving = actorId.equals(targetUserId);
        TeamMembership target;
        if (leaving) {
            accessPolicy.loadTeam(teamId);
            target = loadVisibleMembership(teamId, targetUserId);
        } else {
            TeamMembership actorMembership = accessPolicy.requireRole(teamId, actorId, TeamRole.ADMIN);
            target = loadVisibleMembership(teamId, targetUserId);
            requireOutranks(actorMembership, target);
        }
        if (isLastActiveOwner(target)) {
            throw ProblemException.conflict("LAST_OWNER", "team must keep at least one owner");
        }

        target.softDelete(OffsetDateTime.now(clock));
        membershipRepository.save(target);
        int dropped = taskAssignmentRepository.deleteByTeamIdAndAssigneeId(teamId, targetUserId);
        log.info("Member {} removed from team {} by {}, {} assignments dropped", targetUserId, teamId, actorId, dropped);

        activityLogService.record(ActivityCommand.team(
                ActivityEventType.TEAM_MEMBER_REMOVED,
                teamId,
                actorId,
                Map.of("userId", targetUserId.toString(), "role", target.getRole().name(), "left", leaving)
        ));
    }

    private void requireOutranks(TeamMembership actor, TeamMembership target) {
        if (actor.getRole() == TeamRole.OWNER) {
            return;
        }
        if (!actor.getRole().outranks(target.getRole())) {
            throw ProblemException.forbidden("INSUFFICIENT_TEAM_ROLE", "cannot manage a member with an equal or higher role");
        }
    }

    private boolean isLastActiveOwner(TeamMembership membership) {
        return membership.isActive()
                && membership.getRole() == TeamRole.OWNER
                && membershipRepository.countActiveByTeamIdAndRole(membership.getTeam().getId(), TeamRole.OWNER) <= 1;
    }

    private TeamMembership loadVisibleMembership(UUID teamId, UUID userId) {
        return membershipRepository.findByTeamIdAndUserId(teamId, userId)
                .filter(membership -> !membership.isDeleted())
                .orElseThrow(() -> ProblemException.notFound("MEMBER_NOT_FOUND", "membership not found"));
    }

    private TeamMembership loadPendingInvitation(UUID teamId, UUID userId) {
        accessPolicy.loadTeam(teamId);
        return membershipRepository.findByTeamIdAndUserId(teamId, userId)
                .filter(TeamMembership::isPending)
                .orElseThrow(() -> ProblemException.notFound("INVITATION_NOT_FOUND", "no pending invitation"));
    }

    private AppUser resolveInvitee(InviteMemberRequest request) {
        Optional<AppUser> invitee;
        if (request.userId() != null) {
            invitee = appUserRepository.findById(request.userId());
        } else if (StringUtils.hasText(request.email())) {
            invitee = appUserRepository.findByEmailIgnoreCase(request.email().trim());
        } else {
            throw ProblemException.unprocessable("INVITEE_REQUIRED", "userId or email is required");
        }
        return invitee
                .filter(user -> !user.isDeleted())
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "user not found"));
    }

    private AppUser loadUser(UUID userId) {
        return appUserRepository.findById(userId)
                .filter(user -> !user.isDeleted())
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "user not found"));
    }
}
