package com.taskboard.backend.modules.team.presentation;

import java.util.List;
import java.util.UUID;

import com.taskboard.backend.global.security.SecurityUtils;
import com.taskboard.backend.modules.team.application.TeamService;
import com.taskboard.backend.modules.team.presentation.dto.ChangeMemberRoleRequest;
import com.taskboard.backend.modules.team.presentation.dto.CreateTeamRequest;
import com.taskboard.backend.modules.team.presentation.dto.InviteMemberRequest;
import com.taskboard.backend.modules.team.presentation.dto.TeamMemberResponse;
import com.taskboard.backend.modules.team.presentation.dto.TeamResponse;
import com.taskboard.backend.modules.team.presentation.dto.UpdateTeamRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/teams")
@Tag(name = "Teams")
public class TeamController {

    private final TeamService teamService;

    public TeamController(TeamService teamService) {
        this.teamService = teamService;
    }

    @PostMapping
    @Operation(summary = "Create a team; the caller becomes its owner")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Team created"),
            @ApiResponse(responseCode = "409", description = "Slug already in use")
    })
    public ResponseEntity<TeamResponse> createTeam(@Valid @RequestBody CreateTeamRequest request) {
        TeamResponse response = teamService.createTeam(SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<TeamResponse>> listMyTeams() {
        return ResponseEntity.ok(teamService.listMyTeams(SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/{teamId}")
    public ResponseEntity<TeamResponse> getTeam(@PathVariable("teamId") UUID teamId) {
        return ResponseEntity.ok(teamService.getTeam(teamId, SecurityUtils.getCurrentUserId()));
    }

    @PatchMapping("/{teamId}")
    public ResponseEntity<TeamResponse> updateTeam(
            @PathVariable("teamId") UUID teamId,
            @Valid @RequestBody UpdateTeamRequest request
    ) {
        return ResponseEntity.ok(teamService.updateTeam(teamId, SecurityUtils.getCurrentUserId(), request));
    }

    @DeleteMapping("/{teamId}")
    public ResponseEntity<Void> deleteTeam(@PathVariable("teamId") UUID teamId) {
        teamService.deleteTeam(teamId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{teamId}/members")
    public ResponseEntity<List<TeamMemberResponse>> listMembers(@PathVariable("teamId") UUID teamId) {
        return ResponseEntity.ok(teamService.listMembers(teamId, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/{teamId}/members")
    @Operation(summary = "Invite a user to the team")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Invitation created"),
            @ApiResponse(responseCode = "403", description = "Insufficient role or role escalation"),
            @ApiResponse(responseCode = "404", description = "User not found"),
            @ApiResponse(responseCode = "409", description = "Already a member or invited")
    })
    public ResponseEntity<TeamMemberResponse> inviteMember(
            @PathVariable("teamId") UUID teamId,
            @Valid @RequestBody InviteMemberRequest request
    ) {
        TeamMemberResponse response = teamService.inviteMember(teamId, SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping("/{teamId}/members/{userId}")
    public ResponseEntity<TeamMemberResponse> changeMemberRole(
            @PathVariable("teamId") UUID teamId,
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody ChangeMemberRoleRequest request
    ) {
        return ResponseEntity.ok(teamService.changeMemberRole(teamId, userId, SecurityUtils.getCurrentUserId(), request));
    }

    @DeleteMapping("/{teamId}/members/{userId}")
    public ResponseEntity<Void> removeMember(
            @PathVariable("teamId") UUID teamId,
            @PathVariable("userId") UUID userId
    ) {
        teamService.removeMember(teamId, userId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{teamId}/join")
    public ResponseEntity<TeamMemberResponse> joinTeam(@PathVariable("teamId") UUID teamId) {
        return ResponseEntity.ok(teamService.joinTeam(teamId, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/{teamId}/invitations/accept")
    public ResponseEntity<TeamMemberResponse> acceptInvitation(@PathVariable("teamId") UUID teamId) {
        return ResponseEntity.ok(teamService.acceptInvitation(teamId, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/{teamId}/invitations/decline")
    public ResponseEntity<Void> declineInvitation(@PathVariable("teamId") UUID teamId) {
        teamService.declineInvitation(teamId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
