package com.taskboard.backend.modules.team.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskboard.backend.global.jpa.AbstractTimestampedEntity;
import com.taskboard.backend.modules.auth.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * A user's seat in a team. {@code joinedAt == null} means the invitation is still pending;
 * only active memberships grant permissions.
 */
@Entity
@Table(name = "team_membership",
        uniqueConstraints = @UniqueConstraint(name = "uq_team_membership_user_team", columnNames = {"user_id", "team_id"}))
public class TeamMembership extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "team_id", nullable = false)
    private Team team;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private TeamRole role = TeamRole.MEMBER;

    @Column(name = "invited_at")
    private OffsetDateTime invitedAt;

    @Column(name = "joined_at")
    private OffsetDateTime joinedAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "invited_by")
    private AppUser invitedBy;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    public static TeamMembership joined(AppUser user, Team team, TeamRole role, OffsetDateTime now) {
        TeamMembership membership = new TeamMembership();
        membership.user = user;
        membership.team = team;
        membership.role = role;
        membership.joinedAt = now;
        return membership;
    }

    public static TeamMembership invited(AppUser user, Team team, TeamRole role, AppUser invitedBy, OffsetDateTime now) {
        TeamMembership membership = new TeamMembership();
        membership.user = user;
        membership.team = team;
        membership.reinvite(role, invitedBy, now);
        return membership;
    }

    public void reinvite(TeamRole role, AppUser invitedBy, OffsetDateTime now) {
        this.role = role;
        this.invitedBy = invitedBy;
        this.invitedAt = now;
        this.joinedAt = null;
        this.deletedAt = null;
    }

    public void accept(OffsetDateTime now) {
        this.joinedAt = now;
    }

    public void softDelete(OffsetDateTime now) {
        this.deletedAt = now;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isPending() {
        return !isDeleted() && joinedAt == null;
    }

    public boolean isActive() {
        return !isDeleted() && joinedAt != null;
    }

    public boolean hasRoleAtLeast(TeamRole required) {
        return isActive() && role.isAtLeast(required);
    }

    public UUID getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public Team getTeam() {
        return team;
    }

    public TeamRole getRole() {
        return role;
    }

    public void setRole(TeamRole role) {
        this.role = role;
    }

    public OffsetDateTime getInvitedAt() {
        return invitedAt;
    }

    public OffsetDateTime getJoinedAt() {
        return joinedAt;
    }

    public AppUser getInvitedBy() {
        return invitedBy;
    }

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }
}
