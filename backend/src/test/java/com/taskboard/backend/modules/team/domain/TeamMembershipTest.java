package com.taskboard.backend.modules.team.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.support.TestEntities;

import org.junit.jupiter.api.Test;

class TeamMembershipTest {

    private final AppUser owner = TestEntities.user("owner@example.com");
    private final AppUser invitee = TestEntities.user("invitee@example.com");
    private final Team team = TestEntities.team("Core");

    @Test
    void pendingInvitationGrantsNothingUntilAccepted() {
        TeamMembership membership = TeamMembership.invited(invitee, team, TeamRole.ADMIN, owner, TestEntities.NOW);

        assertThat(membership.isPending()).isTrue();
        assertThat(membership.isActive()).isFalse();
        assertThat(membership.hasRoleAtLeast(TeamRole.VIEWER)).isFalse();

        membership.accept(TestEntities.NOW.plusHours(1));

        assertThat(membership.isActive()).isTrue();
        assertThat(membership.hasRoleAtLeast(TeamRole.ADMIN)).isTrue();
    }

    @Test
    void reinviteRevivesDeletedMembershipAsPending() {
        TeamMembership membership = TeamMembership.joined(invitee, team, TeamRole.MEMBER, TestEntities.NOW);
        membership.softDelete(TestEntities.NOW.plusDays(1));
        assertThat(membership.isDeleted()).isTrue();
        assertThat(membership.isPending()).isFalse();

        membership.reinvite(TeamRole.VIEWER, owner, TestEntities.NOW.plusDays(2));

        assertThat(membership.isDeleted()).isFalse();
        assertThat(membership.isPending()).isTrue();
        assertThat(membership.getRole()).isEqualTo(TeamRole.VIEWER);
        assertThat(membership.getInvitedBy()).isSameAs(owner);
        assertThat(membership.getJoinedAt()).isNull();
    }
}
