package com.taskboard.backend.modules.team.domain;

/**
 * Team role hierarchy, OWNER > ADMIN > MEMBER > VIEWER.
 */
public enum TeamRole {
    VIEWER(1),
    MEMBER(2),
    ADMIN(3),
    OWNER(4);

    private final int level;

    TeamRole(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean isAtLeast(TeamRole required) {
        return level >= required.level;
    }

    public boolean outranks(TeamRole other) {
        return level > other.level;
    }

    public boolean canManageTeam() {
        return isAtLeast(ADMIN);
    }

    public boolean canManageMembers() {
        return isAtLeast(ADMIN);
    }

    public boolean canEditContent() {
        return isAtLeast(MEMBER);
    }
}
