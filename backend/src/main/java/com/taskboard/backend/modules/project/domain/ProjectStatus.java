package com.taskboard.backend.modules.project.domain;

public enum ProjectStatus {
    PLANNING,
    ACTIVE,
    ON_HOLD,
    COMPLETED,
    CANCELLED;

    /**
     * PLANNING, ACTIVE and ON_HOLD projects are still open.
     */
    public boolean isActive() {
        return this == PLANNING || this == ACTIVE || this == ON_HOLD;
    }
}
