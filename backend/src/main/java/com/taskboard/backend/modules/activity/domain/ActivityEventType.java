package com.taskboard.backend.modules.activity.domain;

public enum ActivityEventType {
    TASK_CREATED,
    TASK_ASSIGNED,
    TASK_UNASSIGNED,
    TASK_STATUS_CHANGED,
    TASK_PRIORITY_CHANGED,
    TASK_DUE_DATE_CHANGED,
    TASK_COMPLETED,
    TASK_DELETED,
    TEAM_MEMBER_ADDED,
    TEAM_MEMBER_REMOVED,
    TEAM_MEMBER_ROLE_CHANGED,
    PROJECT_CREATED,
    PROJECT_STATUS_CHANGED,
    PROJECT_COMPLETED
}
