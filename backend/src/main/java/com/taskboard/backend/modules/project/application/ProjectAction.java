package com.taskboard.backend.modules.project.application;

public enum ProjectAction {
    START,
    COMPLETE,
    CANCEL,
    HOLD,
    RESUME
}
