package com.taskboard.backend.modules.project.presentation.dto;

final class ProjectRequests {

    static final String COLOR_PATTERN = "^#[0-9A-Fa-f]{6}$";

    private ProjectRequests() {
    }
}
