package com.taskboard.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.taskboard.backend.modules.auth.domain.AppUser;

public record UserSummaryResponse(
        UUID id,
        String email,
        String displayName,
        String initials
) {

    public static UserSummaryResponse from(AppUser user) {
        if (user == null) {
            return null;
        }
        return new UserSummaryResponse(user.getId(), user.getEmail(), user.getDisplayName(), user.getInitials());
    }
}
