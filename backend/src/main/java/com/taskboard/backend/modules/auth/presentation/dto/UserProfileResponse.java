package com.taskboard.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskboard.backend.modules.auth.domain.AppUser;

public record UserProfileResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        String fullName,
        String displayName,
        String initials,
        String timezone,
        boolean active,
        boolean verified,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse from(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getFullName(),
                user.getDisplayName(),
                user.getInitials(),
                user.getTimezone(),
                user.isActive(),
                user.isVerified(),
                user.getLastLoginAt(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
