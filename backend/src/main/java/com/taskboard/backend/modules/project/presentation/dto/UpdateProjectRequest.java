package com.taskboard.backend.modules.project.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateProjectRequest(
        @Size(min = 1, max = 200) String name,
        @Size(max = 5000) String description,
        OffsetDateTime startDate,
        OffsetDateTime endDate,
        @Pattern(regexp = ProjectRequests.COLOR_PATTERN, message = "color must be #RRGGBB") String color,
        @PositiveOrZero Integer position,
        @PositiveOrZero Integer estimatedHours
) {
}
