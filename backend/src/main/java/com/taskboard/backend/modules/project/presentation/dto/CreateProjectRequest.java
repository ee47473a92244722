package com.taskboard.backend.modules.project.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateProjectRequest(
        @NotBlank(message = "name is required") @Size(max = 200) String name,
        @Size(max = 5000) String description,
        OffsetDateTime startDate,
        OffsetDateTime endDate,
        @Pattern(regexp = ProjectRequests.COLOR_PATTERN, message = "color must be #RRGGBB") String color,
        @PositiveOrZero Integer position,
        @PositiveOrZero Integer estimatedHours
) {
}
