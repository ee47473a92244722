package com.taskboard.backend.modules.activity.presentation;

import java.util.UUID;

import com.taskboard.backend.global.security.SecurityUtils;
import com.taskboard.backend.global.web.PageResponse;
import com.taskboard.backend.modules.activity.application.ActivityLogService;
import com.taskboard.backend.modules.activity.presentation.dto.ActivityResponse;

import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Activity")
public class ActivityController {

    private final ActivityLogService activityLogService;

    public ActivityController(ActivityLogService activityLogService) {
        this.activityLogService = activityLogService;
    }

    @GetMapping("/teams/{teamId}/activity")
    public ResponseEntity<PageResponse<ActivityResponse>> listTeamActivity(
            @PathVariable("teamId") UUID teamId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(activityLogService.listTeamActivity(teamId, SecurityUtils.getCurrentUserId(), page, size));
    }
}
