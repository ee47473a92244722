package com.taskboard.backend.modules.task.presentation;

import java.util.List;
import java.util.UUID;

import com.taskboard.backend.global.security.SecurityUtils;
import com.taskboard.backend.modules.task.application.TaskAssignmentService;
import com.taskboard.backend.modules.task.presentation.dto.AssignTaskRequest;
import com.taskboard.backend.modules.task.presentation.dto.TaskAssignmentResponse;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tasks/{taskId}/assignments")
@Tag(name = "Tasks")
public class TaskAssignmentController {

    private final TaskAssignmentService assignmentService;

    public TaskAssignmentController(TaskAssignmentService assignmentService) {
        this.assignmentService = assignmentService;
    }

    @GetMapping
    public ResponseEntity<List<TaskAssignmentResponse>> listAssignments(@PathVariable("taskId") UUID taskId) {
        return ResponseEntity.ok(assignmentService.listAssignments(taskId, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping
    public ResponseEntity<TaskAssignmentResponse> assign(
            @PathVariable("taskId") UUID taskId,
            @Valid @RequestBody AssignTaskRequest request
    ) {
        TaskAssignmentResponse response = assignmentService.assign(taskId, request.userId(), SecurityUtils.getCurrentUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> unassign(
            @PathVariable("taskId") UUID taskId,
            @PathVariable("userId") UUID userId
    ) {
        assignmentService.unassign(taskId, userId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
