package com.taskboard.backend.modules.task.presentation;

import java.util.UUID;

import com.taskboard.backend.global.security.SecurityUtils;
import com.taskboard.backend.global.web.PageResponse;
import com.taskboard.backend.modules.task.application.TaskAction;
import com.taskboard.backend.modules.task.application.TaskSearchFilter;
import com.taskboard.backend.modules.task.application.TaskService;
import com.taskboard.backend.modules.task.domain.TaskPriority;
import com.taskboard.backend.modules.task.domain.TaskStatus;
import com.taskboard.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskboard.backend.modules.task.presentation.dto.TaskResponse;
import com.taskboard.backend.modules.task.presentation.dto.TaskTransitionResponse;
import com.taskboard.backend.modules.task.presentation.dto.UpdateTaskRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Tasks")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping("/teams/{teamId}/tasks")
    @Operation(summary = "Create a task in a team")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Task created"),
            @ApiResponse(responseCode = "422", description = "Project or assignee outside the team")
    })
    public ResponseEntity<TaskResponse> createTask(
            @PathVariable("teamId") UUID teamId,
            @Valid @RequestBody CreateTaskRequest request
    ) {
        TaskResponse response = taskService.createTask(teamId, SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/teams/{teamId}/tasks")
    public ResponseEntity<PageResponse<TaskResponse>> listTeamTasks(
            @PathVariable("teamId") UUID teamId,
            @RequestParam(name = "projectId", required = false) UUID projectId,
            @RequestParam(name = "status", required = false) TaskStatus status,
            @RequestParam(name = "priority", required = false) TaskPriority priority,
            @RequestParam(name = "assigneeId", required = false) UUID assigneeId,
            @RequestParam(name = "includeArchived", defaultValue = "false") boolean includeArchived,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        TaskSearchFilter filter = new TaskSearchFilter(projectId, status, priority, assigneeId, includeArchived);
        return ResponseEntity.ok(taskService.listTeamTasks(teamId, SecurityUtils.getCurrentUserId(), filter, page, size));
    }

    @GetMapping("/tasks/me")
    public ResponseEntity<PageResponse<TaskResponse>> listMyTasks(
            @RequestParam(name = "status", required = false) TaskStatus status,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(taskService.listMyTasks(SecurityUtils.getCurrentUserId(), status, page, size));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable("taskId") UUID taskId) {
        return ResponseEntity.ok(taskService.getTask(taskId, SecurityUtils.getCurrentUserId()));
    }

    @PatchMapping("/tasks/{taskId}")
    public ResponseEntity<TaskResponse> updateTask(
            @PathVariable("taskId") UUID taskId,
            @Valid @RequestBody UpdateTaskRequest request
    ) {
        return ResponseEntity.ok(taskService.updateTask(taskId, SecurityUtils.getCurrentUserId(), request));
    }

    @DeleteMapping("/tasks/{taskId}")
    public ResponseEntity<Void> deleteTask(@PathVariable("taskId") UUID taskId) {
        taskService.deleteTask(taskId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/tasks/{taskId}/start")
    @Operation(summary = "Start a TODO task; assigns the caller when nobody is assigned")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task started"),
            @ApiResponse(responseCode = "409", description = "Invalid transition or blocked by a prerequisite")
    })
    public ResponseEntity<TaskTransitionResponse> start(@PathVariable("taskId") UUID taskId) {
        return transition(taskId, TaskAction.START);
    }

    @PostMapping("/tasks/{taskId}/review")
    public ResponseEntity<TaskTransitionResponse> submitForReview(@PathVariable("taskId") UUID taskId) {
        return transition(taskId, TaskAction.SUBMIT_FOR_REVIEW);
    }

    @PostMapping("/tasks/{taskId}/complete")
    public ResponseEntity<TaskTransitionResponse> complete(@PathVariable("taskId") UUID taskId) {
        return transition(taskId, TaskAction.COMPLETE);
    }

    @PostMapping("/tasks/{taskId}/cancel")
    public ResponseEntity<TaskTransitionResponse> cancel(@PathVariable("taskId") UUID taskId) {
        return transition(taskId, TaskAction.CANCEL);
    }

    @PostMapping("/tasks/{taskId}/reopen")
    public ResponseEntity<TaskTransitionResponse> reopen(@PathVariable("taskId") UUID taskId) {
        return transition(taskId, TaskAction.REOPEN);
    }

    @PostMapping("/tasks/{taskId}/archive")
    public ResponseEntity<TaskResponse> archive(@PathVariable("taskId") UUID taskId) {
        return ResponseEntity.ok(taskService.setArchived(taskId, SecurityUtils.getCurrentUserId(), true));
    }

    @PostMapping("/tasks/{taskId}/unarchive")
    public ResponseEntity<TaskResponse> unarchive(@PathVariable("taskId") UUID taskId) {
        return ResponseEntity.ok(taskService.setArchived(taskId, SecurityUtils.getCurrentUserId(), false));
    }

    private ResponseEntity<TaskTransitionResponse> transition(UUID taskId, TaskAction action) {
        return ResponseEntity.ok(taskService.transition(taskId, SecurityUtils.getCurrentUserId(), action));
    }
}
