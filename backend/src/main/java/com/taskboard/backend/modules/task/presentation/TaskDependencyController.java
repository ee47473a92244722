package com.taskboard.backend.modules.task.presentation;

import java.util.UUID;

import com.taskboard.backend.global.security.SecurityUtils;
import com.taskboard.backend.modules.task.application.TaskDependencyService;
import com.taskboard.backend.modules.task.presentation.dto.AddDependencyRequest;
import com.taskboard.backend.modules.task.presentation.dto.TaskDependenciesResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
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
@RequestMapping("/tasks/{taskId}/dependencies")
@Tag(name = "Tasks")
public class TaskDependencyController {

    private final TaskDependencyService dependencyService;

    public TaskDependencyController(TaskDependencyService dependencyService) {
        this.dependencyService = dependencyService;
    }

    @GetMapping
    public ResponseEntity<TaskDependenciesResponse> listDependencies(@PathVariable("taskId") UUID taskId) {
        return ResponseEntity.ok(dependencyService.listDependencies(taskId, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping
    @Operation(summary = "Make this task depend on another task of the same team")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Dependency added"),
            @ApiResponse(responseCode = "409", description = "Dependency already exists"),
            @ApiResponse(responseCode = "422", description = "Self, cross-team or circular dependency")
    })
    public ResponseEntity<TaskDependenciesResponse> addDependency(
            @PathVariable("taskId") UUID taskId,
            @Valid @RequestBody AddDependencyRequest request
    ) {
        TaskDependenciesResponse response = dependencyService.addDependency(
                taskId,
                request.prerequisiteTaskId(),
                SecurityUtils.getCurrentUserId()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{prerequisiteTaskId}")
    public ResponseEntity<Void> removeDependency(
            @PathVariable("taskId") UUID taskId,
            @PathVariable("prerequisiteTaskId") UUID prerequisiteTaskId
    ) {
        dependencyService.removeDependency(taskId, prerequisiteTaskId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
