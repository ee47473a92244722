package com.taskboard.backend.modules.project.presentation;

import java.util.List;
import java.util.UUID;

import com.taskboard.backend.global.security.SecurityUtils;
import com.taskboard.backend.modules.project.application.ProjectAction;
import com.taskboard.backend.modules.project.application.ProjectService;
import com.taskboard.backend.modules.project.domain.ProjectStatus;
import com.taskboard.backend.modules.project.presentation.dto.CreateProjectRequest;
import com.taskboard.backend.modules.project.presentation.dto.ProjectResponse;
import com.taskboard.backend.modules.project.presentation.dto.UpdateProjectRequest;

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
@Tag(name = "Projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @PostMapping("/teams/{teamId}/projects")
    @Operation(summary = "Create a project in a team")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Project created"),
            @ApiResponse(responseCode = "409", description = "Name already used in this team"),
            @ApiResponse(responseCode = "422", description = "Start date after end date")
    })
    public ResponseEntity<ProjectResponse> createProject(
            @PathVariable("teamId") UUID teamId,
            @Valid @RequestBody CreateProjectRequest request
    ) {
        ProjectResponse response = projectService.createProject(teamId, SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/teams/{teamId}/projects")
    public ResponseEntity<List<ProjectResponse>> listProjects(
            @PathVariable("teamId") UUID teamId,
            @RequestParam(name = "status", required = false) ProjectStatus status
    ) {
        return ResponseEntity.ok(projectService.listProjects(teamId, SecurityUtils.getCurrentUserId(), status));
    }

    @GetMapping("/projects/{projectId}")
    public ResponseEntity<ProjectResponse> getProject(@PathVariable("projectId") UUID projectId) {
        return ResponseEntity.ok(projectService.getProject(projectId, SecurityUtils.getCurrentUserId()));
    }

    @PatchMapping("/projects/{projectId}")
    public ResponseEntity<ProjectResponse> updateProject(
            @PathVariable("projectId") UUID projectId,
            @Valid @RequestBody UpdateProjectRequest request
    ) {
        return ResponseEntity.ok(projectService.updateProject(projectId, SecurityUtils.getCurrentUserId(), request));
    }

    @DeleteMapping("/projects/{projectId}")
    public ResponseEntity<Void> deleteProject(@PathVariable("projectId") UUID projectId) {
        projectService.deleteProject(projectId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/projects/{projectId}/start")
    public ResponseEntity<ProjectResponse> start(@PathVariable("projectId") UUID projectId) {
        return changeStatus(projectId, ProjectAction.START);
    }

    @PostMapping("/projects/{projectId}/complete")
    public ResponseEntity<ProjectResponse> complete(@PathVariable("projectId") UUID projectId) {
        return changeStatus(projectId, ProjectAction.COMPLETE);
    }

    @PostMapping("/projects/{projectId}/cancel")
    public ResponseEntity<ProjectResponse> cancel(@PathVariable("projectId") UUID projectId) {
        return changeStatus(projectId, ProjectAction.CANCEL);
    }

    @PostMapping("/projects/{projectId}/hold")
    public ResponseEntity<ProjectResponse> hold(@PathVariable("projectId") UUID projectId) {
        return changeStatus(projectId, ProjectAction.HOLD);
    }

    @PostMapping("/projects/{projectId}/resume")
    public ResponseEntity<ProjectResponse> resume(@PathVariable("projectId") UUID projectId) {
        return changeStatus(projectId, ProjectAction.RESUME);
    }

    private ResponseEntity<ProjectResponse> changeStatus(UUID projectId, ProjectAction action) {
        return ResponseEntity.ok(projectService.changeStatus(projectId, SecurityUtils.getCurrentUserId(), action));
    }
}
