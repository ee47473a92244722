package com.taskboard.backend.modules.project.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.activity.application.ActivityLogService;
import com.taskboard.backend.modules.activity.application.ActivityLogService.ActivityCommand;
import com.taskboard.backend.modules.activity.domain.ActivityEventType;
import com.taskboard.backend.modules.project.domain.Project;
import com.taskboard.backend.modules.project.domain.ProjectStatus;
import com.taskboard.backend.modules.project.infrastructure.persistence.ProjectRepository;
import com.taskboard.backend.modules.project.presentation.dto.CreateProjectRequest;
import com.taskboard.backend.modules.project.presentation.dto.ProjectResponse;
import com.taskboard.backend.modules.project.presentation.dto.UpdateProjectRequest;
import com.taskboard.backend.modules.task.domain.TaskStatus;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskAssignmentRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskDependencyRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository.ProjectTaskStats;
import com.taskboard.backend.modules.team.application.TeamAccessPolicy;
import com.taskboard.backend.modules.team.domain.Team;
import com.taskboard.backend.modules.team.domain.TeamRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final TaskAssignmentRepository taskAssignmentRepository;
    private final TaskDependencyRepository taskDependencyRepository;
    private final TeamAccessPolicy accessPolicy;
    private final ActivityLogService activityLogService;
    private final Clock clock;

    public ProjectService(
            ProjectRepository projectRepository,
            TaskRepository taskRepository,
            TaskAssignmentRepository taskAssignmentRepository,
            TaskDependencyRepository taskDependencyRepository,
            TeamAccessPolicy accessPolicy,
            ActivityLogService activityLogService,
            Clock clock
    ) {
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.taskAssignmentRepository = taskAssignmentRepository;
        this.taskDependencyRepository = taskDependencyRepository;
        this.accessPolicy = accessPolicy;
        this.activityLogService = activityLogService;
        this.clock = clock;
    }

    public ProjectResponse createProject(UUID teamId, UUID actorId, CreateProjectRequest request) {
        Team team = accessPolicy.requireRole(teamId, actorId, TeamRole.MEMBER).getTeam();
        String name = request.name().trim();
        if (projectRepository.existsActiveName(teamId, name, null)) {
            throw ProblemException.conflict("PROJECT_NAME_TAKEN", "a project named '" + name + "' already exists");
        }

        Project project = Project.create(team, name);
        project.setDescription(request.description());
        project.setStartDate(request.startDate());
        project.setEndDate(request.endDate());
        project.setColor(request.color());
        project.setEstimatedHours(request.estimatedHours());
        if (request.position() != null) {
            project.setPosition(request.position());
        }
        requireValidTimeline(project);

        Project saved = projectRepository.save(project);
        activityLogService.record(ActivityCommand.project(
                ActivityEventType.PROJECT_CREATED,
                teamId,
                saved.getId(),
                actorId,
                Map.of("name", saved.getName())
        ));
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<ProjectResponse> listProjects(UUID teamId, UUID actorId, ProjectStatus status) {
        accessPolicy.requireRole(teamId, actorId, TeamRole.VIEWER);
        List<Project> projects = projectRepository.findByTeam(teamId, status);
        if (projects.isEmpty()) {
            return List.of();
        }
        Map<UUID, ProjectTaskStats> stats = taskRepository.summarizeByProject(
                        projects.stream().map(Project::getId).toList(),
                        TaskStatus.completedStatuses()
                ).stream()
                .collect(Collectors.toMap(ProjectTaskStats::getProjectId, Function.identity()));

        OffsetDateTime now = OffsetDateTime.now(clock);
        return projects.stream()
                .map(project -> {
                    ProjectTaskStats projectStats = stats.get(project.getId());
                    return projectStats == null
                            ? ProjectResponse.from(project, 0, 0, now)
                            : ProjectResponse.from(project, projectStats.getTotal(), completedOf(projectStats), now);
                })
                .toList();
    }

    @Transactional(readOnly = true)
    public ProjectResponse getProject(UUID projectId, UUID actorId) {
        Project project = loadProject(projectId);
        accessPolicy.requireRole(project.getTeam().getId(), actorId, TeamRole.VIEWER);
        return toResponse(project);
    }

    public ProjectResponse updateProject(UUID projectId, UUID actorId, UpdateProjectRequest request) {
        Project project = loadProject(projectId);
        UUID teamId = project.getTeam().getId();
        accessPolicy.requireRole(teamId, actorId, TeamRole.MEMBER);

        if (request.name() != null) {
            String name = request.name().trim();
            if (!name.equalsIgnoreCase(project.getName()) && projectRepository.existsActiveName(teamId, name, projectId)) {
                throw ProblemException.conflict("PROJECT_NAME_TAKEN", "a project named '" + name + "' already exists");
            }
            project.setName(name);
        }
        if (request.description() != null) {
            project.setDescription(request.description());
        }
        if (request.startDate() != null) {
            project.setStartDate(request.startDate());
        }
        if (request.endDate() != null) {
            project.setEndDate(request.endDate());
        }
        if (request.color() != null) {
            project.setColor(request.color());
        }
        if (request.position() != null) {
            project.setPosition(request.position());
        }
        if (request.estimatedHours() != null) {
            project.setEstimatedHours(request.estimatedHours());
        }
        requireValidTimeline(project);

        return toResponse(projectRepository.save(project));
    }

    public ProjectResponse changeStatus(UUID projectId, UUID actorId, ProjectAction action) {
        Project project = loadProject(projectId);
        UUID teamId = project.getTeam().getId();
        accessPolicy.requireRole(teamId, actorId, TeamRole.MEMBER);

        ProjectStatus previous = project.getStatus();
        OffsetDateTime now = OffsetDateTime.now(clock);
        switch (action) {
            case START -> project.start(now);
            case COMPLETE -> project.complete(now);
            case CANCEL -> project.cancel();
            case HOLD -> project.hold();
            case RESUME -> {
                if (!project.canResume()) {
                    throw ProblemException.conflict(
                            "INVALID_PROJECT_TRANSITION",
                            "only projects on hold can be resumed, current status is " + previous
                    );
                }
                project.resume();
            }
        }
        Project saved = projectRepository.save(project);

        if (previous != saved.getStatus()) {
            activityLogService.record(ActivityCommand.project(
                    saved.getStatus() == ProjectStatus.COMPLETED
                            ? ActivityEventType.PROJECT_COMPLETED
                            : ActivityEventType.PROJECT_STATUS_CHANGED,
                    teamId,
                    projectId,
                    actorId,
                    Map.of("from", previous.name(), "to", saved.getStatus().name())
            ));
        }
        return toResponse(saved);
    }

    public void deleteProject(UUID projectId, UUID actorId) {
        Project project = loadProject(projectId);
        accessPolicy.requireRole(project.getTeam().getId(), actorId, TeamRole.ADMIN);

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<UUID> taskIds = taskRepository.findActiveIdsByProjectId(projectId);
        if (!taskIds.isEmpty()) {
            taskDependencyRepository.deleteByTaskIds(taskIds);
            taskAssignmentRepository.deleteByTaskIds(taskIds);
            taskRepository.softDeleteAll(taskIds, now);
        }
        project.softDelete(now);
        projectRepository.save(project);
        log.info("Project {} deleted by {} with {} tasks", projectId, actorId, taskIds.size());
    }

    private Project loadProject(UUID projectId) {
        return projectRepository.findActiveById(projectId)
                .orElseThrow(() -> ProblemException.notFound("PROJECT_NOT_FOUND", "project not found"));
    }

    private void requireValidTimeline(Project project) {
        if (!project.hasValidTimeline()) {
            throw ProblemException.unprocessable("INVALID_TIMELINE", "startDate must not be after endDate");
        }
    }

    private ProjectResponse toResponse(Project project) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (project.getId() == null) {
            return ProjectResponse.from(project, 0, 0, now);
        }
        return taskRepository.summarizeByProject(List.of(project.getId()), TaskStatus.completedStatuses()).stream()
                .findFirst()
                .map(stats -> ProjectResponse.from(project, stats.getTotal(), completedOf(stats), now))
                .orElseGet(() -> ProjectResponse.from(project, 0, 0, now));
    }

    private static long completedOf(ProjectTaskStats stats) {
        return stats.getCompleted() != null ? stats.getCompleted() : 0L;
    }
}
