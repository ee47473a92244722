package com.taskboard.backend.modules.task.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.global.web.PageResponse;
import com.taskboard.backend.global.web.Pagination;
import com.taskboard.backend.modules.activity.application.ActivityLogService;
import com.taskboard.backend.modules.activity.application.ActivityLogService.ActivityCommand;
import com.taskboard.backend.modules.activity.domain.ActivityEventType;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.project.domain.Project;
import com.taskboard.backend.modules.project.infrastructure.persistence.ProjectRepository;
import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.domain.TaskAssignment;
import com.taskboard.backend.modules.task.domain.TaskStatus;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskAssignmentRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskDependencyRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskboard.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskboard.backend.modules.task.presentation.dto.TaskResponse;
import com.taskboard.backend.modules.task.presentation.dto.TaskTransitionResponse;
import com.taskboard.backend.modules.task.presentation.dto.UpdateTaskRequest;
import com.taskboard.backend.modules.team.application.TeamAccessPolicy;
import com.taskboard.backend.modules.team.domain.Team;
import com.taskboard.backend.modules.team.domain.TeamMembership;
import com.taskboard.backend.modules.team.domain.TeamRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final TaskAssignmentRepository assignmentRepository;
    private final TaskDependencyRepository dependencyRepository;
    private final ProjectRepository projectRepository;
    private final AppUserRepository appUserRepository;
    private final TeamAccessPolicy accessPolicy;
    private final TaskLoader taskLoader;
    private final TaskGraph taskGraph;
    private final TaskResponseAssembler assembler;
    private final ActivityLogService activityLogService;
    private final Clock clock;

    public TaskService(
            TaskRepository taskRepository,
            TaskAssignmentRepository assignmentRepository,
            TaskDependencyRepository dependencyRepository,
            ProjectRepository projectRepository,
            AppUserRepository appUserRepository,
            TeamAccessPolicy accessPolicy,
            TaskLoader taskLoader,
            TaskGraph taskGraph,
            TaskResponseAssembler assembler,
            ActivityLogService activityLogService,
            Clock clock
    ) {
        this.taskRepository = taskRepository;
        this.assignmentRepository = assignmentRepository;
        this.dependencyRepository = dependencyRepository;
        this.projectRepository = projectRepository;
        this.appUserRepository = appUserRepository;
        this.accessPolicy = accessPolicy;
        this.taskLoader = taskLoader;
        this.taskGraph = taskGraph;
        this.assembler = assembler;
        this.activityLogService = activityLogService;
        this.clock = clock;
    }

    public TaskResponse createTask(UUID teamId, UUID actorId, CreateTaskRequest request) {
        TeamMembership membership = accessPolicy.requireRole(teamId, actorId, TeamRole.MEMBER);
        Team team = membership.getTeam();

        Task task = Task.create(team, membership.getUser(), request.title().trim());
        task.setDescription(request.description());
        task.setPriority(request.priority() != null ? request.priority() : team.getDefaultTaskPriority());
        task.setDueDate(request.dueDate());
        task.setEstimatedHours(request.estimatedHours());
        if (request.position() != null) {
            task.setPosition(request.position());
        }
        if (request.projectId() != null) {
            task.setProject(loadProjectInTeam(request.projectId(), teamId));
        }

        Set<UUID> assigneeIds = request.assigneeIds() != null
                ? new LinkedHashSet<>(request.assigneeIds())
                : Set.of();
        assigneeIds.forEach(assigneeId -> requireAssignable(teamId, assigneeId));

        Task saved = taskRepository.save(task);
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (UUID assigneeId : assigneeIds) {
            AppUser assignee = appUserRepository.getReferenceById(assigneeId);
            assignmentRepository.save(TaskAssignment.of(saved, assignee, membership.getUser(), now));
        }

        recordTaskEvent(ActivityEventType.TASK_CREATED, saved, actorId, Map.of("title", saved.getTitle()));
        for (UUID assigneeId : assigneeIds) {
            recordTaskEvent(ActivityEventType.TASK_ASSIGNED, saved, actorId, Map.of("userId", assigneeId.toString()));
        }
        return assembler.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public PageResponse<TaskResponse> listTeamTasks(UUID teamId, UUID actorId, TaskSearchFilter filter, int page, int size) {
        accessPolicy.requireRole(teamId, actorId, TeamRole.VIEWER);
        Page<Task> result = taskRepository.searchTeamTasks(
                teamId,
                filter.projectId(),
                filter.status(),
                filter.priority(),
                filter.assigneeId(),
                filter.includeArchived(),
                Pagination.of(page, size)
        );
        return PageResponse.of(result, assembler.toResponses(result.getContent()));
    }

    @Transactional(readOnly = true)
    public PageResponse<TaskResponse> listMyTasks(UUID actorId, TaskStatus status, int page, int size) {
        Page<Task> result = taskRepository.findAssignedTo(actorId, status, Pagination.of(page, size));
        return PageResponse.of(result, assembler.toResponses(result.getContent()));
    }

    @Transactional(readOnly = true)
    public TaskResponse getTask(UUID taskId, UUID actorId) {
        Task task = taskLoader.loadActive(taskId);
        accessPolicy.requireRole(task.getTeam().getId(), actorId, TeamRole.VIEWER);
        return assembler.toResponse(task);
    }

    public TaskResponse updateTask(UUID taskId, UUID actorId, UpdateTaskRequest request) {
        Task task = taskLoader.loadActive(taskId);
        UUID teamId = task.getTeam().getId();
        accessPolicy.requireRole(teamId, actorId, TeamRole.MEMBER);

        if (request.title() != null) {
            task.setTitle(request.title().trim());
        }
        if (request.description() != null) {
            task.setDescription(request.description());
        }
        if (request.projectId() != null) {
            task.setProject(loadProjectInTeam(request.projectId(), teamId));
        }
        if (request.position() != null) {
            task.setPosition(request.position());
        }
        if (request.estimatedHours() != null) {
            task.setEstimatedHours(request.estimatedHours());
        }
        if (request.actualHours() != null) {
            task.setActualHours(request.actualHours());
        }
        if (request.priority() != null && request.priority() != task.getPriority()) {
            Map<String, Object> detail = Map.of("from", task.getPriority().name(), "to", request.priority().name());
            task.setPriority(request.priority());
            recordTaskEvent(ActivityEventType.TASK_PRIORITY_CHANGED, task, actorId, detail);
        }
        if (request.dueDate() != null && (task.getDueDate() == null || !request.dueDate().isEqual(task.getDueDate()))) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("from", task.getDueDate() != null ? task.getDueDate().toString() : null);
            detail.put("to", request.dueDate().toString());
            task.setDueDate(request.dueDate());
            recordTaskEvent(ActivityEventType.TASK_DUE_DATE_CHANGED, task, actorId, detail);
        }

        if (request.status() != null && request.status() != task.getStatus()) {
            changeStatus(task, request.status(), actorId);
        } else {
            taskRepository.save(task);
        }
        return assembler.toResponse(task);
    }

    public TaskTransitionResponse transition(UUID taskId, UUID actorId, TaskAction action) {
        Task task = taskLoader.loadActive(taskId);
        TeamMembership membership = accessPolicy.requireRole(task.getTeam().getId(), actorId, TeamRole.MEMBER);

        if (action == TaskAction.START && task.getStatus() != TaskStatus.TODO) {
            throw invalidTransition(task.getStatus(), TaskStatus.IN_PROGRESS);
        }
        List<UUID> unblocked = changeStatus(task, action.getTarget(), actorId);

        if (action == TaskAction.START && assignmentRepository.countByTaskId(taskId) == 0) {
            assignmentRepository.save(TaskAssignment.of(task, membership.getUser(), membership.getUser(), OffsetDateTime.now(clock)));
            recordTaskEvent(ActivityEventType.TASK_ASSIGNED, task, actorId, Map.of("userId", actorId.toString()));
        }
        return new TaskTransitionResponse(assembler.toResponse(task), unblocked);
    }

    public TaskResponse setArchived(UUID taskId, UUID actorId, boolean archived) {
        Task task = taskLoader.loadActive(taskId);
        accessPolicy.requireRole(task.getTeam().getId(), actorId, TeamRole.MEMBER);
        task.setArchived(archived);
        return assembler.toResponse(taskRepository.save(task));
    }

    public void deleteTask(UUID taskId, UUID actorId) {
        Task task = taskLoader.loadActive(taskId);
        TeamMembership membership = accessPolicy.requireRole(task.getTeam().getId(), actorId, TeamRole.VIEWER);
        boolean creator = task.getCreator().getId().equals(actorId);
        if (!creator && !membership.getRole().isAtLeast(TeamRole.ADMIN)) {
            throw ProblemException.forbidden("INSUFFICIENT_TEAM_ROLE", "only the creator or an admin can delete this task");
        }

        List<UUID> ids = List.of(taskId);
        int edges = dependencyRepository.deleteByTaskIds(ids);
        assignmentRepository.deleteByTaskIds(ids);
        task.softDelete(OffsetDateTime.now(clock));
        taskRepository.save(task);

        recordTaskEvent(ActivityEventType.TASK_DELETED, task, actorId, Map.of("title", task.getTitle()));
        log.info("Task {} deleted by {}, {} dependency edges removed", taskId, actorId, edges);
    }

    /**
     * @return dependents unblocked by this change, empty unless the task became completed
     */
    private List<UUID> changeStatus(Task task, TaskStatus target, UUID actorId) {
        TaskStatus previous = task.getStatus();
        if (!previous.canTransitionTo(target)) {
            throw invalidTransition(previous, target);
        }
        if (target.requiresUnblocked() && taskGraph.isBlocked(task.getId())) {
            throw ProblemException.conflict("TASK_BLOCKED", "task has unfinished prerequisites");
        }

        task.applyStatus(target, OffsetDateTime.now(clock));
        taskRepository.saveAndFlush(task);

        recordTaskEvent(
                target == TaskStatus.DONE ? ActivityEventType.TASK_COMPLETED : ActivityEventType.TASK_STATUS_CHANGED,
                task,
                actorId,
                Map.of("from", previous.name(), "to", target.name())
        );
        return target.isCompleted() ? taskGraph.unblockedDependentsOf(task.getId()) : List.of();
    }

    private void requireAssignable(UUID teamId, UUID userId) {
        if (!accessPolicy.isActiveMember(teamId, userId)) {
            throw ProblemException.unprocessable("ASSIGNEE_NOT_TEAM_MEMBER", "assignee is not an active member of the team");
        }
    }

    private Project loadProjectInTeam(UUID projectId, UUID teamId) {
        return projectRepository.findActiveById(projectId)
                .filter(project -> project.getTeam().getId().equals(teamId))
                .orElseThrow(() -> ProblemException.unprocessable("PROJECT_NOT_IN_TEAM", "project does not belong to this team"));
    }

    private void recordTaskEvent(ActivityEventType type, Task task, UUID actorId, Map<String, Object> detail) {
        activityLogService.record(ActivityCommand.task(
                type,
                task.getTeam().getId(),
                task.getProject() != null ? task.getProject().getId() : null,
                task.getId(),
                actorId,
                detail
        ));
    }

    private static ProblemException invalidTransition(TaskStatus from, TaskStatus to) {
        return ProblemException.conflict("INVALID_STATUS_TRANSITION", "cannot move task from " + from + " to " + to);
    }
}
