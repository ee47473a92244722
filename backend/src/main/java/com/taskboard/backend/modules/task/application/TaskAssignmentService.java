package com.taskboard.backend.modules.task.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.activity.application.ActivityLogService;
import com.taskboard.backend.modules.activity.application.ActivityLogService.ActivityCommand;
import com.taskboard.backend.modules.activity.domain.ActivityEventType;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.domain.TaskAssignment;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskAssignmentRepository;
import com.taskboard.backend.modules.task.presentation.dto.TaskAssignmentResponse;
import com.taskboard.backend.modules.team.application.TeamAccessPolicy;
import com.taskboard.backend.modules.team.domain.TeamMembership;
import com.taskboard.backend.modules.team.domain.TeamRole;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TaskAssignmentService {

    private final TaskAssignmentRepository assignmentRepository;
    private final AppUserRepository appUserRepository;
    private final TeamAccessPolicy accessPolicy;
    private final TaskLoader taskLoader;
    private final ActivityLogService activityLogService;
    private final Clock clock;

    public TaskAssignmentService(
            TaskAssignmentRepository assignmentRepository,
            AppUserRepository appUserRepository,
            TeamAccessPolicy accessPolicy,
            TaskLoader taskLoader,
            ActivityLogService activityLogService,
            Clock clock
    ) {
        this.assignmentRepository = assignmentRepository;
        this.appUserRepository = appUserRepository;
        this.accessPolicy = accessPolicy;
        this.taskLoader = taskLoader;
        this.activityLogService = activityLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<TaskAssignmentResponse> listAssignments(UUID taskId, UUID actorId) {
        Task task = taskLoader.loadActive(taskId);
        accessPolicy.requireRole(task.getTeam().getId(), actorId, TeamRole.VIEWER);
        return assignmentRepository.findByTaskId(taskId).stream()
                .map(TaskAssignmentResponse::from)
                .toList();
    }

    public TaskAssignmentResponse assign(UUID taskId, UUID assigneeId, UUID actorId) {
        Task task = taskLoader.loadActive(taskId);
        UUID teamId = task.getTeam().getId();
        TeamMembership actor = accessPolicy.requireRole(teamId, actorId, TeamRole.MEMBER);

        if (!accessPolicy.isActiveMember(teamId, assigneeId)) {
            throw ProblemException.unprocessable("ASSIGNEE_NOT_TEAM_MEMBER", "assignee is not an active member of the team");
        }
        if (assignmentRepository.existsByTaskIdAndAssigneeId(taskId, assigneeId)) {
            throw ProblemException.conflict("ALREADY_ASSIGNED", "user is already assigned to this task");
        }

        AppUser assignee = appUserRepository.getReferenceById(assigneeId);
        TaskAssignment saved = assignmentRepository.save(
                TaskAssignment.of(task, assignee, actor.getUser(), OffsetDateTime.now(clock))
        );
        record(ActivityEventType.TASK_ASSIGNED, task, actorId, assigneeId);
        return TaskAssignmentResponse.from(saved);
    }

    public void unassign(UUID taskId, UUID assigneeId, UUID actorId) {
        Task task = taskLoader.loadActive(taskId);
        accessPolicy.requireRole(task.getTeam().getId(), actorId, TeamRole.MEMBER);

        TaskAssignment assignment = assignmentRepository.findByTaskIdAndAssigneeId(taskId, assigneeId)
                .orElseThrow(() -> ProblemException.notFound("ASSIGNMENT_NOT_FOUND", "user is not assigned to this task"));
        assignmentRepository.delete(assignment);
        record(ActivityEventType.TASK_UNASSIGNED, task, actorId, assigneeId);
    }

    private void record(ActivityEventType type, Task task, UUID actorId, UUID assigneeId) {
        activityLogService.record(ActivityCommand.task(
                type,
                task.getTeam().getId(),
                task.getProject() != null ? task.getProject().getId() : null,
                task.getId(),
                actorId,
                Map.of("userId", assigneeId.toString())
        ));
    }
}
