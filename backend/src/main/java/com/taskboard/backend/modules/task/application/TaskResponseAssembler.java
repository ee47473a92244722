package com.taskboard.backend.modules.task.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.domain.TaskStatus;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskAssignmentRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskDependencyRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskDependencyRepository.TaskCount;
import com.taskboard.backend.modules.task.presentation.dto.TaskResponse;

import org.springframework.stereotype.Component;

/**
 * Builds task responses with assignees and blocking state loaded in one batch per page.
 */
@Component
public class TaskResponseAssembler {

    private final TaskAssignmentRepository assignmentRepository;
    private final TaskDependencyRepository dependencyRepository;
    private final TaskGraph taskGraph;
    private final Clock clock;

    public TaskResponseAssembler(
            TaskAssignmentRepository assignmentRepository,
            TaskDependencyRepository dependencyRepository,
            TaskGraph taskGraph,
            Clock clock
    ) {
        this.assignmentRepository = assignmentRepository;
        this.dependencyRepository = dependencyRepository;
        this.taskGraph = taskGraph;
        this.clock = clock;
    }

    public TaskResponse toResponse(Task task) {
        return toResponses(List.of(task)).get(0);
    }

    public List<TaskResponse> toResponses(List<Task> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        List<UUID> taskIds = tasks.stream().map(Task::getId).toList();

        Map<UUID, List<UUID>> assignees = assignmentRepository.findByTaskIds(taskIds).stream()
                .collect(Collectors.groupingBy(
                        assignment -> assignment.getTask().getId(),
                        Collectors.mapping(assignment -> assignment.getAssignee().getId(), Collectors.toList())
                ));
        Set<UUID> blocked = taskGraph.blockedAmong(taskIds);
        Map<UUID, Long> blockingCounts = countActiveDependents(taskIds);

        OffsetDateTime now = OffsetDateTime.now(clock);
        return tasks.stream()
                .map(task -> build(
                        task,
                        assignees.getOrDefault(task.getId(), List.of()),
                        blocked.contains(task.getId()),
                        blockingCounts.getOrDefault(task.getId(), 0L),
                        now
                ))
                .toList();
    }

    private Map<UUID, Long> countActiveDependents(Collection<UUID> taskIds) {
        return dependencyRepository.countActiveDependents(taskIds, TaskStatus.activeStatuses()).stream()
                .collect(Collectors.toMap(TaskCount::getTaskId, TaskCount::getTotal));
    }

    static TaskResponse build(Task task, List<UUID> assigneeIds, boolean blocked, long blockingTasksCount, OffsetDateTime now) {
        return new TaskResponse(
                task.getId(),
                task.getTeam().getId(),
                task.getProject() != null ? task.getProject().getId() : null,
                task.getCreator().getId(),
                task.getTitle(),
                task.getDescription(),
                task.getStatus(),
                task.getPriority(),
                task.getPriority().getScore(),
                task.getDueDate(),
                task.getStartedAt(),
                task.getCompletedAt(),
                task.getPosition(),
                task.getEstimatedHours(),
                task.getActualHours(),
                task.isArchived(),
                task.isOverdue(now),
                task.getDaysUntilDue(now),
                blocked,
                blockingTasksCount,
                List.copyOf(assigneeIds),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }
}
