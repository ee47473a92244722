package com.taskboard.backend.modules.task.application;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.domain.TaskDependency;
import com.taskboard.backend.modules.task.domain.TaskStatus;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskDependencyRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-side queries over the dependency graph: blocking state, unblocking and cycle detection.
 */
@Component
@Transactional(readOnly = true)
public class TaskGraph {

    private final TaskDependencyRepository dependencyRepository;

    public TaskGraph(TaskDependencyRepository dependencyRepository) {
        this.dependencyRepository = dependencyRepository;
    }

    public boolean isBlocked(UUID taskId) {
        return !blockedAmong(List.of(taskId)).isEmpty();
    }

    public Set<UUID> blockedAmong(Collection<UUID> taskIds) {
        if (taskIds.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(dependencyRepository.findBlockedTaskIds(taskIds, TaskStatus.completedStatuses()));
    }

    /**
     * Active dependents of {@code prerequisiteId} that have no open prerequisite left.
     * Call after the prerequisite's new status has been written.
     */
    public List<UUID> unblockedDependentsOf(UUID prerequisiteId) {
        List<UUID> candidates = dependencyRepository.findDependents(prerequisiteId).stream()
                .map(TaskDependency::getDependent)
                .filter(task -> task.getStatus().isActive())
                .map(Task::getId)
                .distinct()
                .toList();
        if (candidates.isEmpty()) {
            return List.of();
        }
        Set<UUID> stillBlocked = blockedAmong(candidates);
        return candidates.stream()
                .filter(id -> !stillBlocked.contains(id))
                .toList();
    }

    /**
     * Breadth-first walk over the prerequisites of {@code prerequisiteId}. Adding the edge
     * dependent -> prerequisite closes a cycle when the walk reaches {@code dependentId}.
     */
    public boolean wouldCreateCycle(UUID dependentId, UUID prerequisiteId) {
        if (dependentId.equals(prerequisiteId)) {
            return true;
        }
        Set<UUID> visited = new HashSet<>();
        Deque<UUID> frontier = new ArrayDeque<>();
        frontier.add(prerequisiteId);
        visited.add(prerequisiteId);

        while (!frontier.isEmpty()) {
            List<UUID> level = List.copyOf(frontier);
            frontier.clear();
            for (UUID next : dependencyRepository.findPrerequisiteIds(level)) {
                if (next.equals(dependentId)) {
                    return true;
                }
                if (visited.add(next)) {
                    frontier.add(next);
                }
            }
        }
        return false;
    }
}
