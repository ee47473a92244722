package com.taskboard.backend.modules.task.application;

import java.util.List;
import java.util.UUID;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.domain.TaskDependency;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskDependencyRepository;
import com.taskboard.backend.modules.task.presentation.dto.TaskDependenciesResponse;
import com.taskboard.backend.modules.task.presentation.dto.TaskReference;
import com.taskboard.backend.modules.team.application.TeamAccessPolicy;
import com.taskboard.backend.modules.team.domain.TeamMembership;
import com.taskboard.backend.modules.team.domain.TeamRole;
import com.taskboard.backend.modules.team.infrastructure.persistence.TeamRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TaskDependencyService {

    private static final Logger log = LoggerFactory.getLogger(TaskDependencyService.class);

    private final TaskDependencyRepository dependencyRepository;
    private final TeamAccessPolicy accessPolicy;
    private final TaskLoader taskLoader;
    private final TaskGraph taskGraph;
    private final TeamRepository teamRepository;

    public TaskDependencyService(
            TaskDependencyRepository dependencyRepository,
            TeamAccessPolicy accessPolicy,
            TaskLoader taskLoader,
            TaskGraph taskGraph,
            TeamRepository teamRepository
    ) {
        this.dependencyRepository = dependencyRepository;
        this.accessPolicy = accessPolicy;
        this.taskLoader = taskLoader;
        this.taskGraph = taskGraph;
        this.teamRepository = teamRepository;
    }

    @Transactional(readOnly = true)
    public TaskDependenciesResponse listDependencies(UUID taskId, UUID actorId) {
        Task task = taskLoader.loadActive(taskId);
        accessPolicy.requireRole(task.getTeam().getId(), actorId, TeamRole.VIEWER);
        return describe(task);
    }

    public TaskDependenciesResponse addDependency(UUID taskId, UUID prerequisiteId, UUID actorId) {
        if (taskId.equals(prerequisiteId)) {
            throw ProblemException.unprocessable("SELF_DEPENDENCY", "a task cannot depend on itself");
        }
        Task dependent = taskLoader.loadActive(taskId);
        TeamMembership actor = accessPolicy.requireRole(dependent.getTeam().getId(), actorId, TeamRole.MEMBER);
        Task prerequisite = taskLoader.loadActive(prerequisiteId);

        if (!prerequisite.belongsToTeam(dependent.getTeam().getId())) {
            throw ProblemException.unprocessable("CROSS_TEAM_DEPENDENCY", "tasks belong to different teams");
        }
        // edge inserts within a team are serialized
        teamRepository.findByIdForUpdate(dependent.getTeam().getId());
        if (dependencyRepository.existsByPair(taskId, prerequisiteId)) {
            throw ProblemException.conflict("DEPENDENCY_EXISTS", "dependency already exists");
        }
        if (taskGraph.wouldCreateCycle(taskId, prerequisiteId)) {
            throw ProblemException.unprocessable("CIRCULAR_DEPENDENCY", "dependency would create a cycle");
        }

        dependencyRepository.saveAndFlush(TaskDependency.of(dependent, prerequisite, actor.getUser()));
        log.debug("Task {} now depends on {}", taskId, prerequisiteId);
        return describe(dependent);
    }

    public void removeDependency(UUID taskId, UUID prerequisiteId, UUID actorId) {
        Task dependent = taskLoader.loadActive(taskId);
        accessPolicy.requireRole(dependent.getTeam().getId(), actorId, TeamRole.MEMBER);
        TaskDependency dependency = dependencyRepository.findByPair(taskId, prerequisiteId)
                .orElseThrow(() -> ProblemException.notFound("DEPENDENCY_NOT_FOUND", "dependency not found"));
        dependencyRepository.delete(dependency);
    }

    private TaskDependenciesResponse describe(Task task) {
        List<TaskDependency> prerequisites = dependencyRepository.findPrerequisites(task.getId());
        List<TaskDependency> dependents = dependencyRepository.findDependents(task.getId());
        boolean blocked = prerequisites.stream().anyMatch(TaskDependency::isBlocking);
        return new TaskDependenciesResponse(
                task.getId(),
                prerequisites.stream().map(TaskDependency::getPrerequisite).map(TaskReference::from).toList(),
                dependents.stream().map(TaskDependency::getDependent).map(TaskReference::from).toList(),
                blocked
        );
    }
}
