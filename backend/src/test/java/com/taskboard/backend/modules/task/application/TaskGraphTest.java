package com.taskboard.backend.modules.task.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.domain.TaskDependency;
import com.taskboard.backend.modules.task.domain.TaskStatus;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskDependencyRepository;
import com.taskboard.backend.modules.team.domain.Team;
import com.taskboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaskGraphTest {

    @Mock
    private TaskDependencyRepository dependencyRepository;

    private TaskGraph taskGraph;

    private final UUID a = UUID.randomUUID();
    private final UUID b = UUID.randomUUID();
    private final UUID c = UUID.randomUUID();
    private final UUID d = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        taskGraph = new TaskGraph(dependencyRepository);
    }

    @Test
    @DisplayName("a -> b -> c: making c depend on a closes a cycle")
    void detectsTransitiveCycle() {
        when(dependencyRepository.findPrerequisiteIds(List.of(a))).thenReturn(List.of(b));
        when(dependencyRepository.findPrerequisiteIds(List.of(b))).thenReturn(List.of(c));

        assertThat(taskGraph.wouldCreateCycle(c, a)).isTrue();
    }

    @Test
    void unrelatedEdgeIsAccepted() {
        when(dependencyRepository.findPrerequisiteIds(List.of(a))).thenReturn(List.of(b));
        when(dependencyRepository.findPrerequisiteIds(List.of(b))).thenReturn(List.of(c));
        when(dependencyRepository.findPrerequisiteIds(List.of(c))).thenReturn(List.of());

        assertThat(taskGraph.wouldCreateCycle(d, a)).isFalse();
    }

    @Test
    void diamondIsWalkedOncePerNode() {
        // a depends on b and c, both depend on d
        when(dependencyRepository.findPrerequisiteIds(List.of(a))).thenReturn(List.of(b, c));
        when(dependencyRepository.findPrerequisiteIds(List.of(b, c))).thenReturn(List.of(d, d));
        when(dependencyRepository.findPrerequisiteIds(List.of(d))).thenReturn(List.of());

        assertThat(taskGraph.wouldCreateCycle(UUID.randomUUID(), a)).isFalse();
    }

    @Test
    void selfEdgeIsACycle() {
        assertThat(taskGraph.wouldCreateCycle(a, a)).isTrue();
        verifyNoInteractions(dependencyRepository);
    }

    @Test
    void blockedWhenRepositoryReportsOpenPrerequisite() {
        when(dependencyRepository.findBlockedTaskIds(List.of(a), TaskStatus.completedStatuses())).thenReturn(List.of(a));

        assertThat(taskGraph.isBlocked(a)).isTrue();
    }

    @Test
    void emptyInputNeverHitsRepository() {
        assertThat(taskGraph.blockedAmong(List.of())).isEmpty();
        verifyNoInteractions(dependencyRepository);
    }

    @Test
    @DisplayName("only active dependents without other open prerequisites are unblocked")
    void unblockedDependents() {
        Team team = TestEntities.team("Core");
        AppUser user = TestEntities.user("user@example.com");
        Task prerequisite = TestEntities.task(team, user, "Build");
        Task free = TestEntities.task(team, user, "Deploy");
        Task stillBlocked = TestEntities.task(team, user, "Announce");
        Task cancelled = TestEntities.task(team, user, "Old follow-up");
        cancelled.applyStatus(TaskStatus.CANCELLED, TestEntities.NOW);

        when(dependencyRepository.findDependents(prerequisite.getId())).thenReturn(List.of(
                TaskDependency.of(free, prerequisite, user),
                TaskDependency.of(stillBlocked, prerequisite, user),
                TaskDependency.of(cancelled, prerequisite, user)
        ));
        when(dependencyRepository.findBlockedTaskIds(anyCollection(), anyCollection()))
                .thenReturn(List.of(stillBlocked.getId()));

        assertThat(taskGraph.unblockedDependentsOf(prerequisite.getId())).containsExactly(free.getId());
    }
}
