package com.taskboard.backend.modules.task.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;

import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.team.domain.Team;
import com.taskboard.backend.support.TestEntities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TaskTest {

    private static final OffsetDateTime NOW = TestEntities.NOW;

    private final AppUser creator = TestEntities.user("creator@example.com");
    private final Team team = TestEntities.team("Core");

    @Test
    @DisplayName("starting stamps startedAt once and completion stamps completedAt")
    void lifecycleTimestamps() {
        Task task = TestEntities.task(team, creator, "Write docs");

        task.applyStatus(TaskStatus.IN_PROGRESS, NOW);
        task.applyStatus(TaskStatus.IN_REVIEW, NOW.plusHours(2));
        task.applyStatus(TaskStatus.IN_PROGRESS, NOW.plusHours(3));

        assertThat(task.getStartedAt()).isEqualTo(NOW);
        assertThat(task.getCompletedAt()).isNull();

        task.applyStatus(TaskStatus.DONE, NOW.plusHours(5));

        assertThat(task.getStatus()).isEqualTo(TaskStatus.DONE);
        assertThat(task.getCompletedAt()).isEqualTo(NOW.plusHours(5));
    }

    @Test
    void reopeningClearsLifecycleTimestamps() {
        Task task = TestEntities.task(team, creator, "Write docs");
        task.applyStatus(TaskStatus.IN_PROGRESS, NOW);
        task.applyStatus(TaskStatus.DONE, NOW.plusHours(1));

        task.applyStatus(TaskStatus.TODO, NOW.plusHours(2));

        assertThat(task.getStatus()).isEqualTo(TaskStatus.TODO);
        assertThat(task.getStartedAt()).isNull();
        assertThat(task.getCompletedAt()).isNull();
    }

    @Test
    void overdueOnlyWhileActive() {
        Task task = TestEntities.task(team, creator, "Ship");
        task.setDueDate(NOW.minusDays(2));

        assertThat(task.isOverdue(NOW)).isTrue();
        assertThat(task.getDaysUntilDue(NOW)).isEqualTo(-2L);

        task.applyStatus(TaskStatus.DONE, NOW);

        assertThat(task.isOverdue(NOW)).isFalse();
    }

    @Test
    void daysUntilDueRoundsDownPartialDays() {
        Task task = TestEntities.task(team, creator, "Ship");

        task.setDueDate(NOW.minusHours(12));
        assertThat(task.getDaysUntilDue(NOW)).isEqualTo(-1L);

        task.setDueDate(NOW.minusHours(36));
        assertThat(task.getDaysUntilDue(NOW)).isEqualTo(-2L);

        task.setDueDate(NOW.plusHours(36));
        assertThat(task.getDaysUntilDue(NOW)).isEqualTo(1L);

        task.setDueDate(NOW);
        assertThat(task.getDaysUntilDue(NOW)).isZero();
    }

    @Test
    void withoutDueDateNothingIsOverdue() {
        Task task = TestEntities.task(team, creator, "Ship");

        assertThat(task.isOverdue(NOW)).isFalse();
        assertThat(task.getDaysUntilDue(NOW)).isNull();
    }

    @Test
    void belongsToItsTeamOnly() {
        Task task = TestEntities.task(team, creator, "Ship");

        assertThat(task.belongsToTeam(team.getId())).isTrue();
        assertThat(task.belongsToTeam(TestEntities.team("Other").getId())).isFalse();
    }

    @Test
    void dependencyOnSelfIsRejected() {
        Task task = TestEntities.task(team, creator, "Ship");

        assertThatThrownBy(() -> TaskDependency.of(task, task, creator))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dependencyBlocksUntilPrerequisiteCompletes() {
        Task dependent = TestEntities.task(team, creator, "Deploy");
        Task prerequisite = TestEntities.task(team, creator, "Build");
        TaskDependency dependency = TaskDependency.of(dependent, prerequisite, creator);

        assertThat(dependency.isBlocking()).isTrue();

        prerequisite.applyStatus(TaskStatus.CANCELLED, NOW);

        assertThat(dependency.isBlocking()).isFalse();
    }

    @Test
    void deletedPrerequisiteNoLongerBlocks() {
        Task dependent = TestEntities.task(team, creator, "Deploy");
        Task prerequisite = TestEntities.task(team, creator, "Build");
        TaskDependency dependency = TaskDependency.of(dependent, prerequisite, creator);

        prerequisite.softDelete(NOW);

        assertThat(dependency.isBlocking()).isFalse();
    }
}
