package com.taskboard.backend.modules.task.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.activity.application.ActivityLogService;
import com.taskboard.backend.modules.activity.application.ActivityLogService.ActivityCommand;
import com.taskboard.backend.modules.activity.domain.ActivityEventType;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.domain.TaskAssignment;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskAssignmentRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskboard.backend.modules.task.presentation.dto.TaskAssignmentResponse;
import com.taskboard.backend.modules.team.application.TeamAccessPolicy;
import com.taskboard.backend.modules.team.domain.Team;
import com.taskboard.backend.modules.team.domain.TeamMembership;
import com.taskboard.backend.modules.team.domain.TeamRole;
import com.taskboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaskAssignmentServiceTest {

    @Mock
    private TaskAssignmentRepository assignmentRepository;

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private TeamAccessPolicy accessPolicy;

    @Mock
    private ActivityLogService activityLogService;

    private TaskAssignmentService assignmentService;

    private Team team;
    private AppUser lead;
    private AppUser colleague;
    private TeamMembership leadMembership;
    private Task task;

    @BeforeEach
    void setUp() {
        assignmentService = new TaskAssignmentService(
                assignmentRepository,
                appUserRepository,
                accessPolicy,
                new TaskLoader(taskRepository),
                activityLogService,
                Clock.fixed(TestEntities.NOW.toInstant(), ZoneOffset.UTC)
        );
        team = TestEntities.team("Core");
        lead = TestEntities.user("lead@example.com");
        colleague = TestEntities.user("colleague@example.com");
        leadMembership = TestEntities.activeMember(lead, team, TeamRole.MEMBER);
        task = TestEntities.task(team, lead, "Review PR");
        when(taskRepository.findActiveById(task.getId())).thenReturn(Optional.of(task));
    }

    @Test
    void listAssignmentsRequiresViewerAndMapsAssignees() {
        TaskAssignment assignment = TaskAssignment.of(task, colleague, lead, TestEntities.NOW);
        when(assignmentRepository.findByTaskId(task.getId())).thenReturn(List.of(assignment));

        List<TaskAssignmentResponse> responses = assignmentService.listAssignments(task.getId(), lead.getId());

        verify(accessPolicy).requireRole(team.getId(), lead.getId(), TeamRole.VIEWER);
        assertThat(responses).singleElement().satisfies(response -> {
            assertThat(response.taskId()).isEqualTo(task.getId());
            assertThat(response.assignee().id()).isEqualTo(colleague.getId());
            assertThat(response.assignedBy()).isEqualTo(lead.getId());
            assertThat(response.assignedAt()).isEqualTo(TestEntities.NOW);
        });
    }

    @Test
    void assignsActiveTeamMember() {
        when(accessPolicy.requireRole(team.getId(), lead.getId(), TeamRole.MEMBER)).thenReturn(leadMembership);
        when(accessPolicy.isActiveMember(team.getId(), colleague.getId())).thenReturn(true);
        when(assignmentRepository.existsByTaskIdAndAssigneeId(task.getId(), colleague.getId())).thenReturn(false);
        when(appUserRepository.getReferenceById(colleague.getId())).thenReturn(colleague);
        when(assignmentRepository.save(any(TaskAssignment.class))).thenAnswer(invocation -> invocation.getArgument(0));

        TaskAssignmentResponse response = assignmentService.assign(task.getId(), colleague.getId(), lead.getId());

        assertThat(response.taskId()).isEqualTo(task.getId());
        assertThat(response.assignee().id()).isEqualTo(colleague.getId());
        assertThat(response.assignedBy()).isEqualTo(lead.getId());
        assertThat(response.assignedAt()).isEqualTo(TestEntities.NOW);

        ArgumentCaptor<ActivityCommand> command = ArgumentCaptor.forClass(ActivityCommand.class);
        verify(activityLogService).record(command.capture());
        assertThat(command.getValue().eventType()).isEqualTo(ActivityEventType.TASK_ASSIGNED);
        assertThat(command.getValue().detail()).containsEntry("userId", colleague.getId().toString());
    }

    @Test
    void rejectsNonMemberAssignee() {
        when(accessPolicy.requireRole(team.getId(), lead.getId(), TeamRole.MEMBER)).thenReturn(leadMembership);
        when(accessPolicy.isActiveMember(team.getId(), colleague.getId())).thenReturn(false);

        assertThatThrownBy(() -> assignmentService.assign(task.getId(), colleague.getId(), lead.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ASSIGNEE_NOT_TEAM_MEMBER"));
        verify(assignmentRepository, never()).save(any());
    }

    @Test
    void rejectsDuplicateAssignment() {
        when(accessPolicy.requireRole(team.getId(), lead.getId(), TeamRole.MEMBER)).thenReturn(leadMembership);
        when(accessPolicy.isActiveMember(team.getId(), colleague.getId())).thenReturn(true);
        when(assignmentRepository.existsByTaskIdAndAssigneeId(task.getId(), colleague.getId())).thenReturn(true);

        assertThatThrownBy(() -> assignmentService.assign(task.getId(), colleague.getId(), lead.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ALREADY_ASSIGNED"));
    }

    @Test
    void unassignRemovesAssignmentAndRecordsActivity() {
        TaskAssignment assignment = TaskAssignment.of(task, colleague, lead, TestEntities.NOW.minusDays(1));
        when(assignmentRepository.findByTaskIdAndAssigneeId(task.getId(), colleague.getId()))
                .thenReturn(Optional.of(assignment));

        assignmentService.unassign(task.getId(), colleague.getId(), lead.getId());

        verify(assignmentRepository).delete(assignment);
        ArgumentCaptor<ActivityCommand> command = ArgumentCaptor.forClass(ActivityCommand.class);
        verify(activityLogService).record(command.capture());
        assertThat(command.getValue().eventType()).isEqualTo(ActivityEventType.TASK_UNASSIGNED);
    }

    @Test
    void unassignUnknownAssignmentIsNotFound() {
        when(assignmentRepository.findByTaskIdAndAssigneeId(task.getId(), colleague.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> assignmentService.unassign(task.getId(), colleague.getId(), lead.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ASSIGNMENT_NOT_FOUND"));
    }
}
