package com.taskboard.backend.modules.task.presentation;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.UUID;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.global.error.RestExceptionHandler;
import com.taskboard.backend.global.security.JwtAuthenticationPrincipal;
import com.taskboard.backend.modules.task.application.TaskAction;
import com.taskboard.backend.modules.task.application.TaskSearchFilter;
import com.taskboard.backend.modules.task.application.TaskService;
import com.taskboard.backend.modules.task.domain.TaskPriority;
import com.taskboard.backend.modules.task.domain.TaskStatus;
import com.taskboard.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskboard.backend.modules.task.presentation.dto.TaskResponse;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class TaskControllerTest {

    @Mock
    private TaskService taskService;

    private MockMvc mockMvc;
    private final UUID userId = UUID.randomUUID();
    private final UUID teamId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TaskController(taskService))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                new JwtAuthenticationPrincipal(userId, "member@example.com"), null, List.of()));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void createReturnsCreatedTask() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.createTask(eq(teamId), eq(userId), any(CreateTaskRequest.class)))
                .thenReturn(taskResponse(taskId, "Write docs"));

        mockMvc.perform(post("/teams/{teamId}/tasks", teamId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Write docs", "priority": "HIGH"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(taskId.toString()))
                .andExpect(jsonPath("$.priority").value("HIGH"));
    }

    @Test
    void blankTitleIsValidationError() throws Exception {
        mockMvc.perform(post("/teams/{teamId}/tasks", teamId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "  "}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
        verifyNoInteractions(taskService);
    }

    @Test
    void businessErrorsRenderAsProblemResponses() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.transition(taskId, userId, TaskAction.COMPLETE))
                .thenThrow(ProblemException.conflict("TASK_BLOCKED", "task has unfinished prerequisites"));

        mockMvc.perform(post("/tasks/{taskId}/complete", taskId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("TASK_BLOCKED"))
                .andExpect(jsonPath("$.status").value(409))
                .andExpect(jsonPath("$.instance").value("/tasks/" + taskId + "/complete"));
    }

    @Test
    void malformedIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/tasks/{taskId}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("malformed_request"));
    }

    @Test
    void listPassesFiltersThrough() throws Exception {
        mockMvc.perform(get("/teams/{teamId}/tasks", teamId)
                        .param("status", "IN_PROGRESS")
                        .param("page", "2")
                        .param("size", "5"))
                .andExpect(status().isOk());

        verify(taskService).listTeamTasks(eq(teamId), eq(userId),
                eq(new TaskSearchFilter(null, TaskStatus.IN_PROGRESS, null, null, false)),
                eq(2), eq(5));
    }

    private static TaskResponse taskResponse(UUID taskId, String title) {
        return new TaskResponse(
                taskId, UUID.randomUUID(), null, UUID.randomUUID(), title, null,
                TaskStatus.TODO, TaskPriority.HIGH, TaskPriority.HIGH.getScore(),
                null, null, null, 0, null, null,
                false, false, null, false, 0L, List.of(), null, null
        );
    }
}
