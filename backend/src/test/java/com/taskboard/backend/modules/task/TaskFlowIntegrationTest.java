package com.taskboard.backend.modules.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;

import com.taskboard.backend.support.AbstractPostgresIntegrationTest;
import com.taskboard.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultMatcher;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
class TaskFlowIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "flow-password-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    private String ownerToken;
    private String memberToken;
    private String outsiderToken;
    private String memberId;
    private String teamId;

    @BeforeEach
    void setUp() throws Exception {
        testUserFactory.ensureUser("owner@example.com", PASSWORD, "Olivia", "Owner");
        memberId = testUserFactory.ensureUser("member@example.com", PASSWORD, "Mark", "Member").getId().toString();
        testUserFactory.ensureUser("outsider@example.com", PASSWORD, "Otto", "Outsider");
        ownerToken = login("owner@example.com");
        memberToken = login("member@example.com");
        outsiderToken = login("outsider@example.com");

        teamId = call(ownerToken, post("/teams"), """
                {"name": "Platform Team"}
                """, status().isCreated()).path("id").asText();

        call(ownerToken, post("/teams/{teamId}/members", teamId), """
                {"email": "member@example.com", "role": "MEMBER"}
                """, status().isCreated());
        call(memberToken, post("/teams/{teamId}/invitations/accept", teamId), null, status().isOk());
    }

    @Test
    void teamIsVisibleToMembersOnly() throws Exception {
        mockMvc.perform(get("/teams/{teamId}", teamId).header("Authorization", bearer(memberToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slug").value("platform-team"))
                .andExpect(jsonPath("$.myRole").value("MEMBER"));

        mockMvc.perform(get("/teams/{teamId}", teamId).header("Authorization", bearer(outsiderToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("TEAM_ACCESS_DENIED"));

        mockMvc.perform(get("/teams/{teamId}/members", teamId).header("Authorization", bearer(ownerToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].role").value("OWNER"))
                .andExpect(jsonPath("$[1].status").value("ACTIVE"));
    }

    @Test
    void memberCannotDeleteTheTeam() throws Exception {
        mockMvc.perform(delete("/teams/{teamId}", teamId).header("Authorization", bearer(memberToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_TEAM_ROLE"));
    }

    @Test
    @DisplayName("a dependent task is blocked until its prerequisite is completed")
    void dependencyBlocksUntilPrerequisiteCompletes() throws Exception {
        String projectId = call(ownerToken, post("/teams/{teamId}/projects", teamId), """
                {"name": "Launch", "color": "#123ABC"}
                """, status().isCreated()).path("id").asText();

        String build = createTask(memberToken, """
                {"title": "Build artifact", "projectId": "%s"}
                """.formatted(projectId));
        String deploy = createTask(memberToken, """
                {"title": "Deploy", "projectId": "%s", "priority": "URGENT", "assigneeIds": ["%s"]}
                """.formatted(projectId, memberId));

        JsonNode dependencies = call(memberToken, post("/tasks/{taskId}/dependencies", deploy), """
                {"prerequisiteTaskId": "%s"}
                """.formatted(build), status().isCreated());
        assertThat(dependencies.path("blocked").asBoolean()).isTrue();

        mockMvc.perform(post("/tasks/{taskId}/start", deploy).header("Authorization", bearer(memberToken)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("TASK_BLOCKED"));

        call(memberToken, post("/tasks/{taskId}/start", build), null, status().isOk());
        JsonNode completed = call(memberToken, post("/tasks/{taskId}/complete", build), null, status().isOk());
        assertThat(completed.path("task").path("status").asText()).isEqualTo("DONE");
        assertThat(completed.path("unblockedTaskIds").get(0).asText()).isEqualTo(deploy);

        JsonNode started = call(memberToken, post("/tasks/{taskId}/start", deploy), null, status().isOk());
        assertThat(started.path("task").path("status").asText()).isEqualTo("IN_PROGRESS");
        assertThat(started.path("task").path("blocked").asBoolean()).isFalse();

        JsonNode project = call(memberToken, get("/projects/{projectId}", projectId), null, status().isOk());
        assertThat(project.path("taskCount").asLong()).isEqualTo(2);
        assertThat(project.path("completedTaskCount").asLong()).isEqualTo(1);

        JsonNode mine = call(memberToken, get("/tasks/me"), null, status().isOk());
        assertThat(mine.path("totalCount").asLong()).isEqualTo(2);
    }

    @Test
    void cyclesAreRejected() throws Exception {
        String first = createTask(memberToken, """
                {"title": "First"}
                """);
        String second = createTask(memberToken, """
                {"title": "Second"}
                """);
        String third = createTask(memberToken, """
                {"title": "Third"}
                """);
        call(memberToken, post("/tasks/{taskId}/dependencies", second), """
                {"prerequisiteTaskId": "%s"}
                """.formatted(first), status().isCreated());
        call(memberToken, post("/tasks/{taskId}/dependencies", third), """
                {"prerequisiteTaskId": "%s"}
                """.formatted(second), status().isCreated());

        mockMvc.perform(post("/tasks/{taskId}/dependencies", first)
                        .header("Authorization", bearer(memberToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"prerequisiteTaskId": "%s"}
                                """.formatted(third)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("CIRCULAR_DEPENDENCY"));
    }

    @Test
    void viewerCannotCreateTasks() throws Exception {
        call(ownerToken, patch("/teams/{teamId}/members/{userId}", teamId, memberId), """
                {"role": "VIEWER"}
                """, status().isOk());

        mockMvc.perform(post("/teams/{teamId}/tasks", teamId)
                        .header("Authorization", bearer(memberToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Sneaky"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_TEAM_ROLE"));
    }

    @Test
    void activityFeedRecordsTeamEvents() throws Exception {
        createTask(memberToken, """
                {"title": "Tracked"}
                """);

        JsonNode feed = call(ownerToken, get("/teams/{teamId}/activity", teamId), null, status().isOk());
        List<String> events = new ArrayList<>();
        feed.path("items").forEach(item -> events.add(item.path("eventType").asText()));

        assertThat(events).first().isEqualTo("TASK_CREATED");
        assertThat(events).contains("TEAM_MEMBER_ADDED");
    }

    @Test
    void teamTaskListSupportsFilters() throws Exception {
        createTask(memberToken, """
                {"title": "Low", "priority": "LOW"}
                """);
        createTask(memberToken, """
                {"title": "High", "priority": "HIGH"}
                """);

        JsonNode high = call(memberToken, get("/teams/{teamId}/tasks", teamId).param("priority", "HIGH"),
                null, status().isOk());
        assertThat(high.path("totalCount").asLong()).isEqualTo(1);
        assertThat(high.path("items").get(0).path("title").asText()).isEqualTo("High");

        JsonNode paged = call(memberToken, get("/teams/{teamId}/tasks", teamId).param("size", "1"),
                null, status().isOk());
        assertThat(paged.path("items").size()).isEqualTo(1);
        assertThat(paged.path("totalPages").asInt()).isEqualTo(2);
    }

    private String createTask(String token, String body) throws Exception {
        return call(token, post("/teams/{teamId}/tasks", teamId), body, status().isCreated()).path("id").asText();
    }

    private JsonNode call(String token, MockHttpServletRequestBuilder request, String body, ResultMatcher expected)
            throws Exception {
        request.header("Authorization", bearer(token));
        if (body != null) {
            request.contentType(MediaType.APPLICATION_JSON).content(body);
        }
        MvcResult result = mockMvc.perform(request).andExpect(expected).andReturn();
        String content = result.getResponse().getContentAsString();
        return content.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(content);
    }

    private String login(String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "%s"}
                                """.formatted(email, PASSWORD)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString())
                .path("tokens").path("accessToken").asText();
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }
}
