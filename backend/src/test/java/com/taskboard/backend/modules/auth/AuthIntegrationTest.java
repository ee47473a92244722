package com.taskboard.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.taskboard.backend.modules.auth.application.RefreshTokenHasher;
import com.taskboard.backend.modules.auth.domain.UserSession;
import com.taskboard.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.taskboard.backend.support.AbstractPostgresIntegrationTest;
import com.taskboard.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String EMAIL = "alice@example.com";
    private static final String PASSWORD = "alice-password-1";
    private static final String DEVICE_ID = "integration-laptop";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserSessionRepository userSessionRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    @BeforeEach
    void setUp() {
        testUserFactory.ensureUser(EMAIL, PASSWORD, "Alice", "Doe");
    }

    @Test
    void registerThenLogin() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "Bob@Example.com",
                                  "password": "bob-password-1",
                                  "firstName": "Bob",
                                  "lastName": "Builder"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email").value("bob@example.com"))
                .andExpect(jsonPath("$.initials").value("BB"))
                .andExpect(jsonPath("$.timezone").value("UTC"));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "bob@example.com", "password": "bob-password-1"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.user.email").value("bob@example.com"));
    }

    @Test
    void duplicateRegistrationIsConflict() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "ALICE@example.com",
                                  "password": "another-password",
                                  "firstName": "Alice",
                                  "lastName": "Again"
                                }
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_ALREADY_REGISTERED"));
    }

    @Test
    void invalidRegistrationIsUnprocessable() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "not-an-email", "password": "short", "firstName": "", "lastName": "X"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "wrong-password"}
                                """.formatted(EMAIL)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void protectedEndpointsNeedAToken() throws Exception {
        mockMvc.perform(get("/users/me"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/users/me").header("Authorization", "Bearer not-a-real-token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void profileCanBeReadAndUpdatedWithAccessToken() throws Exception {
        String accessToken = login().path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/users/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.fullName").value("Alice Doe"));

        mockMvc.perform(patch("/users/me")
                        .header("Authorization", "Bearer " + accessToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"lastName": "Smith", "timezone": "Asia/Seoul"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastName").value("Smith"))
                .andExpect(jsonPath("$.timezone").value("Asia/Seoul"));
    }

    @Test
    void refreshRotatesTokenAndOldOneStopsWorking() throws Exception {
        String original = login().path("tokens").path("refreshToken").asText();

        MvcResult refreshed = mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(original, DEVICE_ID)))
                .andExpect(status().isOk())
                .andReturn();
        String rotated = objectMapper.readTree(refreshed.getResponse().getContentAsString())
                .path("tokens").path("refreshToken").asText();

        assertThat(rotated).isNotBlank().isNotEqualTo(original);
        UserSession old = userSessionRepository.findByRefreshTokenHash(RefreshTokenHasher.hash(original)).orElseThrow();
        assertThat(old.getRevokedReason()).isEqualTo("ROTATED");

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(original, DEVICE_ID)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_REFRESH_TOKEN"));
    }

    @Test
    void refreshFromAnotherDeviceRevokesTheSession() throws Exception {
        String refreshToken = login().path("tokens").path("refreshToken").asText();

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(refreshToken, "someone-elses-phone")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("REFRESH_TOKEN_DEVICE_MISMATCH"));

        UserSession session = userSessionRepository.findByRefreshTokenHash(RefreshTokenHasher.hash(refreshToken)).orElseThrow();
        assertThat(session.getRevokedReason()).isEqualTo("DEVICE_MISMATCH");
    }

    @Test
    void logoutRevokesSession() throws Exception {
        String refreshToken = login().path("tokens").path("refreshToken").asText();

        mockMvc.perform(post("/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(refreshToken)))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(refreshToken, DEVICE_ID)))
                .andExpect(status().isUnauthorized());

        // unknown tokens are accepted silently
        mockMvc.perform(post("/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "never-issued"}
                                """))
                .andExpect(status().isNoContent());
    }

    private JsonNode login() throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "%s", "deviceId": "%s"}
                                """.formatted(EMAIL, PASSWORD, DEVICE_ID)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens.accessToken").isNotEmpty())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static String refreshBody(String refreshToken, String deviceId) {
        return """
                {"refreshToken": "%s", "deviceId": "%s"}
                """.formatted(refreshToken, deviceId);
    }
}
