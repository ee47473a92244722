package com.taskboard.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/taskboard")
                .withProperty("jwt.secret", "a-long-enough-secret-for-hmac-sha256-signing")
                .withProperty("jwt.expiration", "1800000")
                .withProperty("jwt.refresh-expiration", "604800000")
                .withProperty("app.cors.allowed-origins", "http://localhost:3000");
    }

    @Test
    void completeConfigurationPasses() {
        EnvironmentValidator validator = new EnvironmentValidator(environment);

        assertThat(validator.collectProblems()).isEmpty();
        validator.validateEnvironment();
    }

    @Test
    void reportsMissingAndShortSecret() {
        environment.setProperty("jwt.secret", "too-short");
        environment.setProperty("app.cors.allowed-origins", " ");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactlyInAnyOrder(
                        "app.cors.allowed-origins is missing",
                        "jwt.secret must be at least 32 characters"
                );
    }

    @Test
    void rejectsAccessTokenLifetimeOutOfRange() {
        environment.setProperty("jwt.expiration", "1000");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .singleElement()
                .asString()
                .startsWith("jwt.expiration must be between");
    }

    @Test
    void rejectsNonNumericLifetime() {
        environment.setProperty("jwt.expiration", "30m");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.expiration must be numeric");
    }

    @Test
    void productionRefusesDevelopmentSecret() {
        environment.setProperty("jwt.secret", EnvironmentValidator.DEV_JWT_SECRET);
        EnvironmentValidator validator = new EnvironmentValidator(environment);
        assertThat(validator.collectProblems()).isEmpty();

        environment.setActiveProfiles("prod");

        assertThatThrownBy(validator::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("development default");
    }
}
