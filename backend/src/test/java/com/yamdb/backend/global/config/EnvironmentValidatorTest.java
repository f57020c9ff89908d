package com.yamdb.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void acceptsCompleteConfiguration() {
        EnvironmentValidator validator = new EnvironmentValidator(validEnvironment());

        assertThat(validator.collectProblems()).isEmpty();
    }

    @Test
    void rejectsDevelopmentSecret() {
        MockEnvironment environment = validEnvironment().withProperty("jwt.secret", EnvironmentValidator.DEV_JWT_SECRET);

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .anySatisfy(problem -> assertThat(problem).contains("development default"));
    }

    @Test
    void reportsEveryProblem() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", "short")
                .withProperty("jwt.expiration", "1000")
                .withProperty("app.confirmation.ttl", "PT0S");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .anySatisfy(problem -> assertThat(problem).startsWith("spring.datasource.url"))
                .anySatisfy(problem -> assertThat(problem).startsWith("app.cors.allowed-origins"))
                .anySatisfy(problem -> assertThat(problem).contains("at least 32 bytes"))
                .anySatisfy(problem -> assertThat(problem).startsWith("jwt.expiration must be between"))
                .anySatisfy(problem -> assertThat(problem).contains("must be positive"));
    }

    @Test
    void failsStartupOnProblems() {
        MockEnvironment environment = validEnvironment().withProperty("jwt.expiration", "soon");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.expiration must be a number");
    }

    @Test
    void shippedDefaultsNeedSecretOverride() {
        MockEnvironment environment = environmentFrom("application.yml");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.secret still has the development default");
    }

    @Test
    void localProfileStartsWithoutOverrides() {
        MockEnvironment environment = environmentFrom("application.yml", "application-local.yml");

        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    private static MockEnvironment environmentFrom(String... resources) {
        YamlPropertiesFactoryBean yaml = new YamlPropertiesFactoryBean();
        yaml.setResources(Arrays.stream(resources).map(ClassPathResource::new).toArray(ClassPathResource[]::new));
        MockEnvironment environment = new MockEnvironment();
        yaml.getObject().forEach((key, value) -> environment.setProperty(key.toString(), value.toString()));
        return environment;
    }

    private static MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/yamdb")
                .withProperty("jwt.secret", "a-production-secret-with-plenty-of-entropy-42")
                .withProperty("jwt.expiration", "86400000")
                .withProperty("app.cors.allowed-origins", "https://yamdb.app")
                .withProperty("app.confirmation.ttl", "PT30M");
    }
}
