package czm.dabs_be.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringApplication;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.mock.env.MockEnvironment;

class SecretsPropertySourceEnvironmentPostProcessorTest {

    @Test
    void mountedCredentialsOverrideEnvironment(@TempDir Path tempDir) throws IOException {
        Path user = tempDir.resolve("dabs_postgres-user");
        Path password = tempDir.resolve("dabs_postgres-password");
        Files.writeString(user, "site_admin\n");
        Files.writeString(password, "s3cret");

        SecretsPropertySourceEnvironmentPostProcessor postProcessor = new SecretsPropertySourceEnvironmentPostProcessor(
                List.of(
                        new SecretsPropertySourceEnvironmentPostProcessor.SecretDescriptor("DB_USER", user),
                        new SecretsPropertySourceEnvironmentPostProcessor.SecretDescriptor("DB_PASSWORD", password)));

        ConfigurableEnvironment environment = new MockEnvironment();
        environment.getPropertySources().addFirst(new MapPropertySource("env", Map.of("DB_PASSWORD", "from-env")));

        postProcessor.postProcessEnvironment(environment, new SpringApplication(Object.class));

        assertThat(environment.getProperty("DB_USER")).isEqualTo("site_admin");
        assertThat(environment.getProperty("DB_PASSWORD")).isEqualTo("s3cret");
        assertThat(environment.getPropertySources().iterator().next().getName())
                .isEqualTo(SecretsPropertySourceEnvironmentPostProcessor.PROPERTY_SOURCE_NAME);
    }

    @Test
    void missingOrBlankSecretsLeaveEnvironmentAlone(@TempDir Path tempDir) throws IOException {
        Path blank = tempDir.resolve("blank");
        Files.writeString(blank, "   ");

        SecretsPropertySourceEnvironmentPostProcessor postProcessor = new SecretsPropertySourceEnvironmentPostProcessor(
                List.of(
                        new SecretsPropertySourceEnvironmentPostProcessor.SecretDescriptor("DB_USER", blank),
                        new SecretsPropertySourceEnvironmentPostProcessor.SecretDescriptor("DB_PASSWORD", tempDir.resolve("missing"))));

        ConfigurableEnvironment environment = new MockEnvironment();
        environment.getPropertySources().addFirst(new MapPropertySource("env", Map.of("DB_USER", "env-user", "DB_PASSWORD", "env-db")));

        postProcessor.postProcessEnvironment(environment, new SpringApplication(Object.class));

        assertThat(environment.getProperty("DB_USER")).isEqualTo("env-user");
        assertThat(environment.getProperty("DB_PASSWORD")).isEqualTo("env-db");
        assertThat(environment.getPropertySources().get(SecretsPropertySourceEnvironmentPostProcessor.PROPERTY_SOURCE_NAME)).isNull();
    }
}
