package czm.dabs_be.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Promotes database credentials mounted as container secrets to the front of the property sources,
 * so {@code ${DB_USER}} and {@code ${DB_PASSWORD}} in application.yml resolve to the mounted values.
 */
public class SecretsPropertySourceEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    private static final Logger log = LoggerFactory.getLogger(SecretsPropertySourceEnvironmentPostProcessor.class);

    static final String PROPERTY_SOURCE_NAME = "dabsSecretsPropertySource";

    private static final Path DB_USER_PATH = Path.of("/run/secrets/dabs_postgres-user");
    private static final Path DB_PASSWORD_PATH = Path.of("/run/secrets/dabs_postgres-password");

    private final List<SecretDescriptor> secretDescriptors;

    public SecretsPropertySourceEnvironmentPostProcessor() {
        this(List.of(
                new SecretDescriptor("DB_USER", DB_USER_PATH),
                new SecretDescriptor("DB_PASSWORD", DB_PASSWORD_PATH)));
    }

    SecretsPropertySourceEnvironmentPostProcessor(List<SecretDescriptor> secretDescriptors) {
        this.secretDescriptors = secretDescriptors;
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        Map<String, Object> secrets = new LinkedHashMap<>();
        for (SecretDescriptor descriptor : secretDescriptors) {
            readSecret(descriptor.path()).ifPresent(value -> secrets.put(descriptor.key(), value));
        }
        if (secrets.isEmpty()) {
            log.debug("No mounted database secrets found, using environment and application.yml");
            return;
        }
        environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, secrets));
        log.info("Loaded mounted secrets for keys {}", secrets.keySet());
    }

    private Optional<String> readSecret(Path path) {
        if (!Files.isReadable(path)) {
            return Optional.empty();
        }
        try {
            String value = Files.readString(path).trim();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (IOException exception) {
            log.warn("Failed to read secret from {}", path, exception);
            return Optional.empty();
        }
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    record SecretDescriptor(String key, Path path) {}
}
