package club.ppmc.bridge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.bridge.model.ServerConfig;
import club.ppmc.bridge.model.SpawnSpec;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

class SpawnRegistryTest {

    private static Validator validator;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void setUpValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void loadsServersInDeclarationOrder() {
        var registry = new SpawnRegistry(new ClassPathResource("servers-test.json"), validator);

        assertThat(registry.names()).containsExactly("echo", "broken", "chunked", "env-probe", "quick-exit");
        SpawnSpec echo = registry.find("echo").orElseThrow();
        assertThat(echo.command()).isEqualTo("cat");
        assertThat(echo.args()).isEmpty();
        assertThat(echo.env()).isEmpty();
        assertThat(registry.find("env-probe").orElseThrow().env()).containsEntry("BRIDGE_PROBE", "from-config");
    }

    @Test
    void missingFileYieldsEmptyRegistry() {
        var registry = new SpawnRegistry(new FileSystemResource(tempDir.resolve("absent.json")), validator);

        assertThat(registry.isEmpty()).isTrue();
        assertThat(registry.names()).isEmpty();
    }

    @Test
    void malformedFileYieldsEmptyRegistry() {
        var registry = new SpawnRegistry(new ClassPathResource("servers-malformed.json"), validator);

        assertThat(registry.size()).isZero();
    }

    @Test
    void nonObjectRootYieldsEmptyRegistry() throws Exception {
        Path file = tempDir.resolve("servers.json");
        Files.writeString(file, "[\"cat\"]");

        var registry = new SpawnRegistry(new FileSystemResource(file), validator);

        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void invalidEntriesAreSkippedIndividually() {
        Map<String, SpawnSpec> loaded = SpawnRegistry.load(
                new ClassPathResource("servers-invalid.json"), SpawnRegistry.newObjectMapper(), validator);

        assertThat(loaded).containsOnlyKeys("good", "with-extras");
        assertThat(loaded.get("with-extras").args()).containsExactly("-u");
        assertThat(loaded.get("with-extras").env()).containsExactly(Map.entry("A", "1"));
    }

    @Test
    void nullArgsAndEnvValuesAreReportedAsConstraintViolations() {
        var config = new ServerConfig("cat", Arrays.asList("-u", null), Collections.singletonMap("A", null));

        assertThat(validator.validate(config))
                .extracting(ConstraintViolation::getMessage)
                .containsExactlyInAnyOrder("args must not contain null values", "env values must not be null");
    }

    @Test
    void unknownNameIsAbsent() {
        var registry = new SpawnRegistry(Map.of("echo", new SpawnSpec("echo", "cat", List.of(), Map.of())));

        assertThat(registry.find("unknown")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void registryCannotBeModified() {
        var registry = new SpawnRegistry(Map.of("echo", new SpawnSpec("echo", "cat", List.of(), Map.of())));

        assertThatThrownBy(() -> registry.specs().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> registry.names().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }
}
