package org.envkit.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

/**
 * Unit tests for ConfigLoader and CliSettings, covering the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Configuration File
 * 3. Default reference configuration (lowest priority)
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("envkit.output.format");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults come from reference.conf")
    void loadDefaults_shouldProvideReferenceSettings() {
        // When
        final CliSettings settings = CliSettings.from(ConfigLoader.loadDefaults());

        // Then
        assertEquals(".env", settings.defaultFile());
        assertTrue(settings.exportPrefix());
        assertEquals(CliSettings.OutputFormat.JSON, settings.outputFormat());
        assertTrue(settings.pretty());
    }

    @Test
    @DisplayName("Explicit config file overrides defaults and keeps unset keys")
    void resolve_explicitFileShouldOverrideDefaults() throws IOException {
        // Given
        final Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, """
            envkit {
              default-file = "config/app.env"
              output.format = dotenv
            }
            """);
        final List<String> messages = new ArrayList<>();

        // When
        final Config config = ConfigLoader.resolve(file.toFile(), (level, message) -> messages.add(message));
        final CliSettings settings = CliSettings.from(config);

        // Then
        assertEquals("config/app.env", settings.defaultFile());
        assertEquals(CliSettings.OutputFormat.DOTENV, settings.outputFormat());
        assertTrue(settings.pretty(), "keys missing from the file fall back to reference.conf");
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).contains("--config"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void resolve_systemPropertyShouldOverrideFile() throws IOException {
        // Given
        final Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "envkit.output.format = JSON\n");
        System.setProperty("envkit.output.format", "DOTENV");
        ConfigFactory.invalidateCaches();

        // When
        final Config config = ConfigLoader.resolve(file.toFile(), (level, message) -> { });

        // Then
        assertEquals(CliSettings.OutputFormat.DOTENV, CliSettings.from(config).outputFormat());
    }

    @Test
    @DisplayName("Missing explicit file is rejected")
    void resolve_missingExplicitFileShouldFail() {
        final File missing = tempDir.resolve("missing.conf").toFile();

        final IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(ex.getMessage().contains("Configuration file not found"));
    }

    @Test
    @DisplayName("-Dconfig.file is used when no explicit file is given")
    void resolve_shouldUseConfigFileProperty() throws IOException {
        // Given
        final Path file = tempDir.resolve("from-property.conf");
        Files.writeString(file, "envkit.parser.export-prefix = false\n");
        System.setProperty("config.file", file.toString());

        // When
        final Config config = ConfigLoader.resolve(null, (level, message) -> { });

        // Then
        assertFalse(CliSettings.from(config).exportPrefix());
    }

    @Test
    @DisplayName("Falling back to classpath defaults is reported as a warning")
    void resolve_withoutAnyConfigFileShouldWarn() {
        // Given
        System.clearProperty("config.file");
        assumeFalse(new File(ConfigLoader.CONFIG_FILE_NAME).exists(), "working directory holds a config file");
        final List<ConfigLoader.MessageLevel> levels = new ArrayList<>();
        final List<String> messages = new ArrayList<>();

        // When
        final Config config = ConfigLoader.resolve(null, (level, message) -> {
            levels.add(level);
            messages.add(message);
        });

        // Then
        assertEquals(List.of(ConfigLoader.MessageLevel.WARN), levels);
        assertTrue(messages.get(0).contains(ConfigLoader.CONFIG_FILE_NAME));
        assertEquals(".env", CliSettings.from(config).defaultFile());
    }

    @Test
    @DisplayName("Unknown output format is rejected")
    void from_unknownFormatShouldFail() {
        final Config config = ConfigFactory.parseString("envkit.output.format = XML")
                .withFallback(ConfigLoader.loadDefaults());

        assertThrows(IllegalArgumentException.class, () -> CliSettings.from(config));
    }
}
