package org.syntaxscript.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CompilerOptions loading to verify the configuration priority hierarchy:
 * 1. System Properties
 * 2. Configuration File
 * 3. Default reference configuration (lowest priority)
 */
@Tag("unit")
class CompilerOptionsTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        // Invalidate the cache before each test to ensure a clean slate
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("syntaxscript.compiler.format");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when no configuration file exists")
    void load_shouldUseDefaultsWithoutFile() {
        // Act
        CompilerOptions options = CompilerOptions.load(tempDir.resolve("missing.conf"));

        // Assert
        assertEquals(Path.of("src"), options.rootDir());
        assertEquals(Path.of("out"), options.outDir());
        assertEquals("ts", options.format());
        assertEquals(2, options.verbosity());
    }

    @Test
    @DisplayName("Configuration file should override defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        // Arrange
        Path file = tempDir.resolve("syntaxscript.conf");
        Files.writeString(file, "syntaxscript.compiler { format = js, out = build }");

        // Act
        CompilerOptions options = CompilerOptions.load(file);

        // Assert
        assertEquals("js", options.format());
        assertEquals(Path.of("build"), options.outDir());
        assertEquals(Path.of("src"), options.rootDir()); // Default unchanged
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        // Arrange
        Path file = tempDir.resolve("syntaxscript.conf");
        Files.writeString(file, "syntaxscript.compiler.format = js");
        System.setProperty("syntaxscript.compiler.format", "py");
        ConfigFactory.invalidateCaches();

        // Act
        CompilerOptions options = CompilerOptions.load(file);

        // Assert
        assertEquals("py", options.format());
    }

    @Test
    @DisplayName("Blank target format should be rejected")
    void fromConfig_shouldRejectBlankFormat() throws IOException {
        // Arrange
        Path file = tempDir.resolve("syntaxscript.conf");
        Files.writeString(file, "syntaxscript.compiler.format = \"\"");

        // Act & Assert
        assertThrows(ConfigException.BadValue.class, () -> CompilerOptions.load(file));
    }

    @Test
    @DisplayName("Wrongly typed verbosity should be rejected")
    void fromConfig_shouldRejectWrongType() throws IOException {
        // Arrange
        Path file = tempDir.resolve("syntaxscript.conf");
        Files.writeString(file, "syntaxscript.compiler.verbosity = loud");

        // Act & Assert
        assertThrows(ConfigException.WrongType.class, () -> CompilerOptions.load(file));
    }

    @Test
    @DisplayName("A directory in place of the configuration file should be skipped")
    void load_shouldSkipDirectory() throws IOException {
        // Arrange
        Path directory = Files.createDirectory(tempDir.resolve("syntaxscript.conf"));

        // Act
        CompilerOptions options = CompilerOptions.load(directory);

        // Assert
        assertEquals("ts", options.format());
    }

    @Test
    @DisplayName("Options should be read from an already resolved configuration")
    void fromConfig_shouldReadSection() {
        // Arrange
        Config config = ConfigFactory.parseString(
                "syntaxscript.compiler { root = lib, out = dist, format = js, verbosity = 4 }");

        // Act
        CompilerOptions options = CompilerOptions.fromConfig(config);

        // Assert
        assertEquals(new CompilerOptions(Path.of("lib"), Path.of("dist"), "js", 4), options);
        assertThrows(IllegalArgumentException.class, () -> new CompilerOptions(Path.of("lib"), Path.of("dist"), " ", 4));
    }
}
