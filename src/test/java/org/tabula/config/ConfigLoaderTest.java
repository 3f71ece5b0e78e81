package org.tabula.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the layering of configuration sources.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty("tabula.indent.size");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void load_withoutFile_shouldUseReferenceDefaults() {
        // When
        final Config config = ConfigLoader.load();

        // Then
        assertThat(config.getString("tabula.indent.style")).isEqualTo("space");
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
    }

    @Test
    void load_withExplicitFile_shouldOverrideDefaults() throws Exception {
        // Given
        final File file = tempDir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), "tabula.indent { size = 2, switch-case = 1 }");

        // When
        final Config config = ConfigLoader.load(file);

        // Then
        assertThat(config.getInt("tabula.indent.size")).isEqualTo(2);
        assertThat(config.getInt("tabula.indent.switch-case")).isEqualTo(1);
        assertThat(config.getBoolean("tabula.indent.flat-ternary-expressions")).isFalse();
    }

    @Test
    void load_withSystemProperty_shouldOverrideFile() throws Exception {
        // Given
        final File file = tempDir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), "tabula.indent.size = 2");
        System.setProperty("tabula.indent.size", "3");
        ConfigFactory.invalidateCaches();

        // When
        final Config config = ConfigLoader.load(file);

        // Then
        assertThat(config.getInt("tabula.indent.size")).isEqualTo(3);
    }

    @Test
    void load_withMissingExplicitFile_shouldFail() {
        final File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing)).isInstanceOf(ConfigException.IO.class);
    }
}
