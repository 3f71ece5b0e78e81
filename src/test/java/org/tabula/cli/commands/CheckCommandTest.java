package org.tabula.cli.commands;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tabula.cli.CommandLineInterface;
import org.tabula.config.LoggingConfigurator;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the check command: exit codes, output formats and fixing.
 */
@Tag("unit")
public class CheckCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine cmdLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        cmdLine = CommandLineInterface.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testHelpOutput() {
        cmdLine.execute("check", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("--file");
        assertThat(output).contains("--fix");
        assertThat(output).contains("--format");
    }

    @Test
    void testCleanFile() throws Exception {
        Path file = write("clean.js", "if (x) {\n    y();\n}\n");

        int exitCode = cmdLine.execute("check", "--file", file.toString());

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_CLEAN);
        assertThat(out.toString()).isEmpty();
    }

    /**
     * Violations are printed one per line with their position.
     */
    @Test
    void testViolationsAsText() throws Exception {
        // Arrange
        Path file = write("bad.js", "if (x) {\n  y();\n}\n");

        // Act
        int exitCode = cmdLine.execute("check", "-f", file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_VIOLATIONS);
        assertThat(out.toString()).contains(file + ":2:3: Expected indentation of 4 spaces but found 2.");
    }

    @Test
    void testViolationsAsJson() throws Exception {
        Path file = write("bad.js", "if (x) {\n  y();\n}\n");

        int exitCode = cmdLine.execute("check", "-f", file.toString(), "--format", "json");

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_VIOLATIONS);
        JsonArray violations = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertThat(violations.size()).isEqualTo(1);
        JsonObject violation = violations.get(0).getAsJsonObject();
        assertThat(violation.get("expectedWidth").getAsInt()).isEqualTo(4);
        assertThat(violation.getAsJsonObject("source").get("lineNumber").getAsInt()).isEqualTo(2);
    }

    /**
     * With --fix the file is rewritten and the check passes.
     */
    @Test
    void testFixRewritesFile() throws Exception {
        // Arrange
        Path file = write("fix.js", "if (x) {\n  y();\n}\n");

        // Act
        int exitCode = cmdLine.execute("check", "-f", file.toString(), "--fix");

        // Assert
        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_CLEAN);
        assertThat(Files.readString(file)).isEqualTo("if (x) {\n    y();\n}\n");
    }

    /**
     * A configuration file changes the expected indentation.
     */
    @Test
    void testConfigFile() throws Exception {
        // Arrange
        Path file = write("two.js", "if (x) {\n  y();\n}\n");
        Path config = write("two.conf", "tabula.indent.size = 2");

        // Act
        int exitCode = cmdLine.execute("check", "-f", file.toString(), "-c", config.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_CLEAN);
    }

    @Test
    void testInvalidConfigIsAnError() throws Exception {
        Path file = write("any.js", "x();\n");
        Path config = write("bad.conf", "tabula.indent.style = \"dots\"");

        int exitCode = cmdLine.execute("check", "-f", file.toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("Invalid configuration");
    }

    @Test
    void testMissingFileIsAnError() {
        int exitCode = cmdLine.execute("check", "-f", tempDir.resolve("absent.js").toString());

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("Cannot access");
    }

    @Test
    void testSyntaxErrorIsAnError() throws Exception {
        Path file = write("broken.js", "foo(;\n");

        int exitCode = cmdLine.execute("check", "-f", file.toString());

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("broken.js:1:5");
    }
}
