package org.tabula.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabula.Checker;
import org.tabula.api.IndentCheckException;
import org.tabula.api.IndentViolation;
import org.tabula.config.ConfigLoader;
import org.tabula.config.LoggingConfigurator;
import org.tabula.report.IndentFixer;
import org.tabula.rules.IndentOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "check", mixinStandardHelpOptions = true, description = "Checks the indentation of a source file.")
public class CheckCommand implements Callable<Integer> {

    /** No violations. */
    public static final int EXIT_CLEAN = 0;
    /** Violations were found (and, with --fix, remain after fixing). */
    public static final int EXIT_VIOLATIONS = 1;
    /** The file could not be checked. */
    public static final int EXIT_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CheckCommand.class);

    /**
     * Output formats for violations.
     */
    public enum Format {
        TEXT,
        JSON
    }

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @Option(names = "--fix", description = "Rewrites the file with corrected indentation.")
    private boolean fix;

    @Option(names = "--format", defaultValue = "text", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private Format format;

    @Option(names = {"-c", "--config"}, description = "Path to a configuration file (default: tabula.conf).")
    private File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Logs the progress of the check.")
    private boolean verbose;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        IndentOptions options;
        try {
            Config config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            options = IndentOptions.fromConfig(config.getConfig("tabula.indent"));
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_ERROR;
        }
        if (verbose) {
            LoggingConfigurator.enableVerbose();
        }

        Checker checker = new Checker(options);
        List<IndentViolation> violations;
        try {
            String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            violations = checker.check(source, file.getPath());
            if (fix && !violations.isEmpty()) {
                String fixed = IndentFixer.fix(source, violations);
                Files.writeString(file.toPath(), fixed, StandardCharsets.UTF_8);
                LOG.info("Fixed {} lines in {}", violations.size(), file.getPath());
                violations = checker.check(fixed, file.getPath());
            }
        } catch (IOException e) {
            err.println("Cannot access " + file.getPath() + ": " + e.getMessage());
            return EXIT_ERROR;
        } catch (IndentCheckException e) {
            err.println(e.getMessage());
            return EXIT_ERROR;
        }

        print(violations, out);
        return violations.isEmpty() ? EXIT_CLEAN : EXIT_VIOLATIONS;
    }

    private void print(List<IndentViolation> violations, PrintWriter out) {
        if (format == Format.JSON) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(violations));
        } else {
            for (IndentViolation violation : violations) {
                out.println(violation.source() + ": " + violation.message());
            }
        }
        out.flush();
    }
}
