package org.tabula.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the indentation checker.
 */
public interface IndentChecker {

    /**
     * Checks the indentation of one file.
     *
     * @param source The full text of the file.
     * @param fileName A name for the file, used in violations and error messages.
     * @return The violations, ordered by line.
     * @throws IndentCheckException if the file cannot be lexed or parsed.
     */
    List<IndentViolation> check(String source, String fileName) throws IndentCheckException;

    /**
     * Checks the indentation of a file on disk.
     * @param file The path of the file, read as UTF-8.
     * @return The violations, ordered by line.
     * @throws IndentCheckException if the file cannot be lexed or parsed.
     * @throws IOException if the file cannot be read.
     */
    default List<IndentViolation> check(Path file) throws IndentCheckException, IOException {
        return check(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }
}
