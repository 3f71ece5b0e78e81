package org.tabula.diagnostics;

/**
 * Represents a single error that occurs while reading a source file before it can be
 * checked.
 *
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The 1-based column of the issue.
 */
public record Diagnostic(
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    @Override
    public String toString() {
        return String.format("[ERROR] %s:%d:%d: %s", fileName, lineNumber, columnNumber, message);
    }
}
