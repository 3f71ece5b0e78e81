package org.tabula.api;

/**
 * An exception that is thrown when a file cannot be checked, typically because it does
 * not lex or parse.
 * <p>
 * It is part of the public API and hides the internal exception types of the checker.
 */
public class IndentCheckException extends Exception {

    /**
     * Constructs a new check exception with the specified detail message.
     * @param message The detail message.
     */
    public IndentCheckException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new check exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public IndentCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
