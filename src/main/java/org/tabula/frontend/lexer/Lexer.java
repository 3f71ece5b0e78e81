package org.tabula.frontend.lexer;

import org.tabula.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Comments are kept as tokens because their indentation is checked like any other line.
 * Every token carries its character range and its start and end positions, and gets a
 * dense id in source order.
 */
public class Lexer {

    private static final Set<String> KEYWORDS = Set.of(
            "if", "else", "while", "do", "for", "switch", "case", "default",
            "return", "break", "continue", "var", "let", "const", "function",
            "true", "false", "null");

    private static final List<String> MULTI_CHAR_OPERATORS = List.of(
            "===", "!==", "==", "!=", "<=", ">=", "&&", "||", "+=", "-=", "++", "--");

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int startLine = 1;
    private int startColumn = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being checked, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens and comments in source order, terminated by an
     *         {@link TokenType#END_OF_FILE} token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart;
            scanToken();
        }
        start = current;
        startLine = line;
        startColumn = current - lineStart;
        addToken(TokenType.END_OF_FILE);
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case '{' -> addToken(TokenType.LEFT_BRACE);
            case '}' -> addToken(TokenType.RIGHT_BRACE);
            case '[' -> addToken(TokenType.LEFT_BRACKET);
            case ']' -> addToken(TokenType.RIGHT_BRACKET);
            case ',' -> addToken(TokenType.COMMA);
            case ';' -> addToken(TokenType.SEMICOLON);
            case ':' -> addToken(TokenType.COLON);
            case '?' -> addToken(TokenType.QUESTION);
            case '.' -> {
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
            }
            case '"', '\'' -> string(c);
            case '`' -> template();
            case '/' -> {
                if (peek() == '/') {
                    lineComment();
                } else if (peek() == '*') {
                    blockComment();
                } else {
                    operator();
                }
            }
            case '+', '-', '*', '%', '=', '!', '<', '>', '&', '|' -> operator();
            case ' ', '\r', '\t', '\f' -> {
                // Whitespace is not tokenized; indentation is read from the source text.
            }
            case '\n' -> newLine();
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER);
    }

    private void number() {
        if (previous() == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'b' || peek() == 'B')) {
            advance();
            while (isAlphaNumeric(peek())) advance();
        } else {
            while (isDigit(peek())) advance();
            if (peek() == '.' && isDigit(peekNext())) {
                advance();
                while (isDigit(peek())) advance();
            }
        }
        addToken(TokenType.NUMBER);
    }

    private void operator() {
        for (String candidate : MULTI_CHAR_OPERATORS) {
            if (source.startsWith(candidate, start)) {
                while (current < start + candidate.length()) advance();
                addToken(TokenType.OPERATOR);
                return;
            }
        }
        char c = previous();
        if (c == '&' || c == '|') {
            error("Unexpected character: " + c);
            return;
        }
        addToken(TokenType.OPERATOR);
    }

    private void string(char quote) {
        while (peek() != quote && !isAtEnd()) {
            if (peek() == '\n') {
                error("Unterminated string.");
                return;
            }
            if (peek() == '\\') {
                advance();
                if (peek() == '\n') continue;
            }
            if (!isAtEnd()) advance();
        }

        if (isAtEnd()) {
            error("Unterminated string.");
            return;
        }

        // The closing quote
        advance();
        addToken(TokenType.STRING);
    }

    private void template() {
        while (peek() != '`' && !isAtEnd()) {
            if (peek() == '\\') advance();
            if (!isAtEnd() && advance() == '\n') {
                newLine();
            }
        }

        if (isAtEnd()) {
            error("Unterminated template string.");
            return;
        }
        advance();
        addToken(TokenType.TEMPLATE);
    }

    private void lineComment() {
        while (peek() != '\n' && !isAtEnd()) advance();
        addToken(TokenType.LINE_COMMENT);
    }

    private void blockComment() {
        advance(); // consume '*'
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
            if (advance() == '\n') {
                newLine();
            }
        }

        if (isAtEnd()) {
            error("Unterminated block comment.");
            return;
        }
        advance();
        advance();
        addToken(TokenType.BLOCK_COMMENT);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private void addToken(TokenType type) {
        String text = source.substring(start, current);
        tokens.add(new Token(tokens.size(), type, text, start, current,
                startLine, startColumn, line, current - lineStart, logicalFileName));
    }

    private void error(String message) {
        diagnostics.reportError(message, logicalFileName, startLine, startColumn + 1);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_' || c == '$';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
