package org.tabula.indent;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line-oriented facts about the tokens of one file: which token comes first on each
 * line, and what whitespace precedes a token on its line.
 */
public final class TokenIndex {

    private final String source;
    private final List<Token> tokens;
    private final Token[] firstTokensByLine;
    private final int lineCount;

    /**
     * Indexes the tokens and comments of a file.
     * @param tokens The tokens and comments in source order; an end-of-file token is skipped.
     * @param source The full text of the file.
     */
    public TokenIndex(List<Token> tokens, String source) {
        this.source = source;
        this.lineCount = countLines(source);
        this.firstTokensByLine = new Token[lineCount + 1];

        List<Token> indexed = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type() == TokenType.END_OF_FILE) {
                continue;
            }
            if (token.id() != indexed.size()) {
                throw new IllegalArgumentException("Token ids must be dense and in source order: " + token);
            }
            indexed.add(token);

            if (firstTokensByLine[token.line()] == null) {
                firstTokensByLine[token.line()] = token;
            }
            // A multi-line token also opens its last line, unless only whitespace precedes its end there.
            if (firstTokensByLine[token.endLine()] == null
                    && !source.substring(token.end() - token.endColumn(), token.end()).isBlank()) {
                firstTokensByLine[token.endLine()] = token;
            }
        }
        this.tokens = Collections.unmodifiableList(indexed);
    }

    /**
     * @param line A 1-based line number.
     * @return The first token on that line, or null for a blank line.
     */
    public Token firstTokenOfLine(int line) {
        if (line < 1 || line > lineCount) {
            return null;
        }
        return firstTokensByLine[line];
    }

    /**
     * @param token Any token of this file.
     * @return The first token on the line where the given token starts.
     */
    public Token firstTokenOfLine(Token token) {
        return firstTokensByLine[token.line()];
    }

    public boolean isFirstTokenOfLine(Token token) {
        return token.equals(firstTokensByLine[token.line()]);
    }

    /**
     * @param token Any token of this file.
     * @return The text between the start of the token's line and the token.
     */
    public String actualIndent(Token token) {
        return source.substring(token.start() - token.column(), token.start());
    }

    public int actualIndentWidth(Token token) {
        return actualIndent(token).length();
    }

    /**
     * @param id A token id.
     * @return The token with that id.
     */
    public Token token(int id) {
        return tokens.get(id);
    }

    /**
     * @return The indexed tokens and comments in source order.
     */
    public List<Token> tokens() {
        return tokens;
    }

    /**
     * @return The number of tokens indexed, which bounds every token id.
     */
    public int size() {
        return tokens.size();
    }

    /**
     * @return The number of physical lines of the file.
     */
    public int lineCount() {
        return lineCount;
    }

    private static int countLines(String source) {
        int lines = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }
}
