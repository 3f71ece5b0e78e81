package org.tabula.indent;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tabula.diagnostics.DiagnosticsEngine;
import org.tabula.frontend.lexer.Lexer;
import org.tabula.frontend.lexer.Token;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the per-line view of a file's tokens.
 */
public class TokenIndexTest {

    private static TokenIndex index(String source) {
        List<Token> tokens = new Lexer(source, new DiagnosticsEngine()).scanTokens();
        return new TokenIndex(tokens, source);
    }

    /**
     * Each line maps to its leftmost token; blank lines map to nothing.
     */
    @Test
    @Tag("unit")
    void firstTokenOfLineSkipsBlankLines() {
        // Arrange
        TokenIndex index = index("a b\n\n  c\n");

        // Act & Assert
        assertThat(index.lineCount()).isEqualTo(4);
        assertThat(index.firstTokenOfLine(1).text()).isEqualTo("a");
        assertThat(index.firstTokenOfLine(2)).isNull();
        assertThat(index.firstTokenOfLine(3).text()).isEqualTo("c");
        assertThat(index.firstTokenOfLine(4)).isNull();
        assertThat(index.firstTokenOfLine(0)).isNull();
        assertThat(index.firstTokenOfLine(99)).isNull();
    }

    @Test
    @Tag("unit")
    void firstTokenOfLineForAnyTokenOnThatLine() {
        TokenIndex index = index("foo(bar)");
        Token bar = index.token(2);

        assertThat(index.firstTokenOfLine(bar).text()).isEqualTo("foo");
        assertThat(index.isFirstTokenOfLine(bar)).isFalse();
        assertThat(index.isFirstTokenOfLine(index.token(0))).isTrue();
    }

    /**
     * The indentation is the raw text before the token, tabs and spaces as written.
     */
    @Test
    @Tag("unit")
    void actualIndentIsTextBeforeToken() {
        // Arrange
        TokenIndex index = index("a\n\t  b");

        // Act
        Token b = index.token(1);

        // Assert
        assertThat(index.actualIndent(b)).isEqualTo("\t  ");
        assertThat(index.actualIndentWidth(b)).isEqualTo(3);
    }

    /**
     * For a token further along its line the width counts all text before it.
     */
    @Test
    @Tag("unit")
    void actualIndentWidthIsLengthOfLeadingText() {
        // Arrange
        TokenIndex index = index("x = 1");

        // Act
        Token one = index.token(2);

        // Assert
        assertThat(index.actualIndent(one)).isEqualTo("x = ");
        assertThat(index.actualIndentWidth(one)).isEqualTo(index.actualIndent(one).length());
    }

    /**
     * A multi-line comment is the first token of the line it ends on when code follows
     * it there, so that line is not checked on its own.
     */
    @Test
    @Tag("unit")
    void multiLineTokenOpensItsLastLine() {
        // Arrange
        TokenIndex index = index("/* one\n two */ x\n");

        // Act
        Token comment = index.token(0);

        // Assert
        assertThat(index.firstTokenOfLine(2)).isEqualTo(comment);
        assertThat(comment.line()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void endOfFileTokenIsNotIndexed() {
        TokenIndex index = index("a b");

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.tokens()).extracting(Token::text).containsExactly("a", "b");
    }

    @Test
    @Tag("unit")
    void tokensOutOfOrderAreRejected() {
        List<Token> tokens = new Lexer("a b", new DiagnosticsEngine()).scanTokens();

        assertThatThrownBy(() -> new TokenIndex(List.of(tokens.get(1)), "a b"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
