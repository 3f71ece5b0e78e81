package org.tabula.frontend.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tabula.diagnostics.DiagnosticsEngine;
import org.tabula.frontend.lexer.Lexer;
import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.lexer.TokenType;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.CallNode;
import org.tabula.frontend.parser.ast.ExpressionStatementNode;
import org.tabula.frontend.parser.ast.ProgramNode;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the positional token queries used by the indentation rules.
 */
public class TokenStreamTest {

    private static final String SOURCE = "foo(/* c */ a, b) // end\nbar";

    private TokenStream stream;
    private CallNode call;

    @BeforeEach
    void setUp() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(SOURCE, diagnostics).scanTokens();
        List<Token> code = tokens.stream().filter(t -> !t.isComment()).collect(Collectors.toList());
        ProgramNode program = new Parser(code, diagnostics).parse();
        stream = new TokenStream(tokens);
        call = (CallNode) ((ExpressionStatementNode) program.body().get(0)).expression();
    }

    private Token code(String text) {
        return stream.codeTokens().stream().filter(t -> t.text().equals(text)).findFirst().orElseThrow();
    }

    @Test
    @Tag("unit")
    void splitsCodeAndComments() {
        assertThat(stream.codeTokens()).extracting(Token::text).containsExactly("foo", "(", "a", ",", "b", ")", "bar");
        assertThat(stream.comments()).extracting(Token::text).containsExactly("/* c */", "// end");
        assertThat(stream.allTokens()).hasSize(9);
    }

    /**
     * Neighbour lookups skip comments unless asked not to.
     */
    @Test
    @Tag("unit")
    void neighboursSkipComments() {
        // Arrange
        Token a = code("a");

        // Act & Assert
        assertThat(stream.tokenBefore(a).text()).isEqualTo("(");
        assertThat(stream.tokenOrCommentBefore(a).type()).isEqualTo(TokenType.BLOCK_COMMENT);
        assertThat(stream.tokenAfter(code(")")).text()).isEqualTo("bar");
        assertThat(stream.tokenOrCommentAfter(code(")")).type()).isEqualTo(TokenType.LINE_COMMENT);
        assertThat(stream.tokenBefore(code("foo"))).isNull();
        assertThat(stream.tokenAfter(code("bar"))).isNull();
    }

    @Test
    @Tag("unit")
    void filteredAndSkippingLookups() {
        assertThat(stream.tokenBefore(code("b"), t -> t.type() == TokenType.LEFT_PAREN).text()).isEqualTo("(");
        assertThat(stream.tokenBefore(code("b"), 1).text()).isEqualTo("a");
        assertThat(stream.tokenAfter(code("foo"), t -> t.type() == TokenType.COMMA).text()).isEqualTo(",");
    }

    /**
     * Node based lookups use the node's first and last tokens.
     */
    @Test
    @Tag("unit")
    void nodeQueries() {
        // Arrange
        AstNode first = call.arguments().get(0);
        AstNode second = call.arguments().get(1);

        // Act & Assert
        assertThat(stream.firstToken(call, 1).text()).isEqualTo("(");
        assertThat(stream.lastToken(call, 1).text()).isEqualTo("b");
        assertThat(stream.tokenBefore(first).text()).isEqualTo("(");
        assertThat(stream.tokenAfter(second).text()).isEqualTo(")");
        assertThat(stream.firstTokenBetween(first, second, t -> t.type() == TokenType.COMMA)).isNotNull();
        assertThat(stream.tokensOf(call, false)).hasSize(6);
        assertThat(stream.tokensOf(call, true)).hasSize(7);
    }

    @Test
    @Tag("unit")
    void rangesBetweenTokens() {
        Token open = code("(");
        Token close = code(")");

        assertThat(stream.tokensBetween(open, close)).extracting(Token::text).containsExactly("a", ",", "b");
        assertThat(stream.commentsBetween(open, close)).extracting(Token::text).containsExactly("/* c */");
        assertThat(stream.tokensBetween(close, open)).isEmpty();
    }
}
