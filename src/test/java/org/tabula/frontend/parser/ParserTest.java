package org.tabula.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tabula.diagnostics.DiagnosticsEngine;
import org.tabula.frontend.lexer.Lexer;
import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.ast.*;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser}: the shape of the trees it builds and the
 * token ranges of their nodes.
 */
public class ParserTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private ProgramNode parse(String source) {
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens().stream()
                .filter(t -> !t.isComment())
                .collect(Collectors.toList());
        return new Parser(tokens, diagnostics).parse();
    }

    /**
     * Verifies that multiplication binds tighter than addition and that the binary
     * node spans its operands.
     */
    @Test
    @Tag("unit")
    void testOperatorPrecedence() {
        // Arrange
        String source = "a + b * c;";

        // Act
        ProgramNode program = parse(source);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        ExpressionStatementNode statement = (ExpressionStatementNode) program.body().get(0);
        BinaryNode sum = (BinaryNode) statement.expression();
        assertThat(sum.operator().text()).isEqualTo("+");
        assertThat(sum.right()).isInstanceOf(BinaryNode.class);
        assertThat(sum.firstToken().text()).isEqualTo("a");
        assertThat(sum.lastToken().text()).isEqualTo("c");
        assertThat(statement.lastToken().text()).isEqualTo(";");
    }

    /**
     * Verifies that a node whose leftmost operand is parenthesized starts at the parenthesis.
     */
    @Test
    @Tag("unit")
    void testParenthesizedOperandStartsNode() {
        // Act
        ProgramNode program = parse("(a).b(c)");

        // Assert
        ExpressionStatementNode statement = (ExpressionStatementNode) program.body().get(0);
        CallNode call = (CallNode) statement.expression();
        assertThat(call.firstToken().text()).isEqualTo("(");
        assertThat(call.lastToken().text()).isEqualTo(")");
        assertThat(call.callee()).isInstanceOf(MemberNode.class);
        assertThat(call.arguments()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testIfElseChain() {
        ProgramNode program = parse("if (a) b(); else if (c) { d(); } else e();");

        IfNode outer = (IfNode) program.body().get(0);
        assertThat(outer.alternate()).isInstanceOf(IfNode.class);
        IfNode inner = (IfNode) outer.alternate();
        assertThat(inner.consequent()).isInstanceOf(BlockNode.class);
        assertThat(outer.lastToken().text()).isEqualTo(";");
    }

    /**
     * Verifies declarations with several declarators and the position of the final semicolon.
     */
    @Test
    @Tag("unit")
    void testVariableDeclaration() {
        // Act
        ProgramNode program = parse("let a = 1,\n    b = [2, 3];");

        // Assert
        VariableDeclarationNode declaration = (VariableDeclarationNode) program.body().get(0);
        assertThat(declaration.kind().text()).isEqualTo("let");
        assertThat(declaration.declarations()).hasSize(2);
        assertThat(declaration.declarations().get(1).init()).isInstanceOf(ArrayNode.class);
        assertThat(declaration.lastToken().text()).isEqualTo(";");
    }

    @Test
    @Tag("unit")
    void testFunctionsAndObjects() {
        ProgramNode program = parse("function f(a, b) { return { if: a, 'k': function () {} }; }");

        FunctionDeclarationNode function = (FunctionDeclarationNode) program.body().get(0);
        assertThat(function.params()).hasSize(2);
        ReturnNode returned = (ReturnNode) function.body().body().get(0);
        ObjectNode object = (ObjectNode) returned.argument();
        assertThat(object.properties()).hasSize(2);
        assertThat(object.properties().get(1).value()).isInstanceOf(FunctionExpressionNode.class);
    }

    /**
     * Verifies that switch cases collect their statements up to the next case.
     */
    @Test
    @Tag("unit")
    void testSwitch() {
        // Act
        ProgramNode program = parse("switch (x) {\ncase 1:\n  a();\n  break;\ndefault:\n  b();\n}");

        // Assert
        SwitchNode node = (SwitchNode) program.body().get(0);
        assertThat(node.cases()).hasSize(2);
        assertThat(node.cases().get(0).consequent()).hasSize(2);
        assertThat(node.cases().get(1).test()).isNull();
        assertThat(node.close().text()).isEqualTo("}");
    }

    @Test
    @Tag("unit")
    void testLoops() {
        ProgramNode program = parse("for (var i = 0; i < n; i++) x();\nwhile (a) b();\ndo { c(); } while (d);");

        assertThat(program.body()).hasExactlyElementsOfTypes(ForNode.class, WhileNode.class, DoWhileNode.class);
        ForNode loop = (ForNode) program.body().get(0);
        assertThat(loop.init()).isInstanceOf(VariableDeclarationNode.class);
        assertThat(loop.update()).isInstanceOf(UnaryNode.class);
    }

    /**
     * Verifies that a return argument must start on the keyword's line.
     */
    @Test
    @Tag("unit")
    void testReturnArgumentOnSameLineOnly() {
        // Act
        ProgramNode program = parse("function f() {\n  return\n  x;\n}");

        // Assert
        FunctionDeclarationNode function = (FunctionDeclarationNode) program.body().get(0);
        assertThat(function.body().body()).hasSize(2);
        assertThat(((ReturnNode) function.body().body().get(0)).argument()).isNull();
    }

    @Test
    @Tag("unit")
    void testConditionalAndAssignment() {
        ProgramNode program = parse("x = a ? b : c ? d : e;");

        AssignmentNode assignment = (AssignmentNode) ((ExpressionStatementNode) program.body().get(0)).expression();
        ConditionalNode conditional = (ConditionalNode) assignment.right();
        assertThat(conditional.alternate()).isInstanceOf(ConditionalNode.class);
    }

    /**
     * Verifies that a syntax error is reported and parsing resumes at the next statement.
     */
    @Test
    @Tag("unit")
    void testErrorRecovery() {
        // Act
        ProgramNode program = parse("a(;\nb();");

        // Assert
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics().get(0).lineNumber()).isEqualTo(1);
        assertThat(program.body()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testEmptyProgram() {
        ProgramNode program = parse("// only a comment\n");

        assertThat(program.body()).isEmpty();
        assertThat(program.firstToken()).isNull();
    }
}
