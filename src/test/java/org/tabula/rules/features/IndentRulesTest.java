package org.tabula.rules.features;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tabula.Checker;
import org.tabula.api.IndentCheckException;
import org.tabula.api.IndentViolation;
import org.tabula.rules.ElementListOffset;
import org.tabula.rules.IndentOptions;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Exercises each indentation rule on small snippets, checking which lines are reported.
 */
public class IndentRulesTest {

    private static List<Integer> reportedLines(String source, IndentOptions options) throws IndentCheckException {
        return new Checker(options).check(source, "rules.js").stream()
                .map(v -> v.source().lineNumber())
                .collect(Collectors.toList());
    }

    private static List<Integer> reportedLines(String source) throws IndentCheckException {
        return reportedLines(source, IndentOptions.defaults());
    }

    /**
     * Cases sit at the switch by default and their statements one level in.
     */
    @Test
    @Tag("unit")
    void testSwitchCases() throws IndentCheckException {
        // Arrange
        String flat = "switch (x) {\ncase 1:\n    a();\n    break;\ndefault:\n    b();\n}";
        String indented = "switch (x) {\n    case 1:\n        a();\n}";

        // Act & Assert
        assertThat(reportedLines(flat)).isEmpty();
        assertThat(reportedLines(indented, IndentOptions.builder().switchCase(1).build())).isEmpty();
        assertThat(reportedLines(indented)).containsExactly(2, 3);
    }

    @Test
    @Tag("unit")
    void testSwitchCaseWithSingleBlock() throws IndentCheckException {
        assertThat(reportedLines("switch (x) {\ncase 1: {\n    a();\n}\n}")).isEmpty();
    }

    /**
     * Comments after the last case keep whatever indentation they have.
     */
    @Test
    @Tag("unit")
    void testCommentAfterLastCaseIsIgnored() throws IndentCheckException {
        assertThat(reportedLines("switch (x) {\ncase 1:\n    a();\n      // anything\n}")).isEmpty();
    }

    /**
     * Continued declarators are indented per declaration keyword.
     */
    @Test
    @Tag("unit")
    void testVariableDeclarators() throws IndentCheckException {
        // Arrange
        IndentOptions wideVar = IndentOptions.builder().variableDeclarator(2, 1, 1).build();

        // Act & Assert
        assertThat(reportedLines("var a = 1,\n    b = 2;")).isEmpty();
        assertThat(reportedLines("let a = 1,\n  b = 2;")).containsExactly(2);
        assertThat(reportedLines("var a = 1,\n        b;", wideVar)).isEmpty();
        assertThat(reportedLines("let a = 1,\n        b;", wideVar)).containsExactly(2);
    }

    @Test
    @Tag("unit")
    void testObjectInDeclaration() throws IndentCheckException {
        assertThat(reportedLines("const o = {\n    k: 1\n};")).isEmpty();
        assertThat(reportedLines("foo({\n    a: 1,\n    b: 2\n});")).isEmpty();
    }

    /**
     * Chained accesses are one level in from the start of the chain, or left alone when off.
     */
    @Test
    @Tag("unit")
    void testMemberChains() throws IndentCheckException {
        // Arrange
        IndentOptions off = IndentOptions.builder().memberExpression(ElementListOffset.OFF).build();

        // Act & Assert
        assertThat(reportedLines("foo\n    .bar()\n    .baz();")).isEmpty();
        assertThat(reportedLines("foo\n  .bar();")).containsExactly(2);
        assertThat(reportedLines("foo\n  .bar();", off)).isEmpty();
    }

    @Test
    @Tag("unit")
    void testComputedMember() throws IndentCheckException {
        assertThat(reportedLines("a[\n    0\n];")).isEmpty();
        assertThat(reportedLines("a[\n0\n    ];")).containsExactly(2, 3);
    }

    /**
     * Nested conditionals on one line stay flat only when the option allows it.
     */
    @Test
    @Tag("unit")
    void testTernaries() throws IndentCheckException {
        // Arrange
        String chained = "var a =\n    foo ? bar :\n    baz ? qux :\n    boop;";
        IndentOptions flat = IndentOptions.builder().flatTernaryExpressions(true).build();

        // Act & Assert
        assertThat(reportedLines("var x = a\n    ? b\n    : c;")).isEmpty();
        assertThat(reportedLines(chained, flat)).isEmpty();
        assertThat(reportedLines(chained)).containsExactly(3, 4);
    }

    /**
     * Parameters can be aligned with the first parameter, indented, or left alone.
     */
    @Test
    @Tag("unit")
    void testFunctionParameters() throws IndentCheckException {
        // Arrange
        String aligned = "function f(a,\n           b) {\n    return a;\n}";
        IndentOptions first = IndentOptions.builder().functionDeclarationParameters(ElementListOffset.FIRST).build();
        IndentOptions off = IndentOptions.builder().functionDeclarationParameters(ElementListOffset.OFF).build();

        // Act & Assert
        assertThat(reportedLines(aligned, first)).isEmpty();
        assertThat(reportedLines(aligned)).containsExactly(2);
        assertThat(reportedLines("function f(a,\n  b) {}", off)).isEmpty();
    }

    @Test
    @Tag("unit")
    void testFunctionBodies() throws IndentCheckException {
        IndentOptions deepBody = IndentOptions.builder().functionDeclarationBody(2).build();

        assertThat(reportedLines("function f() {\n        return;\n}", deepBody)).isEmpty();
        assertThat(reportedLines("x = function () {\n    y();\n};")).isEmpty();
    }

    /**
     * The body of a top-level function called in place uses its own level.
     */
    @Test
    @Tag("unit")
    void testOuterIife() throws IndentCheckException {
        // Arrange
        String iife = "(function () {\nfoo();\n})();";
        IndentOptions flatIife = IndentOptions.builder().outerIifeBody(0).build();

        // Act & Assert
        assertThat(reportedLines(iife, flatIife)).isEmpty();
        assertThat(reportedLines(iife)).containsExactly(2);
    }

    @Test
    @Tag("unit")
    void testCallArgumentsAlignedWithFirst() throws IndentCheckException {
        IndentOptions first = IndentOptions.builder().callArguments(ElementListOffset.FIRST).build();

        assertThat(reportedLines("foo(a,\n    b);", first)).isEmpty();
        assertThat(reportedLines("foo(a,\n  b);", first)).containsExactly(2);
    }

    /**
     * Array elements follow the array option: aligned with the first, or left alone.
     */
    @Test
    @Tag("unit")
    void testArrayElements() throws IndentCheckException {
        // Arrange
        IndentOptions first = IndentOptions.builder().arrayExpression(ElementListOffset.FIRST).build();
        IndentOptions off = IndentOptions.builder().arrayExpression(ElementListOffset.OFF).build();
        String ragged = "var a = [\n  1,\n      2\n];";

        // Act & Assert
        assertThat(reportedLines("var a = [1,\n         2];", first)).isEmpty();
        assertThat(reportedLines(ragged, off)).isEmpty();
        assertThat(reportedLines(ragged)).containsExactly(2, 3);
    }

    /**
     * The contents of an ignored node kind keep their indentation; unknown kinds change nothing.
     */
    @Test
    @Tag("unit")
    void testIgnoredNodes() throws IndentCheckException {
        // Arrange
        String ragged = "var a = [\n  1,\n      2\n];";
        IndentOptions ignoreArrays = IndentOptions.builder().ignoredNodes(Set.of("Array")).build();
        IndentOptions ignoreNonsense = IndentOptions.builder().ignoredNodes(Set.of("Nonsense")).build();

        // Act & Assert
        assertThat(reportedLines(ragged, ignoreArrays)).isEmpty();
        assertThat(reportedLines(ragged, ignoreNonsense)).containsExactly(2, 3);
    }

    /**
     * Operands continued on a new line keep the author's indentation.
     */
    @Test
    @Tag("unit")
    void testBinaryContinuations() throws IndentCheckException {
        assertThat(reportedLines("x = a +\n  b +\n        c;")).isEmpty();
        assertThat(reportedLines("x = a\n + b;")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testForLoops() throws IndentCheckException {
        assertThat(reportedLines("for (var i = 0;\n    i < n;\n    i++) {\n    x();\n}")).isEmpty();
        assertThat(reportedLines("for (;;)\n    x();")).isEmpty();
        assertThat(reportedLines("for (;;)\nx();")).containsExactly(2);
    }

    /**
     * Bodies without braces are one level in after if, else, while and do.
     */
    @Test
    @Tag("unit")
    void testBlocklessBodies() throws IndentCheckException {
        assertThat(reportedLines("do\n    x();\nwhile (y);")).isEmpty();
        assertThat(reportedLines("if (a)\n    b();\nelse\n    c();")).isEmpty();
        assertThat(reportedLines("if (a)\n    b();\nelse\nc();")).containsExactly(4);
        assertThat(reportedLines("while (a)\n    b();")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testIfElseBlocks() throws IndentCheckException {
        assertThat(reportedLines("if (a) {\n    b();\n} else {\n    c();\n}")).isEmpty();
        assertThat(reportedLines("if (a) {\n} else if (b) {\n    c();\n}")).isEmpty();
    }

    /**
     * Tokens inside grouping parentheses are one level in from the opening parenthesis.
     */
    @Test
    @Tag("unit")
    void testGroupingParentheses() throws IndentCheckException {
        assertThat(reportedLines("x = (\n    a +\n    b\n);")).isEmpty();
        assertThat(reportedLines("x = (\n  a\n);")).containsExactly(2);
    }

    @Test
    @Tag("unit")
    void testViolationCarriesFix() throws IndentCheckException {
        List<IndentViolation> violations = new Checker().check("foo\n  .bar();", "rules.js");

        assertThat(violations.get(0).fix().replacement()).isEqualTo("    ");
    }
}
