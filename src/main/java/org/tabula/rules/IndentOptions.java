package org.tabula.rules;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.tabula.indent.IndentStyle;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The tunable indentation policy: the indentation unit plus the per-construct levels.
 * Built from the {@code tabula.indent} section of the configuration.
 *
 * @param style The indentation unit.
 * @param switchCase Levels of <code>case</code> clauses from the switch's <code>{</code>.
 * @param variableDeclarator Levels of continued declarations, per declaration keyword.
 * @param outerIifeBody Levels of the body of a top-level immediately invoked function.
 * @param functionDeclarationParameters Parameter list offset of function declarations.
 * @param functionDeclarationBody Body levels of function declarations.
 * @param functionExpressionParameters Parameter list offset of function expressions.
 * @param functionExpressionBody Body levels of function expressions.
 * @param callArguments Argument list offset of calls.
 * @param memberExpression Offset of chained property accesses; {@code OFF} or a number of levels.
 * @param arrayExpression Element offset of array literals.
 * @param objectExpression Property offset of object literals.
 * @param flatTernaryExpressions Whether nested conditionals on one line are left unindented.
 * @param ignoredNodes Node kinds whose contents are not checked, e.g. {@code "Array"}.
 */
public record IndentOptions(
        IndentStyle style,
        int switchCase,
        Map<String, Integer> variableDeclarator,
        int outerIifeBody,
        ElementListOffset functionDeclarationParameters,
        int functionDeclarationBody,
        ElementListOffset functionExpressionParameters,
        int functionExpressionBody,
        ElementListOffset callArguments,
        ElementListOffset memberExpression,
        ElementListOffset arrayExpression,
        ElementListOffset objectExpression,
        boolean flatTernaryExpressions,
        Set<String> ignoredNodes
) {

    private static final int DEFAULT_VARIABLE_INDENT = 1;

    public IndentOptions {
        variableDeclarator = Map.copyOf(variableDeclarator);
        ignoredNodes = Set.copyOf(ignoredNodes);
        if (memberExpression.isFirst()) {
            throw new IllegalArgumentException("Member expressions cannot be aligned with the first element.");
        }
    }

    /**
     * @return Four spaces and the default level of 1 everywhere, switch cases not indented.
     */
    public static IndentOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the options from a {@code tabula.indent} configuration section.
     *
     * @param indent The section, with all keys present (defaults come from {@code reference.conf}).
     * @return The options.
     * @throws ConfigException.BadValue if a value is out of range.
     */
    public static IndentOptions fromConfig(Config indent) {
        String styleName = indent.getString("style");
        IndentStyle style;
        switch (styleName) {
            case "tab" -> style = IndentStyle.tabs();
            case "space" -> {
                int size = indent.getInt("size");
                if (size < 1) {
                    throw new ConfigException.BadValue(indent.origin(), "size", "must be at least 1, was " + size);
                }
                style = IndentStyle.spaces(size);
            }
            default -> throw new ConfigException.BadValue(indent.origin(), "style",
                    "must be \"space\" or \"tab\", was \"" + styleName + "\"");
        }

        return builder()
                .style(style)
                .switchCase(level(indent, "switch-case"))
                .variableDeclarator(level(indent, "variable-declarator.var"),
                        level(indent, "variable-declarator.let"),
                        level(indent, "variable-declarator.const"))
                .outerIifeBody(level(indent, "outer-iife-body"))
                .functionDeclarationParameters(listOffset(indent, "function-declaration.parameters", true))
                .functionDeclarationBody(level(indent, "function-declaration.body"))
                .functionExpressionParameters(listOffset(indent, "function-expression.parameters", true))
                .functionExpressionBody(level(indent, "function-expression.body"))
                .callArguments(listOffset(indent, "call-expression.arguments", true))
                .memberExpression(listOffset(indent, "member-expression", false))
                .arrayExpression(listOffset(indent, "array-expression", true))
                .objectExpression(listOffset(indent, "object-expression", true))
                .flatTernaryExpressions(indent.getBoolean("flat-ternary-expressions"))
                .ignoredNodes(new HashSet<>(indent.getStringList("ignored-nodes")))
                .build();
    }

    /**
     * @param kind The declaration keyword: var, let or const.
     * @return The levels a continued declaration of that kind is indented.
     */
    public int variableDeclaratorLevel(String kind) {
        return variableDeclarator.getOrDefault(kind, DEFAULT_VARIABLE_INDENT);
    }

    private static int level(Config config, String path) {
        int value = config.getInt(path);
        if (value < 0) {
            throw new ConfigException.BadValue(config.origin(), path, "must not be negative, was " + value);
        }
        return value;
    }

    private static ElementListOffset listOffset(Config config, String path, boolean firstAllowed) {
        ConfigValue value = config.getValue(path);
        if (value.valueType() == ConfigValueType.NUMBER) {
            return ElementListOffset.levels(level(config, path));
        }
        if (value.valueType() == ConfigValueType.STRING) {
            String text = config.getString(path);
            if ("off".equals(text)) {
                return ElementListOffset.OFF;
            }
            if (firstAllowed && "first".equals(text)) {
                return ElementListOffset.FIRST;
            }
        }
        String allowed = firstAllowed ? "an integer, \"first\" or \"off\"" : "an integer or \"off\"";
        throw new ConfigException.BadValue(value.origin(), path, "must be " + allowed + ", was " + value.render());
    }

    /**
     * Assembles options field by field, starting from the defaults.
     */
    public static final class Builder {
        private IndentStyle style = IndentStyle.spaces(4);
        private int switchCase = 0;
        private Map<String, Integer> variableDeclarator = Map.of(
                "var", DEFAULT_VARIABLE_INDENT, "let", DEFAULT_VARIABLE_INDENT, "const", DEFAULT_VARIABLE_INDENT);
        private int outerIifeBody = 1;
        private ElementListOffset functionDeclarationParameters = ElementListOffset.levels(1);
        private int functionDeclarationBody = 1;
        private ElementListOffset functionExpressionParameters = ElementListOffset.levels(1);
        private int functionExpressionBody = 1;
        private ElementListOffset callArguments = ElementListOffset.levels(1);
        private ElementListOffset memberExpression = ElementListOffset.levels(1);
        private ElementListOffset arrayExpression = ElementListOffset.levels(1);
        private ElementListOffset objectExpression = ElementListOffset.levels(1);
        private boolean flatTernaryExpressions = false;
        private Set<String> ignoredNodes = Set.of();

        private Builder() {}

        public Builder style(IndentStyle style) {
            this.style = style;
            return this;
        }

        public Builder switchCase(int levels) {
            this.switchCase = levels;
            return this;
        }

        public Builder variableDeclarator(int levels) {
            return variableDeclarator(levels, levels, levels);
        }

        public Builder variableDeclarator(int var, int let, int constant) {
            this.variableDeclarator = Map.of("var", var, "let", let, "const", constant);
            return this;
        }

        public Builder outerIifeBody(int levels) {
            this.outerIifeBody = levels;
            return this;
        }

        public Builder functionDeclarationParameters(ElementListOffset offset) {
            this.functionDeclarationParameters = offset;
            return this;
        }

        public Builder functionDeclarationBody(int levels) {
            this.functionDeclarationBody = levels;
            return this;
        }

        public Builder functionExpressionParameters(ElementListOffset offset) {
            this.functionExpressionParameters = offset;
            return this;
        }

        public Builder functionExpressionBody(int levels) {
            this.functionExpressionBody = levels;
            return this;
        }

        public Builder callArguments(ElementListOffset offset) {
            this.callArguments = offset;
            return this;
        }

        public Builder memberExpression(ElementListOffset offset) {
            this.memberExpression = offset;
            return this;
        }

        public Builder arrayExpression(ElementListOffset offset) {
            this.arrayExpression = offset;
            return this;
        }

        public Builder objectExpression(ElementListOffset offset) {
            this.objectExpression = offset;
            return this;
        }

        public Builder flatTernaryExpressions(boolean flat) {
            this.flatTernaryExpressions = flat;
            return this;
        }

        public Builder ignoredNodes(Set<String> kinds) {
            this.ignoredNodes = kinds;
            return this;
        }

        public IndentOptions build() {
            return new IndentOptions(style, switchCase, variableDeclarator, outerIifeBody,
                    functionDeclarationParameters, functionDeclarationBody,
                    functionExpressionParameters, functionExpressionBody,
                    callArguments, memberExpression, arrayExpression, objectExpression,
                    flatTernaryExpressions, ignoredNodes);
        }
    }
}
