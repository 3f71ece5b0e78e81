package org.tabula.rules.features;

import org.tabula.frontend.parser.ast.AssignmentNode;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.BinaryNode;
import org.tabula.frontend.parser.ast.BlockNode;
import org.tabula.frontend.parser.ast.CallNode;
import org.tabula.frontend.parser.ast.ExpressionStatementNode;
import org.tabula.frontend.parser.ast.FunctionDeclarationNode;
import org.tabula.frontend.parser.ast.FunctionExpressionNode;
import org.tabula.frontend.parser.ast.ProgramNode;
import org.tabula.frontend.parser.ast.SwitchCaseNode;
import org.tabula.frontend.parser.ast.UnaryNode;
import org.tabula.frontend.parser.ast.VariableDeclarationNode;
import org.tabula.frontend.parser.ast.VariableDeclaratorNode;
import org.tabula.rules.ElementListOffset;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;
import org.tabula.rules.IndentOptions;

import java.util.Set;

/**
 * Indents the statements of a block. Function bodies use the configured body levels;
 * a brace that does not stand in a statement list lines up with the construct owning it.
 */
public class BlockIndentRule implements IIndentRule {

    private static final Set<String> IIFE_PREFIX_OPERATORS = Set.of("!", "~", "+", "-");

    @Override
    public void apply(AstNode node, IndentContext context) {
        BlockNode block = (BlockNode) node;
        AstNode parent = context.parentOf(block);
        IndentOptions options = context.options();

        int level;
        if (parent instanceof FunctionExpressionNode function && isOuterIife(function, context)) {
            level = options.outerIifeBody();
        } else if (parent instanceof FunctionExpressionNode) {
            level = options.functionExpressionBody();
        } else if (parent instanceof FunctionDeclarationNode) {
            level = options.functionDeclarationBody();
        } else {
            level = 1;
        }

        if (parent != null && !isStatementListParent(parent)) {
            context.offsets().matchIndent(parent.firstToken(), block.open());
        }
        context.elementListIndent(block.body(), block.open(), block.close(), ElementListOffset.levels(level));
    }

    private static boolean isStatementListParent(AstNode node) {
        return node instanceof ProgramNode || node instanceof BlockNode || node instanceof SwitchCaseNode;
    }

    /**
     * A function expression called right away in a top-level statement, possibly behind
     * a unary operator, an assignment, a logical operator or a declarator.
     */
    static boolean isOuterIife(FunctionExpressionNode function, IndentContext context) {
        AstNode parent = context.parentOf(function);
        if (!(parent instanceof CallNode call) || call.callee() != function) {
            return false;
        }

        AstNode statement = context.parentOf(call);
        while (isIifeWrapper(statement)) {
            statement = context.parentOf(statement);
        }
        return (statement instanceof ExpressionStatementNode || statement instanceof VariableDeclarationNode)
                && context.parentOf(statement) instanceof ProgramNode;
    }

    private static boolean isIifeWrapper(AstNode node) {
        if (node instanceof UnaryNode unary) {
            return unary.prefix() && IIFE_PREFIX_OPERATORS.contains(unary.operator().text());
        }
        if (node instanceof BinaryNode binary) {
            String operator = binary.operator().text();
            return "&&".equals(operator) || "||".equals(operator);
        }
        return node instanceof AssignmentNode || node instanceof VariableDeclaratorNode;
    }
}
