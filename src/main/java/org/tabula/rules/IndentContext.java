package org.tabula.rules;

import org.tabula.frontend.TreeWalker;
import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.TokenStream;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.BlockNode;
import org.tabula.frontend.parser.ast.EmptyStatementNode;
import org.tabula.indent.OffsetStorage;
import org.tabula.indent.TokenIndex;

import java.util.BitSet;
import java.util.List;

/**
 * The state shared by all indentation rules while one file is walked: the tokens, the
 * offset storage being filled, the options, and the parent links of the tree.
 * <p>
 * Also hosts the offset patterns several rules have in common.
 */
public final class IndentContext {

    private final TokenStream tokens;
    private final TokenIndex tokenIndex;
    private final OffsetStorage offsets;
    private final IndentOptions options;
    private final TreeWalker walker;
    private final BitSet parameterParens = new BitSet();

    public IndentContext(TokenStream tokens, TokenIndex tokenIndex, OffsetStorage offsets,
                         IndentOptions options, TreeWalker walker) {
        this.tokens = tokens;
        this.tokenIndex = tokenIndex;
        this.offsets = offsets;
        this.options = options;
        this.walker = walker;
    }

    public TokenStream tokens() {
        return tokens;
    }

    public TokenIndex tokenIndex() {
        return tokenIndex;
    }

    public OffsetStorage offsets() {
        return offsets;
    }

    public IndentOptions options() {
        return options;
    }

    /**
     * @param node A node already entered by the walk.
     * @return Its parent, or null for the root.
     */
    public AstNode parentOf(AstNode node) {
        return walker.parentOf(node);
    }

    /**
     * Marks parentheses that delimit parameters or arguments, so that the parentheses
     * pass leaves their contents alone.
     */
    public void markParameterParens(Token opening, Token closing) {
        parameterParens.set(opening.id());
        parameterParens.set(closing.id());
    }

    public boolean isParameterParen(Token token) {
        return parameterParens.get(token.id());
    }

    /**
     * Indents the elements of a delimited list (block statements, array elements, object
     * properties, parameters, arguments) from the opening delimiter and aligns the closing
     * delimiter with it.
     *
     * @param elements The elements, in source order.
     * @param startToken The opening delimiter.
     * @param endToken The closing delimiter.
     * @param offset How far the elements are indented.
     */
    public void elementListIndent(List<? extends AstNode> elements, Token startToken, Token endToken,
                                  ElementListOffset offset) {
        // Everything inside, comments included, is offset; the elements themselves may be refined below.
        offsets.declareOffsets(startToken.end(), endToken.start(), startToken, offset.level());
        offsets.matchIndent(startToken, endToken);

        for (int index = 0; index < elements.size(); index++) {
            AstNode element = elements.get(index);
            if (offset.isOff()) {
                offsets.ignore(firstTokenOfElement(element, startToken));
            }
            if (index == 0) {
                continue;
            }
            if (offset.isFirst() && tokenIndex.isFirstTokenOfLine(firstTokenOfElement(element, startToken))) {
                offsets.lockAlignment(firstTokenOfElement(elements.get(0), startToken),
                        firstTokenOfElement(element, startToken));
            } else {
                AstNode previous = elements.get(index - 1);
                if (previous.lastToken().line() > startToken.endLine()) {
                    offsets.declareOffsets(element.start(), element.end(),
                            firstTokenOfElement(previous, startToken), 0);
                }
            }
        }
    }

    /**
     * Indents the body of a statement written without braces by one level from the
     * token before it.
     *
     * @param body The body statement; blocks are left to the block rule.
     */
    public void blocklessBodyIndent(AstNode body) {
        if (body instanceof BlockNode) {
            return;
        }
        Token lastParentToken = tokens.tokenBefore(body, Punctuators::isNotOpeningParen);
        Token firstBodyToken = body.firstToken();
        Token lastBodyToken = body.lastToken();

        while (Punctuators.isOpeningParen(tokens.tokenBefore(firstBodyToken))
                && Punctuators.isClosingParen(tokens.tokenAfter(lastBodyToken))) {
            firstBodyToken = tokens.tokenBefore(firstBodyToken);
            lastBodyToken = tokens.tokenAfter(lastBodyToken);
        }

        offsets.declareOffsets(firstBodyToken.start(), lastBodyToken.end(), lastParentToken, 1);

        // A leading-semicolon style body keeps its semicolon at the statement's level.
        Token lastToken = body.lastToken();
        if (!(body instanceof EmptyStatementNode) && Punctuators.isSemicolon(lastToken)) {
            offsets.matchIndent(lastParentToken, lastToken);
        }
    }

    /**
     * @return The first token of a list element, including parentheses wrapped around it.
     */
    private Token firstTokenOfElement(AstNode element, Token startToken) {
        Token token = tokens.tokenBefore(element);
        while (Punctuators.isOpeningParen(token) && !token.equals(startToken)) {
            token = tokens.tokenBefore(token);
        }
        return token == null ? tokens.codeTokens().get(0) : tokens.tokenAfter(token);
    }
}
