package org.tabula.frontend.parser;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.lexer.TokenType;
import org.tabula.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * A read-only view of the tokens and comments of one file, answering the positional
 * questions the indentation rules ask about nodes: which token comes before or after,
 * which tokens lie between two nodes, which tokens make up a node.
 * <p>
 * Unless a method says otherwise, only code tokens are returned; comments are skipped.
 */
public final class TokenStream {

    private final List<Token> all;
    private final List<Token> code;
    private final List<Token> comments;

    /**
     * Creates a view over the lexer output. A trailing end-of-file token is dropped.
     * @param tokens The tokens and comments in source order.
     */
    public TokenStream(List<Token> tokens) {
        List<Token> allTokens = new ArrayList<>(tokens.size());
        List<Token> codeTokens = new ArrayList<>(tokens.size());
        List<Token> commentTokens = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.END_OF_FILE) {
                continue;
            }
            allTokens.add(token);
            if (token.isComment()) {
                commentTokens.add(token);
            } else {
                codeTokens.add(token);
            }
        }
        this.all = Collections.unmodifiableList(allTokens);
        this.code = Collections.unmodifiableList(codeTokens);
        this.comments = Collections.unmodifiableList(commentTokens);
    }

    /** @return All tokens and comments in source order. */
    public List<Token> allTokens() {
        return all;
    }

    /** @return The code tokens in source order. */
    public List<Token> codeTokens() {
        return code;
    }

    /** @return The comments in source order. */
    public List<Token> comments() {
        return comments;
    }

    public Token firstToken(AstNode node) {
        return node.firstToken();
    }

    public Token lastToken(AstNode node) {
        return node.lastToken();
    }

    /**
     * @param node A node.
     * @param skip The number of code tokens to skip from the start of the node.
     * @return The code token {@code skip} places after the node's first token.
     */
    public Token firstToken(AstNode node, int skip) {
        return code.get(indexOf(node.firstToken()) + skip);
    }

    /**
     * @param node A node.
     * @param skip The number of code tokens to skip from the end of the node.
     * @return The code token {@code skip} places before the node's last token.
     */
    public Token lastToken(AstNode node, int skip) {
        return code.get(indexOf(node.lastToken()) - skip);
    }

    /**
     * @param token A token or comment.
     * @return The nearest code token ending at or before the given token starts, or null.
     */
    public Token tokenBefore(Token token) {
        int index = lowerBound(code, token.start()) - 1;
        return index >= 0 ? code.get(index) : null;
    }

    /**
     * @param token A token or comment.
     * @param filter The condition the returned token satisfies.
     * @return The nearest preceding code token accepted by the filter, or null.
     */
    public Token tokenBefore(Token token, Predicate<Token> filter) {
        for (int i = lowerBound(code, token.start()) - 1; i >= 0; i--) {
            if (filter.test(code.get(i))) {
                return code.get(i);
            }
        }
        return null;
    }

    /**
     * @param token A token or comment.
     * @param skip The number of preceding code tokens to skip.
     * @return The code token {@code skip + 1} places before the given token, or null.
     */
    public Token tokenBefore(Token token, int skip) {
        int index = lowerBound(code, token.start()) - 1 - skip;
        return index >= 0 ? code.get(index) : null;
    }

    /**
     * @return The nearest token or comment before the given one, or null.
     */
    public Token tokenOrCommentBefore(Token token) {
        int index = lowerBound(all, token.start()) - 1;
        return index >= 0 ? all.get(index) : null;
    }

    /**
     * @return The nearest token or comment after the given one, or null.
     */
    public Token tokenOrCommentAfter(Token token) {
        int index = lowerBound(all, token.end());
        return index < all.size() ? all.get(index) : null;
    }

    public Token tokenBefore(AstNode node) {
        return tokenBefore(node.firstToken());
    }

    public Token tokenBefore(AstNode node, Predicate<Token> filter) {
        return tokenBefore(node.firstToken(), filter);
    }

    /**
     * @param token A token or comment.
     * @return The nearest code token starting at or after the given token ends, or null.
     */
    public Token tokenAfter(Token token) {
        int index = lowerBound(code, token.end());
        return index < code.size() ? code.get(index) : null;
    }

    /**
     * @param token A token or comment.
     * @param filter The condition the returned token satisfies.
     * @return The nearest following code token accepted by the filter, or null.
     */
    public Token tokenAfter(Token token, Predicate<Token> filter) {
        for (int i = lowerBound(code, token.end()); i < code.size(); i++) {
            if (filter.test(code.get(i))) {
                return code.get(i);
            }
        }
        return null;
    }

    public Token tokenAfter(AstNode node) {
        return tokenAfter(node.lastToken());
    }

    public Token tokenAfter(AstNode node, Predicate<Token> filter) {
        return tokenAfter(node.lastToken(), filter);
    }

    /**
     * @param left The left boundary, exclusive.
     * @param right The right boundary, exclusive.
     * @return The code tokens strictly between the two tokens.
     */
    public List<Token> tokensBetween(Token left, Token right) {
        return slice(code, left.end(), right.start());
    }

    /**
     * @param left The left boundary, exclusive.
     * @param right The right boundary, exclusive.
     * @param filter The condition the returned token satisfies.
     * @return The first code token strictly between the two tokens accepted by the filter, or null.
     */
    public Token firstTokenBetween(Token left, Token right, Predicate<Token> filter) {
        for (Token token : tokensBetween(left, right)) {
            if (filter.test(token)) {
                return token;
            }
        }
        return null;
    }

    public Token firstTokenBetween(AstNode left, AstNode right, Predicate<Token> filter) {
        return firstTokenBetween(left.lastToken(), right.firstToken(), filter);
    }

    /**
     * @param left The left boundary, exclusive.
     * @param right The right boundary, exclusive.
     * @return The comments strictly between the two tokens.
     */
    public List<Token> commentsBetween(Token left, Token right) {
        return slice(comments, left.end(), right.start());
    }

    /**
     * @param node A node.
     * @param includeComments Whether comments inside the node are returned as well.
     * @return The tokens lying within the node's range, in source order.
     */
    public List<Token> tokensOf(AstNode node, boolean includeComments) {
        if (node.firstToken() == null) {
            return Collections.emptyList();
        }
        return slice(includeComments ? all : code, node.start(), node.end());
    }

    private int indexOf(Token token) {
        int index = lowerBound(code, token.start());
        if (index >= code.size() || code.get(index).start() != token.start()) {
            throw new IllegalArgumentException("Not a code token of this file: " + token);
        }
        return index;
    }

    private static List<Token> slice(List<Token> tokens, int from, int to) {
        if (from >= to) {
            return Collections.emptyList();
        }
        return tokens.subList(lowerBound(tokens, from), lowerBound(tokens, to));
    }

    /**
     * @return The index of the first token starting at or after the offset.
     */
    private static int lowerBound(List<Token> tokens, int offset) {
        int low = 0;
        int high = tokens.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (tokens.get(mid).start() < offset) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
