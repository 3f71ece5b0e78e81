package org.tabula.indent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabula.frontend.lexer.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Answers the desired indentation of tokens once all offsets have been declared.
 * Obtained from {@link OffsetStorage#freeze()}.
 * <p>
 * Indentation is computed in characters so that alignment with an arbitrary column is
 * exact; levels are derived from it. Results are memoized per token.
 */
public final class IndentResolver {

    private static final Logger LOG = LoggerFactory.getLogger(IndentResolver.class);

    private static final byte UNRESOLVED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte RESOLVED = 2;

    private final TokenIndex tokenIndex;
    private final IndentStyle style;
    private final IntervalStore<OffsetDescriptor> descriptors;
    private final Token[] alignmentLocks;
    private final boolean[] ignored;
    private final byte[] states;
    private final int[] widths;
    private int resolvedCount;

    IndentResolver(TokenIndex tokenIndex, IndentStyle style, IntervalStore<OffsetDescriptor> descriptors,
                   Token[] alignmentLocks, boolean[] ignored) {
        this.tokenIndex = tokenIndex;
        this.style = style;
        this.descriptors = descriptors;
        this.alignmentLocks = alignmentLocks;
        this.ignored = ignored;
        this.states = new byte[tokenIndex.size()];
        this.widths = new int[tokenIndex.size()];
    }

    /**
     * @param token A token of this file.
     * @return The desired number of indentation characters before the token's line.
     * @throws CyclicOffsetException if the token's anchors lead back to itself.
     */
    public int desiredWidth(Token token) {
        if (token == null || token.id() < 0 || token.id() >= states.length) {
            throw new IllegalArgumentException("Token does not belong to this file: " + token);
        }
        if (states[token.id()] == RESOLVED) {
            return widths[token.id()];
        }

        Deque<Token> pending = new ArrayDeque<>();
        pending.push(token);
        while (!pending.isEmpty()) {
            Token current = pending.peek();
            int id = current.id();
            if (states[id] == RESOLVED) {
                pending.pop();
                continue;
            }
            states[id] = IN_PROGRESS;

            Token dependency = dependencyOf(current);
            if (dependency != null && states[dependency.id()] != RESOLVED) {
                if (states[dependency.id()] == IN_PROGRESS) {
                    for (Token unfinished : pending) {
                        states[unfinished.id()] = UNRESOLVED;
                    }
                    throw new CyclicOffsetException(current, dependency);
                }
                pending.push(dependency);
                continue;
            }

            widths[id] = computeWidth(current, dependency);
            states[id] = RESOLVED;
            resolvedCount++;
            pending.pop();
        }
        return widths[token.id()];
    }

    /**
     * @param token A token of this file.
     * @return The desired indentation in levels, rounded down for alignments that are
     *         not a whole number of levels.
     */
    public int desiredLevel(Token token) {
        return desiredWidth(token) / style.unitSize();
    }

    public boolean isIgnored(Token token) {
        return ignored[token.id()];
    }

    /**
     * @return The token whose alignment the given token is locked to, or null.
     */
    public Token alignmentLockOf(Token token) {
        return alignmentLocks[token.id()];
    }

    public IndentStyle style() {
        return style;
    }

    public TokenIndex tokenIndex() {
        return tokenIndex;
    }

    /**
     * @return How many tokens have been resolved so far.
     */
    public int resolvedCount() {
        return resolvedCount;
    }

    /**
     * The token whose width must be known before the given token's width can be computed.
     */
    private Token dependencyOf(Token token) {
        if (ignored[token.id()]) {
            return null;
        }
        Token base = alignmentLocks[token.id()];
        if (base != null) {
            return tokenIndex.firstTokenOfLine(base);
        }
        return descriptors.findFloor(token.start()).anchor();
    }

    private int computeWidth(Token token, Token dependency) {
        if (ignored[token.id()]) {
            return tokenIndex.actualIndentWidth(token);
        }
        Token base = alignmentLocks[token.id()];
        if (base != null) {
            // A multi-line token ending on the base's line is not re-indented there.
            if (dependency.line() != base.line()) {
                return base.column();
            }
            return widths[dependency.id()] + (base.column() - dependency.column());
        }
        OffsetDescriptor descriptor = descriptors.findFloor(token.start());
        Token anchor = descriptor.anchor();
        boolean collapsed = anchor != null && anchor.line() == token.line() && !descriptor.forced();
        int contribution = collapsed ? 0 : descriptor.offsetLevel();
        int width = contribution * style.unitSize() + (anchor == null ? 0 : widths[anchor.id()]);
        if (LOG.isTraceEnabled()) {
            LOG.trace("{} -> {} ({} levels from {})", token, width, contribution, anchor);
        }
        return width;
    }
}
