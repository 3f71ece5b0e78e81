package org.tabula.indent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabula.frontend.lexer.Token;

/**
 * Collects the indentation offsets of one file while its tree is walked.
 * <p>
 * Offsets are declared over character ranges: every token starting inside a range is
 * indented a number of levels beyond the range's anchor token. Later declarations
 * override earlier ones for the positions they cover, except that a range never
 * re-anchors its own anchor. Tokens can also be locked to the column of another token
 * or ignored altogether.
 * <p>
 * Once the walk is complete, {@link #freeze()} ends the declaration phase and hands out
 * the {@link IndentResolver} that answers indentation queries. One instance serves one
 * file and is discarded afterwards.
 */
public final class OffsetStorage {

    private static final Logger LOG = LoggerFactory.getLogger(OffsetStorage.class);

    private final TokenIndex tokenIndex;
    private final IndentStyle style;
    private final IntervalStore<OffsetDescriptor> descriptors = new IntervalStore<>();
    private final Token[] alignmentLocks;
    private final boolean[] ignored;
    private IndentResolver resolver;
    private int declarationCount;

    /**
     * @param tokenIndex The line index of the file.
     * @param style The indentation unit.
     */
    public OffsetStorage(TokenIndex tokenIndex, IndentStyle style) {
        this.tokenIndex = tokenIndex;
        this.style = style;
        this.alignmentLocks = new Token[tokenIndex.size()];
        this.ignored = new boolean[tokenIndex.size()];
        descriptors.insertBreakpoint(0, OffsetDescriptor.TOP_LEVEL);
    }

    /**
     * Offsets every token starting in {@code [start, end)} by {@code offsetLevel} from the anchor.
     *
     * @param start The first position of the range.
     * @param end The position just past the range.
     * @param anchor The token the range is indented from, or null for the left margin.
     * @param offsetLevel The number of indentation levels.
     */
    public void declareOffsets(int start, int end, Token anchor, int offsetLevel) {
        declareOffsets(start, end, anchor, offsetLevel, false);
    }

    /**
     * Offsets every token starting in {@code [start, end)} by {@code offsetLevel} from the anchor.
     * Zero-width and inverted ranges leave the storage unchanged.
     *
     * @param start The first position of the range.
     * @param end The position just past the range.
     * @param anchor The token the range is indented from, or null for the left margin.
     * @param offsetLevel The number of indentation levels.
     * @param forced Whether tokens on the anchor's line are offset as well.
     */
    public void declareOffsets(int start, int end, Token anchor, int offsetLevel, boolean forced) {
        requireDeclarationPhase();
        if (start < 0) {
            throw new IllegalArgumentException("Range must not start before 0: " + start);
        }
        if (start >= end) {
            return;
        }
        OffsetDescriptor descriptor = new OffsetDescriptor(offsetLevel, anchor, forced);
        OffsetDescriptor tail = descriptors.findFloor(end);

        boolean anchorInRange = anchor != null && anchor.start() >= start && anchor.end() <= end;
        OffsetDescriptor anchorDescriptor = anchorInRange ? descriptors.findFloor(anchor.start()) : null;

        descriptors.deleteRange(start, end);
        descriptors.insertBreakpoint(start, descriptor);

        // The anchor keeps whatever governed it before, the rest of the range follows the anchor.
        if (anchorInRange) {
            descriptors.insertBreakpoint(anchor.start(), anchorDescriptor);
            descriptors.insertBreakpoint(anchor.end(), descriptor);
        }

        descriptors.insertBreakpoint(end, tail);
        declarationCount++;

        if (LOG.isTraceEnabled()) {
            LOG.trace("offset [{}, {}) by {} from {}{}", start, end, offsetLevel, anchor, forced ? " (forced)" : "");
        }
    }

    /**
     * Offsets a single token from an anchor.
     * @param token The token to offset.
     * @param anchor The token it is indented from, or null for the left margin.
     * @param offsetLevel The number of indentation levels.
     */
    public void declareOffset(Token token, Token anchor, int offsetLevel) {
        requireToken(token);
        declareOffsets(token.start(), token.end(), anchor, offsetLevel, false);
    }

    /**
     * Gives {@code target} the same indentation as {@code base}.
     */
    public void matchIndent(Token base, Token target) {
        requireToken(base);
        requireToken(target);
        declareOffsets(target.start(), target.end(), base, 0, false);
    }

    /**
     * Aligns {@code target} with the column of {@code base}, whatever the offsets say.
     * A later lock of the same target replaces an earlier one.
     */
    public void lockAlignment(Token base, Token target) {
        requireDeclarationPhase();
        requireToken(base);
        requireToken(target);
        alignmentLocks[target.id()] = base;
    }

    /**
     * Accepts the actual indentation of a token as correct. Only a token that starts its
     * line can be ignored; for any other token this does nothing.
     */
    public void ignore(Token token) {
        requireDeclarationPhase();
        requireToken(token);
        if (tokenIndex.isFirstTokenOfLine(token)) {
            ignored[token.id()] = true;
        }
    }

    /**
     * @param token A token of this file.
     * @return The anchor of the offset currently governing the token, or null for the left margin.
     */
    public Token firstDependency(Token token) {
        requireToken(token);
        return descriptors.findFloor(token.start()).anchor();
    }

    /**
     * @param position A non-negative position.
     * @return The descriptor currently governing that position.
     */
    public OffsetDescriptor descriptorAt(int position) {
        return descriptors.findFloor(position);
    }

    /**
     * @return A read-only view of the interval partition, mainly for diagnostics.
     */
    public IntervalStore<OffsetDescriptor> descriptors() {
        return descriptors;
    }

    public boolean isFrozen() {
        return resolver != null;
    }

    /**
     * Ends the declaration phase. Further declarations throw {@link IllegalStateException}.
     * @return The resolver over the final offsets; repeated calls return the same instance.
     */
    public IndentResolver freeze() {
        if (resolver == null) {
            resolver = new IndentResolver(tokenIndex, style, descriptors, alignmentLocks, ignored);
            LOG.debug("Frozen offsets: {} declarations, {} breakpoints, {} tokens",
                    declarationCount, descriptors.size(), tokenIndex.size());
        }
        return resolver;
    }

    TokenIndex tokenIndex() {
        return tokenIndex;
    }

    private void requireDeclarationPhase() {
        if (resolver != null) {
            throw new IllegalStateException("Offsets can no longer be declared once resolution has started.");
        }
    }

    private void requireToken(Token token) {
        if (token == null) {
            throw new IllegalArgumentException("Token must not be null.");
        }
        if (token.id() < 0 || token.id() >= tokenIndex.size()) {
            throw new IllegalArgumentException("Token does not belong to this file: " + token);
        }
    }
}
