package org.tabula.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabula.api.IndentViolation;
import org.tabula.api.SourceInfo;
import org.tabula.api.TextEdit;
import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.TokenStream;
import org.tabula.indent.IndentResolver;
import org.tabula.indent.IndentStyle;
import org.tabula.indent.TokenIndex;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares the indentation of every line with the resolved offsets and reports the
 * lines that differ.
 * <p>
 * Blank lines and lines continuing a multi-line token are skipped. Indentation mixing
 * spaces and tabs is accepted, as is a comment indented like the code next to it.
 */
public final class IndentReporter {

    private static final Logger LOG = LoggerFactory.getLogger(IndentReporter.class);

    private final TokenIndex tokenIndex;
    private final TokenStream tokens;
    private final IndentResolver resolver;
    private final IndentStyle style;

    public IndentReporter(TokenIndex tokenIndex, TokenStream tokens, IndentResolver resolver) {
        this.tokenIndex = tokenIndex;
        this.tokens = tokens;
        this.resolver = resolver;
        this.style = resolver.style();
    }

    /**
     * @return The violations in line order.
     */
    public List<IndentViolation> report() {
        List<IndentViolation> violations = new ArrayList<>();
        for (int line = 1; line <= tokenIndex.lineCount(); line++) {
            Token firstTokenOfLine = tokenIndex.firstTokenOfLine(line);
            if (firstTokenOfLine == null || firstTokenOfLine.line() != line) {
                continue;
            }
            int desiredWidth = resolver.desiredWidth(firstTokenOfLine);
            if (isValid(firstTokenOfLine, desiredWidth)) {
                continue;
            }
            if (firstTokenOfLine.isComment() && matchesNeighbour(firstTokenOfLine)) {
                continue;
            }
            violations.add(violation(firstTokenOfLine, desiredWidth));
        }
        LOG.debug("Checked {} lines, {} violations", tokenIndex.lineCount(), violations.size());
        return violations;
    }

    /**
     * A comment may be indented like the code token before it or the one after that.
     */
    private boolean matchesNeighbour(Token comment) {
        Token tokenBefore = tokens.tokenBefore(comment);
        Token tokenAfter;
        if (tokenBefore != null) {
            tokenAfter = tokens.tokenAfter(tokenBefore);
        } else {
            tokenAfter = tokens.codeTokens().isEmpty() ? null : tokens.codeTokens().get(0);
        }
        return tokenBefore != null && isValid(comment, resolver.desiredWidth(tokenBefore))
                || tokenAfter != null && isValid(comment, resolver.desiredWidth(tokenAfter));
    }

    private boolean isValid(Token token, int desiredWidth) {
        String indentation = tokenIndex.actualIndent(token);
        return indentation.equals(style.render(desiredWidth))
                || indentation.indexOf(' ') >= 0 && indentation.indexOf('\t') >= 0;
    }

    private IndentViolation violation(Token token, int desiredWidth) {
        String indentation = tokenIndex.actualIndent(token);
        int spaces = 0;
        int tabs = 0;
        for (int i = 0; i < indentation.length(); i++) {
            char c = indentation.charAt(i);
            if (c == ' ') {
                spaces++;
            } else if (c == '\t') {
                tabs++;
            }
        }
        String message = ViolationMessages.create(style, desiredWidth, spaces, tabs);
        TextEdit fix = new TextEdit(token.start() - token.column(), token.start(), style.render(desiredWidth));
        return new IndentViolation(
                new SourceInfo(token.fileName(), token.line(), token.column() + 1),
                desiredWidth / style.unitSize(), desiredWidth, spaces, tabs, message, fix);
    }
}
