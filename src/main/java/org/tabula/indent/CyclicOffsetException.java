package org.tabula.indent;

import org.tabula.frontend.lexer.Token;

/**
 * Thrown when the desired indentation of a token depends, through its chain of anchors,
 * on itself.
 */
public class CyclicOffsetException extends IllegalStateException {

    private final transient Token token;
    private final transient Token dependency;

    /**
     * @param token The token whose resolution was in progress when the cycle closed.
     * @param dependency The token that depends back on it.
     */
    public CyclicOffsetException(Token token, Token dependency) {
        super("Cyclic indentation dependency between " + token + " and " + dependency);
        this.token = token;
        this.dependency = dependency;
    }

    public Token getToken() {
        return token;
    }

    public Token getDependency() {
        return dependency;
    }
}
