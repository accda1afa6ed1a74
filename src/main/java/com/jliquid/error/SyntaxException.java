package com.jliquid.error;

import com.jliquid.lexer.Token;

/**
 * The parser found a token it cannot use at the current index, or ran out of tokens.
 */
@SuppressWarnings("serial")
public class SyntaxException extends LiquidException {
    private final Token token;
    private final int index;

    public SyntaxException(String message, Token token, int index) {
        super(message + (token == null
            ? " (end of input at token " + index + ")"
            : " (found " + token + " at token " + index + ")"));
        this.token = token;
        this.index = index;
    }

    /**
     * @return the offending token, or {@code null} at end of input
     */
    public Token token() {
        return token;
    }

    public int index() {
        return index;
    }
}
