package com.jliquid.error;

/**
 * A character that matches no token pattern and is not a single-character token.
 */
@SuppressWarnings("serial")
public class LexicalException extends LiquidException {
    private final String character;
    private final int position;

    public LexicalException(String character, int position) {
        super("Unexpected character '" + character + "' at position " + position);
        this.character = character;
        this.position = position;
    }

    public String character() {
        return character;
    }

    public int position() {
        return position;
    }
}
