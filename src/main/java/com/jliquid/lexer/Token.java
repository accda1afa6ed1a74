package com.jliquid.lexer;

/**
 * A token kind paired with the exact source text it was lexed from.
 */
public record Token(TokenKind kind, String lexeme) {

    public static Token of(TokenKind kind, String lexeme) {
        return new Token(kind, lexeme);
    }

    @Override
    public String toString() {
        return kind + "(" + lexeme + ")";
    }
}
