package com.jliquid.lexer;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Optional;

public enum TokenKind {
    COMPARISON,
    IDENTIFIER,
    NUMBER,
    STRING,
    RANGE,
    PIPE,
    DOT,
    COLON,
    COMMA,
    OPEN_SQUARE,
    CLOSE_SQUARE,
    OPEN_ROUND,
    CLOSE_ROUND,
    QUESTION,
    DASH;

    private static final ImmutableMap<String, TokenKind> SPECIALS = Maps.mutable.<String, TokenKind>empty()
        .withKeyValue("|", PIPE)
        .withKeyValue(".", DOT)
        .withKeyValue(":", COLON)
        .withKeyValue(",", COMMA)
        .withKeyValue("[", OPEN_SQUARE)
        .withKeyValue("]", CLOSE_SQUARE)
        .withKeyValue("(", OPEN_ROUND)
        .withKeyValue(")", CLOSE_ROUND)
        .withKeyValue("?", QUESTION)
        .withKeyValue("-", DASH)
        .toImmutable();

    /**
     * Looks up the kind of a single-character token.
     */
    public static Optional<TokenKind> special(String character) {
        return Optional.ofNullable(SPECIALS.get(character));
    }
}
