package com.jliquid.lexer;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Turns the interior of one tag into tokens. The lexer owns the scanner;
 * {@link Tokens} advances it, so a lexer can be iterated only once.
 */
public class Lexer {
    private final Scanner scanner;

    public Lexer(String source) {
        this.scanner = new Scanner(source);
    }

    public Tokens tokens() {
        return new Tokens(scanner);
    }

    public MutableList<Token> tokenize() {
        MutableList<Token> tokens = Lists.mutable.empty();
        tokens().forEachRemaining(tokens::add);
        return tokens;
    }

    Scanner scanner() {
        return scanner;
    }
}
