package com.jliquid.lexer;

import com.jliquid.error.LexicalException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lazy token sequence over a shared {@link Scanner}. Each step produces one
 * token; the sequence ends when the scanner runs out of text.
 */
public class Tokens implements Iterator<Token> {
    static final Pattern COMPARISON = Pattern.compile("==|!=|<>|<=?|>=?|contains");
    static final Pattern SINGLE_STRING_LITERAL = Pattern.compile("'[^']*'");
    static final Pattern DOUBLE_STRING_LITERAL = Pattern.compile("\"[^\"]*\"");
    static final Pattern NUMBER_LITERAL = Pattern.compile("-?\\d+(\\.\\d+)?", Pattern.UNICODE_CHARACTER_CLASS);
    static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][\\w-]*\\??", Pattern.UNICODE_CHARACTER_CLASS);
    static final Pattern RANGE_OP = Pattern.compile("\\.\\.");

    // Checked in order, first match wins.
    private static final ImmutableList<Pair<Pattern, TokenKind>> MATCHERS = Lists.immutable.of(
        Tuples.pair(COMPARISON, TokenKind.COMPARISON),
        Tuples.pair(SINGLE_STRING_LITERAL, TokenKind.STRING),
        Tuples.pair(DOUBLE_STRING_LITERAL, TokenKind.STRING),
        Tuples.pair(NUMBER_LITERAL, TokenKind.NUMBER),
        Tuples.pair(IDENTIFIER, TokenKind.IDENTIFIER),
        Tuples.pair(RANGE_OP, TokenKind.RANGE)
    );

    private final Scanner scanner;
    private Token pending;

    Tokens(Scanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = lex().orElse(null);
        }
        return pending != null;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens");
        }
        Token token = pending;
        pending = null;
        return token;
    }

    private Optional<Token> lex() {
        for (Pair<Pattern, TokenKind> matcher : MATCHERS) {
            if (scanner.check(matcher.getOne())) {
                return scanner.scan(matcher.getOne()).map(value -> Token.of(matcher.getTwo(), value));
            }
        }

        int position = scanner.position();
        return scanner.nextChar().map(chr -> TokenKind.special(chr)
            .map(kind -> Token.of(kind, chr))
            .orElseThrow(() -> new LexicalException(chr, position)));
    }
}
