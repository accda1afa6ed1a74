package com.jliquid.parser;

import com.jliquid.error.CursorUnderflowException;
import com.jliquid.error.NestingTooDeepException;
import com.jliquid.error.SyntaxException;
import com.jliquid.lexer.Lexer;
import com.jliquid.lexer.Token;
import com.jliquid.lexer.TokenKind;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Recursive-descent parser over the tokens of one tag.
 *
 * <pre>
 * expression := variable | range | STRING | NUMBER
 * variable   := IDENT ('[' expression ']')* ('.' variable)?
 * range      := '(' expression '..' expression ')'
 * </pre>
 *
 * The cursor only moves on a successful {@link #consume} or an explicit {@link #jump}.
 */
public class Parser {
    public static final int DEFAULT_MAX_DEPTH = 64;

    private final ImmutableList<Token> tokens;
    private final int maxDepth;
    private int currentIndex;
    private int depth;

    public Parser(String source) {
        this(new Lexer(source).tokenize(), DEFAULT_MAX_DEPTH);
    }

    public Parser(String source, int maxDepth) {
        this(new Lexer(source).tokenize(), maxDepth);
    }

    public Parser(MutableList<Token> tokens, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.tokens = tokens.toImmutable();
        this.maxDepth = maxDepth;
        this.currentIndex = 0;
    }

    public int index() {
        return currentIndex;
    }

    public boolean isAtEnd() {
        return currentIndex >= tokens.size();
    }

    public ImmutableList<Token> tokens() {
        return tokens;
    }

    /**
     * Moves the cursor by a relative offset. Moving past the end is allowed.
     *
     * @throws CursorUnderflowException if the new index would be negative
     */
    public void jump(int offset) {
        long index = (long) currentIndex + offset;
        if (index < 0) {
            throw new CursorUnderflowException(index);
        }
        currentIndex = (int) Math.min(index, Integer.MAX_VALUE);
    }

    /**
     * Takes the current token if it has the given kind.
     *
     * @return the lexeme, or empty (cursor untouched) on a mismatch
     */
    public Optional<String> consume(TokenKind kind) {
        if (!isCurrent(kind)) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(currentIndex++).lexeme());
    }

    public boolean isCurrent(TokenKind kind) {
        return isCurrent(kind, 0);
    }

    public boolean isCurrent(TokenKind kind, int offset) {
        long index = (long) currentIndex + offset;
        if (index < 0 || index >= tokens.size()) {
            return false;
        }
        return tokens.get((int) index).kind() == kind;
    }

    /**
     * Parses one expression and returns its normalized markup, e.g.
     * {@code hi?[5].there?} or {@code (1..n)}.
     *
     * @return empty when no tokens are left
     */
    public Optional<String> expression() {
        if (isAtEnd()) {
            return Optional.empty();
        }
        return Optional.of(parseExpression().markup());
    }

    public Expression parseExpression() {
        Token token = current();
        if (token == null) {
            throw new SyntaxException("Expected an expression", null, currentIndex);
        }

        enter();
        try {
            return switch (token.kind()) {
                case IDENTIFIER -> variable();
                case OPEN_ROUND -> range();
                case STRING -> new Expression.StringLiteral(expect(TokenKind.STRING));
                case NUMBER -> new Expression.NumberLiteral(expect(TokenKind.NUMBER));
                default -> throw new SyntaxException("Syntax Error: cannot start an expression", token, currentIndex);
            };
        } finally {
            depth--;
        }
    }

    private Expression.VariablePath variable() {
        String name = expect(TokenKind.IDENTIFIER);

        MutableList<Expression> indices = Lists.mutable.empty();
        while (consume(TokenKind.OPEN_SQUARE).isPresent()) {
            indices.add(parseExpression());
            expect(TokenKind.CLOSE_SQUARE);
        }

        Expression.VariablePath tail = null;
        if (consume(TokenKind.DOT).isPresent()) {
            enter();
            try {
                tail = variable();
            } finally {
                depth--;
            }
        }

        return new Expression.VariablePath(name, indices.toImmutable(), tail);
    }

    private Expression.Range range() {
        expect(TokenKind.OPEN_ROUND);
        Expression start = parseExpression();
        expect(TokenKind.RANGE);
        Expression end = parseExpression();
        expect(TokenKind.CLOSE_ROUND);
        return new Expression.Range(start, end);
    }

    private String expect(TokenKind kind) {
        return consume(kind).orElseThrow(() ->
            new SyntaxException("Expected " + kind, current(), currentIndex));
    }

    private void enter() {
        if (depth >= maxDepth) {
            throw new NestingTooDeepException(maxDepth, currentIndex);
        }
        depth++;
    }

    private Token current() {
        return currentIndex < tokens.size() ? tokens.get(currentIndex) : null;
    }
}
