package com.jliquid.parser;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Parsed expression. {@link #markup()} is the normalized text handed to the evaluator.
 */
public sealed interface Expression {
    String markup();

    record StringLiteral(String lexeme) implements Expression {
        public String value() {
            return lexeme.substring(1, lexeme.length() - 1);
        }

        @Override
        public String markup() {
            return lexeme;
        }
    }

    record NumberLiteral(String lexeme) implements Expression {
        /**
         * Decimal value of the lexeme. Digits from any script are accepted.
         */
        public double value() {
            StringBuilder ascii = new StringBuilder(lexeme.length());
            lexeme.codePoints().forEach(cp -> {
                if (Character.isDigit(cp)) {
                    ascii.append((char) ('0' + Character.digit(cp, 10)));
                } else {
                    ascii.appendCodePoint(cp);
                }
            });
            return Double.parseDouble(ascii.toString());
        }

        @Override
        public String markup() {
            return lexeme;
        }
    }

    /**
     * {@code name[index]...} optionally followed by {@code .tail}.
     */
    record VariablePath(String name, ImmutableList<Expression> indices, VariablePath tail) implements Expression {
        @Override
        public String markup() {
            StringBuilder sb = new StringBuilder(name);
            for (Expression index : indices) {
                sb.append('[').append(index.markup()).append(']');
            }
            if (tail != null) {
                sb.append('.').append(tail.markup());
            }
            return sb.toString();
        }
    }

    record Range(Expression start, Expression end) implements Expression {
        @Override
        public String markup() {
            return "(" + start.markup() + ".." + end.markup() + ")";
        }
    }
}
