package com.jliquid.context;

import com.jliquid.error.UnsupportedVariableKindException;

/**
 * Value stored in a {@link Context}. The set of kinds is closed.
 */
public sealed interface Variable {

    record TextVariable(String value) implements Variable {
        public TextVariable {
            if (value == null) {
                throw new IllegalArgumentException("Text value cannot be null");
            }
        }
    }

    record NumberVariable(double value) implements Variable {}

    record BooleanVariable(boolean value) implements Variable {}

    static Variable text(String value) {
        return new TextVariable(value);
    }

    static Variable number(double value) {
        return new NumberVariable(value);
    }

    static Variable bool(boolean value) {
        return new BooleanVariable(value);
    }

    /**
     * Wraps a host value. Only {@link String}, {@link Double} and {@link Boolean}
     * are accepted; integers and other numbers are not converted.
     *
     * @throws UnsupportedVariableKindException for any other type, or {@code null}
     */
    static Variable of(Object value) {
        if (value instanceof Variable v) {
            return v;
        } else if (value instanceof String s) {
            return new TextVariable(s);
        } else if (value instanceof Double d) {
            return new NumberVariable(d);
        } else if (value instanceof Boolean b) {
            return new BooleanVariable(b);
        }
        throw new UnsupportedVariableKindException(null, value == null ? "null" : value.getClass().getName());
    }
}
