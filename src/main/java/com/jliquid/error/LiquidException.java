package com.jliquid.error;

/**
 * Base type for every failure raised while slicing, lexing or parsing a
 * template, or while mutating a {@linkplain com.jliquid.context.Context Context}.
 * The caller decides whether to abort the template, skip the tag, or report.
 */
@SuppressWarnings("serial")
public class LiquidException extends RuntimeException {

    public LiquidException(String message) {
        super(message);
    }

    public LiquidException(String message, Throwable cause) {
        super(message, cause);
    }
}
