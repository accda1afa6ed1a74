package com.jliquid.template;

import java.util.regex.Pattern;

/**
 * Tag-boundary patterns understood by the {@link Tokenizer}.
 */
public enum TagPattern {
    /**
     * {@code {% ... %}}, {@code {{ ... }}} or a bare unterminated opener.
     * The second closing brace of an output tag is optional, so an output tag
     * closed by a single brace is sliced as a complete tag. Only {@code \n}
     * ends a tag early; other line terminators may appear inside one.
     */
    TEMPLATE("(\\{%.*?%\\}|\\{\\{.*?\\}\\}?|\\{\\{|\\{%)");

    private final String regex;
    private final Pattern pattern;

    TagPattern(String regex) {
        this.regex = regex;
        this.pattern = Pattern.compile(regex, Pattern.UNIX_LINES);
    }

    public Pattern toPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return regex;
    }
}
