package com.jliquid.lexer;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cursor over an immutable source string. Patterns are always matched anchored
 * at the cursor, and whitespace around a match is skipped automatically.
 * Whitespace skipped before a failed match stays skipped.
 */
public class Scanner {
    private final String source;
    private final int length;
    private int index;

    public Scanner(String source) {
        this.source = source;
        this.length = source.length();
        this.index = 0;
    }

    public int position() {
        return Math.min(index, length);
    }

    public boolean isAtEnd() {
        return position() == length;
    }

    /**
     * Moves the cursor {@code n} chars ahead, stopping at the end of the source.
     *
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public void skip(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot skip backwards: " + n);
        }
        index = (int) Math.min((long) position() + n, length);
    }

    public Optional<String> rest() {
        if (isAtEnd()) {
            return Optional.empty();
        }
        return Optional.of(raw());
    }

    /**
     * Reads one code point and moves past it.
     */
    public Optional<String> nextChar() {
        if (isAtEnd()) {
            return Optional.empty();
        }

        int codePoint = source.codePointAt(position());
        int width = Character.charCount(codePoint);
        String chr = source.substring(position(), position() + width);
        skip(width);

        return Optional.of(chr);
    }

    public Optional<String> scan(Pattern pattern) {
        skipWhitespace();
        Matcher matcher = matcherAtCursor(pattern);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }

        String matched = matcher.group();
        skip(matched.length());
        skipWhitespace();
        return Optional.of(matched);
    }

    public boolean check(Pattern pattern) {
        skipWhitespace();
        return matcherAtCursor(pattern).lookingAt();
    }

    private Matcher matcherAtCursor(Pattern pattern) {
        return pattern.matcher(source).region(position(), length);
    }

    private void skipWhitespace() {
        int pos = position();
        while (pos < length) {
            int codePoint = source.codePointAt(pos);
            if (!isWhitespace(codePoint)) {
                break;
            }
            pos += Character.charCount(codePoint);
        }
        index = pos;
    }

    // Unicode White_Space, which includes no-break spaces and NEL.
    private static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint) || codePoint == 0x85;
    }

    private String raw() {
        return source.substring(position());
    }
}
