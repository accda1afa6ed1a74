package com.jliquid.template;

/**
 * Half-open {@code [start, end)} range of the template source.
 * {@code tag} is set for ranges matched by the tag pattern.
 */
public record Slice(int start, int end, boolean tag) {

    public static Slice tag(int start, int end) {
        return new Slice(start, end, true);
    }

    public static Slice literal(int start, int end) {
        return new Slice(start, end, false);
    }

    public String of(String source) {
        return source.substring(start, end);
    }

    public int length() {
        return end - start;
    }
}
