package com.jliquid.error;

@SuppressWarnings("serial")
public class NestingTooDeepException extends LiquidException {
    private final int maxDepth;
    private final int index;

    public NestingTooDeepException(int maxDepth, int index) {
        super("Expression too deeply nested (limit " + maxDepth + ") at token " + index);
        this.maxDepth = maxDepth;
        this.index = index;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public int index() {
        return index;
    }
}
