package com.jliquid.error;

@SuppressWarnings("serial")
public class CursorUnderflowException extends LiquidException {
    private final long requestedIndex;

    public CursorUnderflowException(long requestedIndex) {
        super("Attempted to jump too far back (index " + requestedIndex + ")");
        this.requestedIndex = requestedIndex;
    }

    public long requestedIndex() {
        return requestedIndex;
    }
}
