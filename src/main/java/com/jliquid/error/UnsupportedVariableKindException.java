package com.jliquid.error;

/**
 * A value outside the text / number / boolean kinds was offered to a context.
 */
@SuppressWarnings("serial")
public class UnsupportedVariableKindException extends LiquidException {
    private final String kind;

    public UnsupportedVariableKindException(String key, String kind) {
        super("Tried to add unsupported kind " + kind + " to context" + (key == null ? "" : " as '" + key + "'"));
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }
}
