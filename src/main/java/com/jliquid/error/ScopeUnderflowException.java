package com.jliquid.error;

@SuppressWarnings("serial")
public class ScopeUnderflowException extends LiquidException {

    public ScopeUnderflowException() {
        super("Cannot pop the base scope");
    }
}
