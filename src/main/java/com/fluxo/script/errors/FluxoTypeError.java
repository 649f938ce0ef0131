package com.fluxo.script.errors;

/** Operation applied to a value of the wrong type, e.g. calling a non-function. */
public class FluxoTypeError extends FluxoError {

    public FluxoTypeError(String message) {
        super("TypeError", message);
    }

    public FluxoTypeError(String message, Integer line, Integer column) {
        super("TypeError", message, null, line, column);
    }
}
