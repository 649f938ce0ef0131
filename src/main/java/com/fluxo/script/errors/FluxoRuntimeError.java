package com.fluxo.script.errors;

/** An engine limit was exceeded: call depth, loop iterations or deferred tasks. */
public class FluxoRuntimeError extends FluxoError {

    public FluxoRuntimeError(String message) {
        super("RangeError", message);
    }

    public FluxoRuntimeError(String message, Integer line, Integer column) {
        super("RangeError", message, null, line, column);
    }
}
