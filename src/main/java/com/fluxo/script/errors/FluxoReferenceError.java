package com.fluxo.script.errors;

/** Read of an unbound name, or assignment to one in strict mode. */
public class FluxoReferenceError extends FluxoError {

    public FluxoReferenceError(String message) {
        super("ReferenceError", message);
    }

    public FluxoReferenceError(String message, Integer line, Integer column) {
        super("ReferenceError", message, null, line, column);
    }
}
