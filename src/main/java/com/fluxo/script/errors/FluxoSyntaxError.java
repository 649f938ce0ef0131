package com.fluxo.script.errors;

/** Raised by the lexer and parser; aborts evaluation of the file being parsed. */
public class FluxoSyntaxError extends FluxoError {

    public FluxoSyntaxError(String message) {
        super("SyntaxError", message);
    }

    public FluxoSyntaxError(String message, Integer line, Integer column) {
        super("SyntaxError", message, null, line, column);
    }
}
