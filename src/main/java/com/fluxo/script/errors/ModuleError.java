package com.fluxo.script.errors;

/** Misplaced export or a module that failed to initialise. */
public class ModuleError extends FluxoError {

    public ModuleError(String message) {
        super("ModuleError", message);
    }

    public ModuleError(String message, Throwable cause) {
        super("ModuleError", message, cause);
    }

    public ModuleError(String message, Integer line, Integer column) {
        super("ModuleError", message, null, line, column);
    }
}
