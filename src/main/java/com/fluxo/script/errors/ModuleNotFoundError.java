package com.fluxo.script.errors;

public class ModuleNotFoundError extends FluxoError {

    private final String path;

    public ModuleNotFoundError(String path) {
        this(path, "Module not found: " + path);
    }

    public ModuleNotFoundError(String path, String message) {
        super("ModuleNotFoundError", message);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
