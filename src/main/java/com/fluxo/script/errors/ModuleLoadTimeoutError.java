package com.fluxo.script.errors;

/** No module-response or module-error arrived for a request within the bridge timeout. */
public class ModuleLoadTimeoutError extends FluxoError {

    private final String path;
    private final long timeoutMillis;

    public ModuleLoadTimeoutError(String path, long timeoutMillis) {
        super("ModuleLoadTimeoutError", "Module load timeout: " + path + " (" + timeoutMillis + " ms)");
        this.path = path;
        this.timeoutMillis = timeoutMillis;
    }

    public String path() { return path; }
    public long timeoutMillis() { return timeoutMillis; }
}
