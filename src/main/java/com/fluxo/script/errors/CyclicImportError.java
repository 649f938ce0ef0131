package com.fluxo.script.errors;

import java.util.List;

/** A module's initialisation transitively required the same module again. */
public class CyclicImportError extends FluxoError {

    private final List<String> chain;

    public CyclicImportError(List<String> chain) {
        super("CyclicImportError", "Cyclic import: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
