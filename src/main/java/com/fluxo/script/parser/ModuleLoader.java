package com.fluxo.script.parser;

/**
 * Supplies initialised modules to import expressions.
 *
 * The batch evaluator initialises workspace files on demand; the sandboxed
 * runtime serves modules it has already fetched and linked.
 */
public interface ModuleLoader {

    /**
     * @param canonicalPath already-resolved module path
     * @throws com.fluxo.script.errors.ModuleNotFoundError when no source exists for the path
     * @throws com.fluxo.script.errors.CyclicImportError when the module is still initialising
     */
    FluxoModule load(String canonicalPath, ExecutionContext context);
}
