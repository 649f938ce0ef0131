package com.fluxo.script;

import com.fluxo.debug.Debug;
import com.fluxo.script.errors.CyclicImportError;
import com.fluxo.script.errors.FluxoError;
import com.fluxo.script.errors.ModuleError;
import com.fluxo.script.errors.ModuleNotFoundError;
import com.fluxo.script.parser.ExecutionContext;
import com.fluxo.script.parser.FluxoModule;
import com.fluxo.script.parser.ModuleLoader;
import com.fluxo.script.resolve.FileKind;
import com.fluxo.script.resolve.SourceUnit;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Module loader of a batch run. Serves modules already in the registry and
 * initialises module files of the same run on first import, so an importer
 * never observes a half-built export table.
 */
final class WorkspaceModuleLoader implements ModuleLoader {

    private static final String TAG = "ModuleLoader";

    interface UnitEvaluator {
        void evaluate(ExecutionContext ctx, SourceUnit unit);
    }

    private final Map<String, SourceUnit> units = new LinkedHashMap<>();
    private final Set<String> evaluated = new HashSet<>();
    private final UnitEvaluator evaluator;

    WorkspaceModuleLoader(List<SourceUnit> runUnits, UnitEvaluator evaluator) {
        for (SourceUnit u : runUnits) units.put(u.path(), u);
        this.evaluator = evaluator;
    }

    /** Marks a unit as started; returns false if it already ran (on demand or in schedule). */
    boolean begin(String path) {
        return evaluated.add(path);
    }

    @Override
    public FluxoModule load(String canonicalPath, ExecutionContext ctx) {
        FluxoModule m = ctx.getModule(canonicalPath);
        if (m == null) {
            SourceUnit u = units.get(canonicalPath);
            if (u == null) throw new ModuleNotFoundError(canonicalPath);
            if (u.kind() != FileKind.MODULE) {
                throw new ModuleNotFoundError(canonicalPath,
                        "Module not found: " + canonicalPath + " is a script that has not run yet");
            }
            Debug.get().d(TAG, "initialising " + canonicalPath + " on demand");
            evaluator.evaluate(ctx, u);
            m = ctx.getModule(canonicalPath);
            if (m == null) throw new ModuleNotFoundError(canonicalPath);
        }
        switch (m.state()) {
            case INITIALIZING:
                throw ctx.cycleTo(canonicalPath);
            case FAILED:
                throw failedImport(m);
            default:
                return m;
        }
    }

    private static FluxoError failedImport(FluxoModule m) {
        FluxoError cause = m.failure();
        if (cause instanceof CyclicImportError) {
            return new CyclicImportError(((CyclicImportError) cause).chain());
        }
        return new ModuleError("Module '" + m.name() + "' (" + m.path() + ") failed to initialise", cause);
    }
}
