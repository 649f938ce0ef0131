package com.fluxo.script.parser;

import com.fluxo.script.errors.FluxoError;
import com.fluxo.script.errors.FluxoTypeError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Export table of one source file.
 *
 * Created empty when the file starts evaluating, filled by export
 * statements, frozen when the file finishes. Private bindings never live
 * here; they stay in the module's own scope.
 */
public final class FluxoModule {

    public enum State { INITIALIZING, READY, FAILED }

    private final String path;
    private String name;
    private boolean declared;
    private final Map<String, Value> exports = new LinkedHashMap<>();
    private State state = State.INITIALIZING;
    private FluxoError failure;

    public FluxoModule(String path, String name) {
        this.path = path;
        this.name = name;
    }

    public String path() { return path; }
    public String name() { return name; }
    public State state() { return state; }

    /** True when the file declared a {@code module NAME { }} block. */
    public boolean isDeclared() { return declared; }

    void declareName(String moduleName) {
        this.name = moduleName;
        this.declared = true;
    }

    public void export(String exportName, Value value) {
        if (state != State.INITIALIZING) {
            throw new FluxoTypeError("Cannot export '" + exportName + "' from module '" + name + "' after it finished initialising");
        }
        exports.put(exportName, value);
    }

    public boolean hasExport(String exportName) {
        return exports.containsKey(exportName);
    }

    /** The exported value, or undefined. */
    public Value get(String exportName) {
        Value v = exports.get(exportName);
        return (v == null) ? Value.undefined() : v;
    }

    public Map<String, Value> exports() {
        return Collections.unmodifiableMap(exports);
    }

    public boolean isFrozen() {
        return state != State.INITIALIZING;
    }

    public void freeze() {
        if (state == State.INITIALIZING) state = State.READY;
    }

    public void markFailed(FluxoError cause) {
        state = State.FAILED;
        failure = cause;
    }

    /** Why initialisation failed, or null. */
    public FluxoError failure() {
        return failure;
    }

    @Override
    public String toString() {
        return "module " + name + " (" + path + ", " + state + ", exports=" + exports.keySet() + ")";
    }
}
