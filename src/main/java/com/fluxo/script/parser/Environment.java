package com.fluxo.script.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lexical scope. Scopes form a parent chain ending at the run's globals.
 *
 * Closures hold a reference to the scope they were created in, so later
 * writes to that scope are visible to them.
 */
public class Environment {

    private final Environment parent;
    private final Map<String, Value> values = new HashMap<>();

    public Environment() {
        this(null);
    }

    public Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    public Environment parent() {
        return parent;
    }

    /** Declares or redeclares {@code name} in this scope. */
    public void define(String name, Value value) {
        values.put(name, value == null ? Value.undefined() : value);
    }

    public boolean hasLocal(String name) {
        return values.containsKey(name);
    }

    public boolean exists(String name) {
        return lookupScope(name) != null;
    }

    /** @return the bound value, or null when the name is unbound along the whole chain */
    public Value get(String name) {
        Environment scope = lookupScope(name);
        return (scope == null) ? null : scope.values.get(name);
    }

    /** Updates the nearest binding of {@code name}; returns false when there is none. */
    public boolean assign(String name, Value value) {
        Environment scope = lookupScope(name);
        if (scope == null) return false;
        scope.values.put(name, value == null ? Value.undefined() : value);
        return true;
    }

    /** This scope's own bindings, for debugging and tests. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    private Environment lookupScope(String name) {
        Environment e = this;
        while (e != null) {
            if (e.values.containsKey(name)) return e;
            e = e.parent;
        }
        return null;
    }
}
