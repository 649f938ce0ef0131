package com.fluxo.protocol;

import com.fluxo.script.parser.FluxoModule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Loaded modules of one sandbox session, keyed by canonical path. Failures are never stored. */
public final class ModuleCache {

    public static final class Entry {
        private final FluxoModule module;
        private final boolean executed;

        Entry(FluxoModule module, boolean executed) {
            this.module = module;
            this.executed = executed;
        }

        public FluxoModule module() { return module; }
        public boolean executed() { return executed; }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public Entry get(String path) {
        return entries.get(path);
    }

    public boolean isLoaded(String path) {
        Entry e = entries.get(path);
        return e != null && e.executed;
    }

    void put(String path, FluxoModule module) {
        entries.put(path, new Entry(module, true));
    }

    public int size() {
        return entries.size();
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(entries);
    }
}
