package com.fluxo.script.resolve;

import com.fluxo.script.errors.FluxoTypeError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps import specifiers to canonical paths and orders a batch run.
 *
 * <p>Canonical paths are absolute, '/'-separated and free of '.', '..' and
 * empty segments. Specifiers starting with '/' are absolute; anything else
 * resolves against the importing file's directory. A specifier whose last
 * segment has no extension gets {@code .fxm}.
 */
public final class ModuleResolver {

    public String resolve(String specifier, String importerPath) {
        if (specifier == null || specifier.trim().isEmpty()) {
            throw new FluxoTypeError("Module path must be a non-empty string");
        }
        String spec = specifier.trim().replace('\\', '/');
        String joined = spec.startsWith("/") ? spec : directoryOf(importerPath) + "/" + spec;
        String canonical = normalize(joined);
        return withDefaultExtension(canonical);
    }

    /** Directory part of a canonical file path; "/" for root-level files. */
    public static String directoryOf(String path) {
        if (path == null || path.isEmpty()) return "";
        String p = normalize(path);
        int slash = p.lastIndexOf('/');
        return (slash <= 0) ? "" : p.substring(0, slash);
    }

    /** Absolute form of {@code path} with '.', '..' and empty segments removed. */
    public static String normalize(String path) {
        if (path == null) return "/";
        Deque<String> parts = new ArrayDeque<>();
        for (String seg : path.replace('\\', '/').split("/")) {
            if (seg.isEmpty() || seg.equals(".")) continue;
            if (seg.equals("..")) {
                if (!parts.isEmpty()) parts.removeLast();
                continue;
            }
            parts.addLast(seg);
        }
        return "/" + String.join("/", parts);
    }

    static String withDefaultExtension(String canonical) {
        String last = canonical.substring(canonical.lastIndexOf('/') + 1);
        if (last.isEmpty() || last.contains(".")) return canonical;
        return canonical + FileKind.MODULE_EXTENSION;
    }

    /** Binding name for a file without a module block: its file name minus extension. */
    public static String stemOf(String path) {
        String last = path.substring(path.lastIndexOf('/') + 1);
        int dot = last.indexOf('.');
        String stem = (dot > 0) ? last.substring(0, dot) : last;
        return stem.isEmpty() ? "main" : stem;
    }

    /**
     * Run order for a batch: every module-kind unit before every script-kind
     * unit, caller order kept within each kind.
     *
     * @throws IllegalArgumentException when two units share a canonical path
     */
    public List<SourceUnit> plan(List<SourceUnit> units) {
        Set<String> seen = new HashSet<>();
        List<SourceUnit> modules = new ArrayList<>();
        List<SourceUnit> scripts = new ArrayList<>();
        for (SourceUnit u : units) {
            if (!seen.add(u.path())) {
                throw new IllegalArgumentException("Duplicate file path in request: " + u.path());
            }
            if (u.kind() == FileKind.MODULE) modules.add(u);
            else scripts.add(u);
        }
        List<SourceUnit> order = new ArrayList<>(modules.size() + scripts.size());
        order.addAll(modules);
        order.addAll(scripts);
        return order;
    }
}
