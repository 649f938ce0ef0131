package com.fluxo.protocol;

import com.fluxo.debug.Debug;
import com.fluxo.script.errors.CyclicImportError;
import com.fluxo.script.errors.FluxoError;
import com.fluxo.script.errors.ModuleLoadTimeoutError;
import com.fluxo.script.errors.ModuleNotFoundError;
import com.fluxo.script.parser.DependencyCollector;
import com.fluxo.script.parser.ExecutionContext;
import com.fluxo.script.parser.FluxoModule;
import com.fluxo.script.parser.Interpreter;
import com.fluxo.script.parser.ModuleLoader;
import com.fluxo.script.parser.Program;
import com.fluxo.script.resolve.FileKind;
import com.fluxo.script.resolve.HtmlSource;
import com.fluxo.script.schedule.Cancellable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches modules from the host on demand.
 *
 * Per canonical path: Unrequested, Pending, then Loaded or Failed. The first
 * reference posts one module-request and parks a future in the pending map;
 * later references share that future. A module-response is parsed, its
 * literal import specifiers are loaded first, then the module is evaluated in
 * the session context and cached. A module-error, an evaluation failure or
 * the timeout reject the future and clear the pending entry so a later
 * reference retries.
 *
 * State is confined to the session's scheduler thread; no locking. The
 * public loading methods move onto that thread when called from elsewhere.
 */
public final class ModuleBridge {

    private static final String TAG = "ModuleBridge";

    private enum Phase { AWAITING, LINKING }

    private static final class Pending {
        final CompletableFuture<FluxoModule> future = new CompletableFuture<>();
        final List<String> dependencies = new ArrayList<>();
        List<String> linkAncestors;
        Cancellable timer;
        Phase phase = Phase.AWAITING;
    }

    private final ExecutionContext ctx;
    private final MessageChannel channel;
    private final long timeoutMillis;
    private final ModuleCache cache = new ModuleCache();
    private final Map<String, Pending> pending = new HashMap<>();
    private int requestsSent = 0;

    public ModuleBridge(ExecutionContext ctx, MessageChannel channel, long timeoutMillis) {
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeoutMillis must be positive");
        this.ctx = ctx;
        this.channel = channel;
        this.timeoutMillis = timeoutMillis;
        ctx.setModuleLoader(new CacheLoader());
    }

    public ModuleCache cache() { return cache; }
    public long timeoutMillis() { return timeoutMillis; }

    /** Number of module-request messages posted so far. */
    public int requestsSent() { return requestsSent; }

    public boolean isPending(String canonicalPath) {
        return pending.containsKey(canonicalPath);
    }

    /**
     * Resolves {@code specifier} against {@code importerPath} (null for the
     * document root) and loads the module.
     */
    public CompletableFuture<FluxoModule> require(String specifier, String importerPath) {
        return ctx.scheduler().submit(() -> {
            String canonical;
            try {
                canonical = ctx.resolver().resolve(specifier, importerPath);
            } catch (FluxoError e) {
                return CompletableFuture.failedFuture(e);
            }
            return load(canonical, List.of());
        });
    }

    /** Loads a module by canonical path. */
    public CompletableFuture<FluxoModule> load(String canonicalPath) {
        return ctx.scheduler().submit(() -> load(canonicalPath, List.of()));
    }

    private CompletableFuture<FluxoModule> load(String path, List<String> ancestors) {
        if (ancestors.contains(path)) {
            return CompletableFuture.failedFuture(cycle(ancestors, path));
        }
        ModuleCache.Entry cached = cache.get(path);
        if (cached != null && cached.executed()) {
            return CompletableFuture.completedFuture(cached.module());
        }
        Pending p = pending.get(path);
        if (p != null) {
            if (!ancestors.isEmpty() && waitsOn(path, ancestors)) {
                return CompletableFuture.failedFuture(cycle(ancestors, path));
            }
            Debug.get().t(TAG, "joining pending request for " + path);
            return p.future;
        }

        Pending fresh = new Pending();
        fresh.linkAncestors = append(ancestors, path);
        pending.put(path, fresh);
        fresh.timer = ctx.scheduler().schedule(timeoutMillis, () -> onTimeout(path, fresh));
        requestsSent++;
        Debug.get().d(TAG, "module-request " + path);
        channel.post(ModuleMessage.request(path));
        return fresh.future;
    }

    // ===================== HOST MESSAGES =====================

    /** Handles a module-response or module-error from the host. Other types are ignored. */
    public void onMessage(ModuleMessage message) {
        switch (message.type()) {
            case MODULE_RESPONSE:
                onResponse(message.path(), message.code());
                break;
            case MODULE_ERROR:
                onError(message.path(), message.error());
                break;
            default:
                Debug.get().d(TAG, "ignoring " + message.type().wireName() + " message");
        }
    }

    void onResponse(String path, String code) {
        Pending p = pending.get(path);
        if (p == null || p.phase != Phase.AWAITING) {
            Debug.get().d(TAG, "ignoring late or unknown module-response for " + path);
            return;
        }
        p.timer.cancel();
        p.phase = Phase.LINKING;

        Program program;
        List<String> deps = new ArrayList<>();
        try {
            String source = FileKind.isHtml(path) ? HtmlSource.extractProgram(code) : code;
            program = Program.parse(path, source);
            for (String spec : DependencyCollector.collect(program)) {
                String canonical = ctx.resolver().resolve(spec, path);
                if (!deps.contains(canonical)) deps.add(canonical);
            }
        } catch (FluxoError e) {
            fail(path, p, e);
            return;
        }
        p.dependencies.addAll(deps);
        Program linked = program;

        List<CompletableFuture<FluxoModule>> loads = new ArrayList<>();
        for (String dep : deps) {
            loads.add(load(dep, p.linkAncestors));
        }
        CompletableFuture.allOf(loads.toArray(new CompletableFuture[0])).whenComplete((ignored, err) -> {
            if (err != null) {
                fail(path, p, unwrap(err));
            } else {
                evaluate(path, p, linked);
            }
        });
    }

    void onError(String path, String error) {
        Pending p = pending.get(path);
        if (p == null || p.phase != Phase.AWAITING) {
            Debug.get().d(TAG, "ignoring late or unknown module-error for " + path);
            return;
        }
        p.timer.cancel();
        String message = (error == null || error.isBlank()) ? "Module not found: " + path : error;
        fail(path, p, new ModuleNotFoundError(path, message));
    }

    private void onTimeout(String path, Pending p) {
        if (pending.get(path) != p || p.phase != Phase.AWAITING) return;
        Debug.get().w(TAG, "no response for " + path + " within " + timeoutMillis + " ms");
        fail(path, p, new ModuleLoadTimeoutError(path, timeoutMillis));
    }

    // ===================== EVALUATION =====================

    private void evaluate(String path, Pending p, Program program) {
        FluxoModule module;
        try {
            module = new Interpreter(ctx, path).run(program);
        } catch (FluxoError e) {
            fail(path, p, e);
            return;
        }
        cache.put(path, module);
        pending.remove(path);
        Debug.get().d(TAG, "loaded " + path + " exports=" + module.exports().keySet());
        p.future.complete(module);
    }

    private void fail(String path, Pending p, Throwable error) {
        if (pending.get(path) == p) pending.remove(path);
        Throwable cause = (error instanceof FluxoError) ? ((FluxoError) error).attachFile(path) : error;
        Debug.get().d(TAG, "failed " + path + ": " + cause.getMessage());
        p.future.completeExceptionally(cause);
    }

    // ===================== CYCLES =====================

    /** True when {@code path} (pending) transitively waits on one of {@code ancestors}. */
    private boolean waitsOn(String path, List<String> ancestors) {
        Set<String> seen = new HashSet<>();
        Deque<String> todo = new ArrayDeque<>();
        todo.add(path);
        while (!todo.isEmpty()) {
            String cur = todo.poll();
            if (!seen.add(cur)) continue;
            Pending p = pending.get(cur);
            if (p == null) continue;
            for (String d : p.dependencies) {
                if (ancestors.contains(d)) return true;
                todo.add(d);
            }
        }
        return false;
    }

    private static CyclicImportError cycle(List<String> ancestors, String path) {
        List<String> chain = new ArrayList<>(ancestors.subList(Math.max(0, ancestors.indexOf(path)), ancestors.size()));
        chain.add(path);
        return new CyclicImportError(chain);
    }

    private static List<String> append(List<String> list, String item) {
        List<String> out = new ArrayList<>(list);
        out.add(item);
        return List.copyOf(out);
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) t = t.getCause();
        return t;
    }

    /** Import expressions inside fetched modules read the cache; linking put their targets there. */
    private final class CacheLoader implements ModuleLoader {
        @Override
        public FluxoModule load(String canonicalPath, ExecutionContext context) {
            ModuleCache.Entry e = cache.get(canonicalPath);
            if (e != null && e.executed()) return e.module();
            if (context.isInitializing(canonicalPath)) throw context.cycleTo(canonicalPath);
            throw new ModuleNotFoundError(canonicalPath,
                    "Module not found: " + canonicalPath + " (not loaded; computed import paths must name a module that is already loaded)");
        }
    }
}
