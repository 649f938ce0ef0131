package com.fluxo.protocol;

import com.fluxo.debug.Debug;
import com.fluxo.script.FluxoConfig;
import com.fluxo.script.FluxoScript;
import com.fluxo.script.errors.FluxoError;
import com.fluxo.script.output.EventLog;
import com.fluxo.script.parser.DependencyCollector;
import com.fluxo.script.parser.ExecutionContext;
import com.fluxo.script.parser.FluxoModule;
import com.fluxo.script.parser.Interpreter;
import com.fluxo.script.parser.Program;
import com.fluxo.script.schedule.Scheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * One sandboxed session: the runtime side of the host/runtime boundary.
 *
 * Owns the session's context, module bridge and event log. Host messages
 * arrive as JSON through {@link #onMessage(String)} and are handled on the
 * session scheduler, which also runs {@code wait} bodies, so no two Fluxo
 * statements of the session ever run at the same time.
 */
public final class SandboxRuntime {

    private static final String TAG = "SandboxRuntime";

    /** Attribution for inline code, which has no canonical path. */
    public static final String INLINE_PATH = "<inline>";

    private final EventLog events = new EventLog();
    private final Scheduler scheduler;
    private final ExecutionContext ctx;
    private final ModuleBridge bridge;
    private final MessageChannel toHost;
    private final ModuleMessageCodec codec = new ModuleMessageCodec();

    public SandboxRuntime(FluxoScript engine, Scheduler scheduler, MessageChannel toHost) {
        this(engine, scheduler, toHost, FluxoConfig.DEFAULT_MODULE_TIMEOUT_MILLIS);
    }

    public SandboxRuntime(FluxoScript engine, Scheduler scheduler, MessageChannel toHost, long moduleTimeoutMillis) {
        this.scheduler = scheduler;
        this.toHost = toHost;
        this.ctx = engine.newRun(events, scheduler);
        this.bridge = new ModuleBridge(ctx, toHost, moduleTimeoutMillis);
    }

    public EventLog events() { return events; }
    public ModuleBridge bridge() { return bridge; }
    public ExecutionContext context() { return ctx; }

    // ===================== HOST MESSAGES =====================

    /** Entry point for raw host messages. Malformed ones are dropped with a warning. */
    public void onMessage(String json) {
        ModuleMessage message;
        try {
            message = codec.decode(json);
        } catch (MalformedMessageException e) {
            Debug.get().w(TAG, "dropping malformed message: " + e.getMessage());
            return;
        }
        scheduler.execute(() -> dispatch(message));
    }

    private void dispatch(ModuleMessage message) {
        switch (message.type()) {
            case EXECUTE:
                executeInline(message.code());
                break;
            case MODULE_RESPONSE:
            case MODULE_ERROR:
                bridge.onMessage(message);
                break;
            default:
                Debug.get().d(TAG, "ignoring " + message.type().wireName() + " from host");
        }
    }

    // ===================== ENTRIES =====================

    /**
     * Loads entry modules one after another. Each failure becomes an error
     * event plus a module-error diagnostic to the host; the next entry still
     * loads. The returned future never completes exceptionally.
     */
    public CompletableFuture<List<FluxoModule>> loadEntries(List<String> paths) {
        return scheduler.submit(() -> loadSequentially(paths));
    }

    private CompletableFuture<List<FluxoModule>> loadSequentially(List<String> paths) {
        List<FluxoModule> loaded = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String p : paths) {
            chain = chain.thenCompose(ignored -> loadEntry(p).thenAccept(m -> {
                if (m != null) loaded.add(m);
            }));
        }
        return chain.thenApply(ignored -> loaded);
    }

    private CompletableFuture<FluxoModule> loadEntry(String specifier) {
        return bridge.require(specifier, null).handle((module, err) -> {
            if (err == null) {
                Debug.get().i(TAG, "✓ Loaded: " + module.path());
                return module;
            }
            reportLoadFailure(specifier, asFluxoError(err));
            return null;
        });
    }

    /** Error event plus a module-error diagnostic to the host. */
    private void reportLoadFailure(String specifier, FluxoError e) {
        Debug.get().w(TAG, "✗ Failed to load: " + specifier + " - " + e.getMessage());
        ctx.reportError(e);
        String path = (e.sourceFile() != null) ? e.sourceFile() : specifier;
        toHost.post(ModuleMessage.error(path, e.describe()));
    }

    // ===================== INLINE CODE =====================

    /**
     * Runs code that is not a module. Literal imports are loaded first; the
     * code itself is never cached. Errors become error events; a failed
     * import is also reported to the host as a module-error.
     */
    public CompletableFuture<Void> executeInline(String code) {
        return scheduler.submit(() -> runInline(code));
    }

    private CompletableFuture<Void> runInline(String code) {
        Program program;
        try {
            program = Program.parse(INLINE_PATH, code);
        } catch (FluxoError e) {
            ctx.reportError(e);
            return CompletableFuture.completedFuture(null);
        }
        List<String> specifiers = DependencyCollector.collect(program);
        List<CompletableFuture<FluxoModule>> deps = new ArrayList<>();
        for (String spec : specifiers) {
            deps.add(bridge.require(spec, INLINE_PATH));
        }
        return CompletableFuture.allOf(deps.toArray(new CompletableFuture[0])).handle((ignored, err) -> {
            if (err != null) {
                FluxoError e = asFluxoError(err);
                String failed = (e.sourceFile() != null) ? e.sourceFile() : String.join(", ", specifiers);
                reportLoadFailure(failed, e.attachFile(INLINE_PATH));
                return null;
            }
            try {
                new Interpreter(ctx, INLINE_PATH).runDetached(program);
            } catch (FluxoError e) {
                ctx.reportError(e);
            }
            return null;
        });
    }

    private static FluxoError asFluxoError(Throwable err) {
        Throwable t = err;
        while (t instanceof CompletionException && t.getCause() != null) t = t.getCause();
        if (t instanceof FluxoError) return (FluxoError) t;
        return new FluxoError("InternalError", String.valueOf(t.getMessage()), t);
    }
}
