package com.fluxo.script.parser;

import com.fluxo.script.errors.CyclicImportError;
import com.fluxo.script.errors.FluxoError;
import com.fluxo.script.errors.FluxoRuntimeError;
import com.fluxo.script.output.OutputEvent;
import com.fluxo.script.output.OutputKind;
import com.fluxo.script.output.OutputSink;
import com.fluxo.script.resolve.ModuleResolver;
import com.fluxo.script.schedule.Cancellable;
import com.fluxo.script.schedule.Scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared state of one run: global bindings, module registry, event sink and
 * timer queue.
 *
 * Every per-file {@link Interpreter} of the run holds the same instance, which
 * is how a script sees the exports of modules evaluated before it. Not thread
 * safe; all access happens on the run's single thread.
 */
public final class ExecutionContext {

    private final Environment globals = new Environment();
    private final Map<String, FluxoModule> modules = new LinkedHashMap<>();
    private final Deque<String> initializing = new ArrayDeque<>();

    private final OutputSink sink;
    private final Scheduler scheduler;
    private final RunOptions options;
    private final ModuleResolver resolver = new ModuleResolver();
    private ModuleLoader moduleLoader;

    private String currentFile;
    private int deferredScheduled = 0;

    private ExecutionContext(OutputSink sink, Scheduler scheduler, RunOptions options) {
        this.sink = sink;
        this.scheduler = scheduler;
        this.options = (options == null) ? RunOptions.defaults() : options;
    }

    public static ExecutionContext newRun(OutputSink sink, Scheduler scheduler, RunOptions options) {
        if (sink == null) throw new IllegalArgumentException("sink is required");
        if (scheduler == null) throw new IllegalArgumentException("scheduler is required");
        return new ExecutionContext(sink, scheduler, options);
    }

    public Environment globals() { return globals; }
    public Scheduler scheduler() { return scheduler; }
    public RunOptions options() { return options; }
    public ModuleResolver resolver() { return resolver; }

    public ModuleLoader moduleLoader() { return moduleLoader; }
    public void setModuleLoader(ModuleLoader loader) { this.moduleLoader = loader; }

    // ===================== ATTRIBUTION =====================

    /** Installs {@code path} as the file events are attributed to; returns the previous one. */
    public String beginFile(String path) {
        String prev = currentFile;
        currentFile = path;
        return prev;
    }

    public String currentFile() {
        return currentFile;
    }

    // ===================== MODULE REGISTRY =====================

    public FluxoModule getModule(String path) {
        return modules.get(path);
    }

    public void registerModule(String path, FluxoModule module) {
        modules.put(path, module);
    }

    public Map<String, FluxoModule> modules() {
        return Collections.unmodifiableMap(modules);
    }

    void pushInitializing(String path) {
        initializing.addLast(path);
    }

    void popInitializing() {
        initializing.pollLast();
    }

    public boolean isInitializing(String path) {
        return initializing.contains(path);
    }

    /** Error describing the import chain from {@code path}'s first initialisation back to itself. */
    public CyclicImportError cycleTo(String path) {
        List<String> chain = new ArrayList<>();
        boolean inCycle = false;
        Iterator<String> it = initializing.iterator();
        while (it.hasNext()) {
            String p = it.next();
            if (p.equals(path)) inCycle = true;
            if (inCycle) chain.add(p);
        }
        chain.add(path);
        return new CyclicImportError(chain);
    }

    // ===================== EVENTS =====================

    /** Appends to the event log; never blocks evaluation. */
    public void emit(OutputEvent event) {
        sink.emit(event);
    }

    public OutputEvent emit(OutputKind kind, String message, Integer line, Integer column) {
        OutputEvent ev = new OutputEvent(null, kind, message, scheduler.now(), currentFile, line, column);
        sink.emit(ev);
        return ev;
    }

    /** Turns an error into an error event attributed to its file (or the current one). */
    public OutputEvent reportError(FluxoError e) {
        String file = (e.sourceFile() != null) ? e.sourceFile() : currentFile;
        OutputEvent ev = new OutputEvent(null, OutputKind.ERROR, e.describe(), scheduler.now(), file, e.line(), e.column());
        sink.emit(ev);
        return ev;
    }

    // ===================== DEFERRED BLOCKS =====================

    /**
     * Queues a deferred block body. It runs with {@code file} as the attributed
     * file, whatever file is current at the time.
     */
    public Cancellable scheduleDeferred(long delayMillis, String file, Runnable body) {
        if (deferredScheduled >= options.maxDeferredTasks()) {
            throw new FluxoRuntimeError("Too many deferred blocks scheduled (max " + options.maxDeferredTasks() + ")");
        }
        deferredScheduled++;
        return scheduler.schedule(delayMillis, () -> {
            String prev = beginFile(file);
            try {
                body.run();
            } finally {
                beginFile(prev);
            }
        });
    }
}
