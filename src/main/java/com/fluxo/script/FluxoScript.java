package com.fluxo.script;

import com.fluxo.script.errors.FluxoError;
import com.fluxo.script.output.OutputEvent;
import com.fluxo.script.output.OutputSink;
import com.fluxo.script.parser.ExecutionContext;
import com.fluxo.script.parser.NativeFunction;
import com.fluxo.script.parser.RunOptions;
import com.fluxo.script.parser.Value;
import com.fluxo.script.resolve.SourceUnit;
import com.fluxo.script.schedule.Scheduler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluxo engine.
 *
 * - JavaScript-like syntax: local / function / if / else / while / for /
 *   module / export / import / require / wait
 * - Types: number (double), string, boolean, null, undefined, array, object,
 *   function, module
 * - Output: console.log / info / warn / error / success become OutputEvents
 * - Built-ins: host functions registered via registerFunction
 * - Mode:
 *     - STRICT (default): assigning to an undeclared name is a ReferenceError
 *     - COMPAT: such an assignment creates a global, like legacy Fluxo
 */
public class FluxoScript {

    /** Handling of assignments to names no scope declares. Default STRICT. */
    public enum Mode {
        STRICT,
        COMPAT
    }

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private Mode mode = Mode.STRICT;
    private int maxCallDepth = RunOptions.DEFAULT_MAX_CALL_DEPTH;
    private int maxLoopIterations = RunOptions.DEFAULT_MAX_LOOP_ITERATIONS;
    private int maxDeferredTasks = RunOptions.DEFAULT_MAX_DEFERRED_TASKS;
    private boolean elementStub = true;

    public void setMode(Mode mode) { this.mode = (mode == null) ? Mode.STRICT : mode; }
    public Mode getMode() { return mode; }

    public void setMaxCallDepth(int depth) { this.maxCallDepth = depth; }
    public int getMaxCallDepth() { return maxCallDepth; }

    public void setMaxLoopIterations(int max) { this.maxLoopIterations = max; }
    public int getMaxLoopIterations() { return maxLoopIterations; }

    public void setMaxDeferredTasks(int max) { this.maxDeferredTasks = max; }
    public int getMaxDeferredTasks() { return maxDeferredTasks; }

    /** Whether runs get the server-side {@code selectElement} stub. Hosts with a real document turn it off. */
    public void setElementStub(boolean enabled) { this.elementStub = enabled; }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public RunOptions runOptions() {
        return new RunOptions(
                mode == Mode.COMPAT ? RunOptions.UndeclaredAssignment.CREATE_GLOBAL : RunOptions.UndeclaredAssignment.REJECT,
                maxCallDepth, maxLoopIterations, maxDeferredTasks);
    }

    /** Allocates the context for one run, with console and host built-ins bound as globals. */
    public ExecutionContext newRun(OutputSink sink, Scheduler scheduler) {
        ExecutionContext ctx = ExecutionContext.newRun(sink, scheduler, runOptions());
        CoreBuiltins.installConsole(ctx);
        if (elementStub) CoreBuiltins.installElementStub(ctx);
        for (Map.Entry<String, BuiltinFunction> e : functions.entrySet()) {
            BuiltinFunction fn = e.getValue();
            String name = e.getKey();
            ctx.globals().define(name, Value.func(new NativeFunction(name, (in, args, site) -> {
                try {
                    return fn.call(args);
                } catch (FluxoError fe) {
                    throw fe;
                } catch (RuntimeException re) {
                    throw new FluxoError("HostError", name + "() failed: " + re.getMessage(), re);
                }
            })));
        }
        return ctx;
    }

    // ===================== BATCH ENTRY POINTS =====================

    /**
     * Runs a workspace: module files first, then scripts, each kind in the
     * given order. {@code entryPoint} is recorded for diagnostics only.
     */
    public ExecuteResult execute(List<SourceFile> files, String entryPoint) {
        return new BatchEvaluator(this).execute(files, entryPoint);
    }

    public ExecuteResult execute(ExecuteRequest request) {
        return execute(request.files(), request.entryPoint());
    }

    /** Runs every module and script the provider lists for {@code workspaceId}. */
    public ExecuteResult execute(SourceProvider provider, String workspaceId, String entryPoint) {
        List<SourceFile> files = new ArrayList<>();
        for (SourceUnit u : provider.listModulesAndScripts(workspaceId)) {
            files.add(new SourceFile(u.path(), u.text()));
        }
        return execute(files, entryPoint);
    }

    /** Runs a single script saved as {@code /main.fxo} and returns its events. */
    public List<OutputEvent> run(String source) {
        return execute(List.of(new SourceFile("/main.fxo", source)), "/main.fxo").events();
    }
}
