package com.fluxo.script;

import com.fluxo.debug.Debug;
import com.fluxo.script.errors.FluxoError;
import com.fluxo.script.output.EventLog;
import com.fluxo.script.output.OutputKind;
import com.fluxo.script.parser.ExecutionContext;
import com.fluxo.script.parser.FluxoModule;
import com.fluxo.script.parser.Interpreter;
import com.fluxo.script.parser.Program;
import com.fluxo.script.resolve.HtmlSource;
import com.fluxo.script.resolve.ModuleResolver;
import com.fluxo.script.resolve.SourceUnit;
import com.fluxo.script.schedule.VirtualScheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * Server-side execution of a whole workspace.
 *
 * Single-threaded and run-to-completion. Files run in resolver order; a
 * failing file becomes an error event and the next file still runs. Deferred
 * {@code wait} bodies are drained afterwards on a virtual clock, in deadline
 * order, so their events land where real timers would put them.
 */
final class BatchEvaluator {

    private static final String TAG = "BatchEvaluator";

    private final FluxoScript engine;
    private final ModuleResolver resolver = new ModuleResolver();

    BatchEvaluator(FluxoScript engine) {
        this.engine = engine;
    }

    ExecuteResult execute(List<SourceFile> files, String entryPoint) {
        List<SourceUnit> order;
        try {
            List<SourceUnit> units = new ArrayList<>();
            for (SourceFile f : (files == null ? List.<SourceFile>of() : files)) {
                units.add(SourceUnit.of(f.path(), f.code()));
            }
            order = resolver.plan(units);
        } catch (IllegalArgumentException e) {
            Debug.get().w(TAG, "rejected execute request: " + e.getMessage());
            return new ExecuteResult(List.of(), e.getMessage());
        }

        EventLog log = new EventLog();
        VirtualScheduler scheduler = new VirtualScheduler();
        ExecutionContext ctx = engine.newRun(log, scheduler);
        WorkspaceModuleLoader loader = new WorkspaceModuleLoader(order, this::evaluate);
        ctx.setModuleLoader(loader);

        Debug.get().i(TAG, "run: " + order.size() + " file(s), entry=" + entryPoint);
        for (SourceUnit unit : order) {
            evaluate(ctx, unit);
        }
        int deferred = scheduler.runUntilIdle();
        Debug.get().d(TAG, "run finished: " + log.size() + " event(s), " + deferred + " deferred block(s)");
        return new ExecuteResult(log.events(), null);
    }

    private void evaluate(ExecutionContext ctx, SourceUnit unit) {
        WorkspaceModuleLoader loader = (WorkspaceModuleLoader) ctx.moduleLoader();
        if (!loader.begin(unit.path())) {
            Debug.get().t(TAG, "skip " + unit.path() + " (already initialised on import)");
            return;
        }

        String code = unit.text();
        if (unit.isHtml()) {
            if (HtmlSource.extractScripts(code).isEmpty()) {
                String prev = ctx.beginFile(unit.path());
                ctx.emit(OutputKind.WARNING, HtmlSource.NO_SCRIPTS_WARNING, null, null);
                ctx.beginFile(prev);
                return;
            }
            code = HtmlSource.extractProgram(code);
        }

        try {
            Program program = Program.parse(unit.path(), code);
            new Interpreter(ctx, unit.path()).run(program);
        } catch (FluxoError e) {
            e.attachFile(unit.path());
            if (ctx.getModule(unit.path()) == null) {
                // failed before evaluation began (syntax); importers must still see a failure
                FluxoModule failed = new FluxoModule(unit.path(), ModuleResolver.stemOf(unit.path()));
                failed.markFailed(e);
                ctx.registerModule(unit.path(), failed);
            }
            Debug.get().d(TAG, unit.path() + " failed: " + e.describe());
            ctx.reportError(e);
        }
    }
}
