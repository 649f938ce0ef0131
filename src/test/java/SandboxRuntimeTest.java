import com.fluxo.protocol.MessageChannel;
import com.fluxo.protocol.MessageType;
import com.fluxo.protocol.ModuleBridge;
import com.fluxo.protocol.ModuleMessage;
import com.fluxo.protocol.ModuleMessageCodec;
import com.fluxo.protocol.SandboxRuntime;
import com.fluxo.script.FluxoScript;
import com.fluxo.script.errors.CyclicImportError;
import com.fluxo.script.errors.FluxoReferenceError;
import com.fluxo.script.errors.ModuleLoadTimeoutError;
import com.fluxo.script.errors.ModuleNotFoundError;
import com.fluxo.script.output.OutputEvent;
import com.fluxo.script.output.OutputKind;
import com.fluxo.script.parser.FluxoModule;
import com.fluxo.script.schedule.VirtualScheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

public class SandboxRuntimeTest {

    private static final long TIMEOUT = 5000;

    private final List<ModuleMessage> sent = new ArrayList<>();
    private final ModuleMessageCodec codec = new ModuleMessageCodec();
    private VirtualScheduler clock;
    private SandboxRuntime runtime;
    private ModuleBridge bridge;

    @BeforeEach
    void setUp() {
        clock = new VirtualScheduler(0);
        MessageChannel toHost = sent::add;
        runtime = new SandboxRuntime(new FluxoScript(), clock, toHost, TIMEOUT);
        bridge = runtime.bridge();
    }

    private void hostResponds(String path, String code) {
        runtime.onMessage(codec.encode(ModuleMessage.response(path, code)));
        clock.runDue();
    }

    private void hostFails(String path, String error) {
        runtime.onMessage(codec.encode(ModuleMessage.error(path, error)));
        clock.runDue();
    }

    private List<String> requestedPaths() {
        List<String> out = new ArrayList<>();
        for (ModuleMessage m : sent) {
            if (m.type() == MessageType.MODULE_REQUEST) out.add(m.path());
        }
        return out;
    }

    private List<String> messages() {
        List<String> out = new ArrayList<>();
        for (OutputEvent e : runtime.events().events()) out.add(e.message());
        return out;
    }

    private static Throwable failureOf(CompletableFuture<?> f) {
        CompletionException ce = assertThrows(CompletionException.class, f::join);
        return ce.getCause();
    }

    @Test
    void concurrentReferences_shareOneRequest() {
        CompletableFuture<FluxoModule> f1 = bridge.require("/lib/math", null);
        CompletableFuture<FluxoModule> f2 = bridge.require("lib/./math.fxm", null);
        CompletableFuture<FluxoModule> f3 = bridge.require("/lib/../lib/math", null);

        assertEquals(1, bridge.requestsSent());
        assertEquals(List.of("/lib/math.fxm"), requestedPaths());
        assertFalse(f1.isDone());

        hostResponds("/lib/math.fxm", "module math { export function sq(x) { return x * x } }");

        assertSame(f1.join(), f2.join());
        assertSame(f1.join(), f3.join());
        assertTrue(bridge.cache().isLoaded("/lib/math.fxm"));
    }

    @Test
    void cachedModule_isNotRequestedAgain() {
        bridge.require("/a", null);
        hostResponds("/a.fxm", "module a { }");

        CompletableFuture<FluxoModule> again = bridge.require("/a.fxm", null);
        assertTrue(again.isDone());
        assertEquals(1, bridge.requestsSent());
    }

    @Test
    void timeout_firesExactlyAtTheConfiguredWindow() {
        CompletableFuture<FluxoModule> f = bridge.require("/slow", null);

        clock.advanceBy(TIMEOUT - 1);
        assertFalse(f.isDone());
        assertTrue(bridge.isPending("/slow.fxm"));

        clock.advanceBy(2);
        assertTrue(f.isCompletedExceptionally());
        Throwable cause = failureOf(f);
        assertTrue(cause instanceof ModuleLoadTimeoutError);
        assertEquals("Module load timeout: /slow.fxm (5000 ms)", cause.getMessage());
        assertFalse(bridge.isPending("/slow.fxm"));
    }

    @Test
    void lateResponse_isIgnored_andALaterReferenceRetries() {
        CompletableFuture<FluxoModule> f = bridge.require("/slow", null);
        clock.advanceBy(TIMEOUT);
        assertTrue(f.isCompletedExceptionally());

        hostResponds("/slow.fxm", "module slow { console.log(\"should not run\") }");
        assertFalse(bridge.cache().isLoaded("/slow.fxm"));
        assertTrue(messages().isEmpty());

        CompletableFuture<FluxoModule> retry = bridge.require("/slow", null);
        assertEquals(2, bridge.requestsSent());
        hostResponds("/slow.fxm", "module slow { console.log(\"loaded\") }");
        assertEquals("slow", retry.join().name());
        assertEquals(List.of("loaded"), messages());
    }

    @Test
    void errorResponse_rejectsWithModuleNotFound() {
        CompletableFuture<FluxoModule> f = bridge.require("/gone", null);
        hostFails("/gone.fxm", "Module not found: /gone.fxm");

        Throwable cause = failureOf(f);
        assertTrue(cause instanceof ModuleNotFoundError);
        assertEquals("Module not found: /gone.fxm", cause.getMessage());
        assertFalse(bridge.isPending("/gone.fxm"));
    }

    @Test
    void responseForUnknownPath_isIgnored() {
        hostResponds("/never-asked.fxm", "module x { }");
        assertEquals(0, bridge.cache().size());
    }

    @Test
    void dependencies_areFetchedBeforeTheModuleRuns() {
        CompletableFuture<FluxoModule> app = bridge.require("/app", null);
        hostResponds("/app.fxm", String.join("\n",
                "module app {",
                "  import from \"./lib/util\" { twice }",
                "  console.log(twice(21))",
                "}"));

        assertFalse(app.isDone());
        assertEquals(List.of("/app.fxm", "/lib/util.fxm"), requestedPaths());

        hostResponds("/lib/util.fxm", "module util { export function twice(x) { return x * 2 } }");
        assertTrue(app.isDone());
        assertEquals(List.of("42"), messages());
        assertEquals("/app.fxm", runtime.events().events().get(0).sourceFile());
    }

    @Test
    void sharedDependency_isRequestedOnce() {
        bridge.require("/a", null);
        bridge.require("/b", null);
        hostResponds("/a.fxm", "module a { import(\"/shared\") }");
        hostResponds("/b.fxm", "module b { import(\"/shared\") }");

        assertEquals(List.of("/a.fxm", "/b.fxm", "/shared.fxm"), requestedPaths());
    }

    @Test
    void mutualCycle_rejectsWithCyclicImportError() {
        CompletableFuture<FluxoModule> a = bridge.require("/a", null);
        hostResponds("/a.fxm", "module a { import from \"/b\" { y } }");
        hostResponds("/b.fxm", "module b { import from \"/a\" { x } }");

        Throwable cause = failureOf(a);
        assertTrue(cause instanceof CyclicImportError);
        assertEquals(List.of("/a.fxm", "/b.fxm", "/a.fxm"), ((CyclicImportError) cause).chain());
        assertEquals(2, bridge.requestsSent());
        assertFalse(bridge.isPending("/a.fxm"));
        assertFalse(bridge.isPending("/b.fxm"));
    }

    @Test
    void selfImport_rejectsWithCyclicImportError() {
        CompletableFuture<FluxoModule> a = bridge.require("/a", null);
        hostResponds("/a.fxm", "module a { import(\"./a.fxm\") }");

        assertTrue(failureOf(a) instanceof CyclicImportError);
        assertEquals(1, bridge.requestsSent());
    }

    @Test
    void failingDependency_rejectsEveryDependent() {
        CompletableFuture<FluxoModule> app = bridge.require("/app", null);
        hostResponds("/app.fxm", "module app { import(\"/dep\") }");
        hostFails("/dep.fxm", "Module not found: /dep.fxm");

        assertTrue(failureOf(app) instanceof ModuleNotFoundError);
        assertEquals(0, bridge.cache().size());
    }

    @Test
    void evaluationError_rejectsAndIsNotCached() {
        CompletableFuture<FluxoModule> f = bridge.require("/bad", null);
        hostResponds("/bad.fxm", "module bad { missing() }");

        assertTrue(failureOf(f) instanceof FluxoReferenceError);
        assertFalse(bridge.cache().isLoaded("/bad.fxm"));
    }

    @Test
    void inlineCode_runsImmediately_withoutCaching() {
        runtime.onMessage(codec.encode(ModuleMessage.execute("console.log(1 + 1)")));
        clock.runDue();

        assertEquals(List.of("2"), messages());
        assertEquals(SandboxRuntime.INLINE_PATH, runtime.events().events().get(0).sourceFile());
        assertEquals(0, bridge.requestsSent());
        assertEquals(0, bridge.cache().size());
    }

    @Test
    void inlineCode_waitsForItsImports() {
        runtime.executeInline("import from \"/greet\" { hello }\nconsole.log(hello(\"sam\"))");
        assertTrue(messages().isEmpty());

        hostResponds("/greet.fxm", "module greet { export function hello(n) { return \"hello \" + n } }");
        assertEquals(List.of("hello sam"), messages());
    }

    @Test
    void loadEntries_reportsFailuresAndKeepsGoing() {
        CompletableFuture<List<FluxoModule>> done = runtime.loadEntries(List.of("/missing", "/ok"));

        assertEquals(List.of("/missing.fxm"), requestedPaths());
        hostFails("/missing.fxm", "Module not found: /missing.fxm");
        assertEquals(List.of("/missing.fxm", "/ok.fxm"), requestedPaths());
        hostResponds("/ok.fxm", "module ok { console.log(\"ok ready\") }");

        assertTrue(done.isDone());
        assertEquals(1, done.join().size());

        OutputEvent err = runtime.events().events().get(0);
        assertEquals(OutputKind.ERROR, err.kind());
        assertEquals("ModuleNotFoundError: Module not found: /missing.fxm", err.message());
        assertEquals("/missing.fxm", err.sourceFile());
        assertEquals("ok ready", runtime.events().events().get(1).message());

        ModuleMessage diagnostic = sent.get(1);
        assertEquals(MessageType.MODULE_ERROR, diagnostic.type());
        assertEquals("/missing.fxm", diagnostic.path());
    }

    @Test
    void waitBodies_runOnTheSessionClock() {
        bridge.require("/timer", null);
        hostResponds("/timer.fxm", "module timer { wait(1.5) { console.log(\"tick\") }\nconsole.log(\"armed\") }");

        assertEquals(List.of("armed"), messages());
        clock.advanceBy(1499);
        assertEquals(List.of("armed"), messages());
        clock.advanceBy(1);
        assertEquals(List.of("armed", "tick"), messages());
    }

    @Test
    void malformedMessages_areDropped() {
        runtime.onMessage("{not json");
        runtime.onMessage("{\"type\":\"module-response\"}");
        runtime.onMessage("{\"type\":\"teleport\",\"path\":\"/x\"}");
        clock.runDue();

        assertTrue(messages().isEmpty());
        assertEquals(0, bridge.requestsSent());
    }

    @Test
    void requireInsideFetchedFunction_usesTheModuleDirectory() {
        bridge.require("/lib/a", null);
        hostResponds("/lib/a.fxm", String.join("\n",
                "module a {",
                "  export function greet() {",
                "    local h = require(\"helper\")",
                "    return h.word()",
                "  }",
                "}"));
        assertEquals(List.of("/lib/a.fxm", "/lib/helper.fxm"), requestedPaths());
        hostResponds("/lib/helper.fxm", "module helper { export function word() { return \"hi\" } }");

        runtime.executeInline("import from \"/lib/a\" { greet }\nconsole.log(greet())");
        clock.runDue();

        assertEquals(List.of("hi"), messages());
        assertEquals(2, bridge.requestsSent());
    }

    @Test
    void inlineImportFailure_isReportedToTheHost() {
        runtime.executeInline("import from \"/nope\" { x }\nconsole.log(x)");
        hostFails("/nope.fxm", "Module not found: /nope.fxm");

        assertEquals(1, runtime.events().size());
        assertEquals(OutputKind.ERROR, runtime.events().events().get(0).kind());

        ModuleMessage last = sent.get(sent.size() - 1);
        assertEquals(MessageType.MODULE_ERROR, last.type());
        assertEquals("/nope.fxm", last.path());
        assertTrue(last.error().contains("ModuleNotFoundError"), last.error());
    }
}
