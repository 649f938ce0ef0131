import com.fluxo.debug.Debug;
import com.fluxo.debug.DebugSink;
import com.fluxo.protocol.ModuleMessage;
import com.fluxo.protocol.SandboxRuntime;
import com.fluxo.script.FluxoScript;
import com.fluxo.script.output.OutputEvent;
import com.fluxo.script.schedule.VirtualScheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    private DebugSink saved;

    @AfterEach
    void restoreSink() {
        if (saved != null) Debug.get().setSink(saved);
    }

    @Test
    public void freshHub_hasANoOpSink() throws Exception {
        // Load the hub in its own class loader so its static state starts clean.
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        try (URLClassLoader isolated = new URLClassLoader(new URL[]{classes}, ClassLoader.getPlatformClassLoader())) {
            Class<?> hub = isolated.loadClass("com.fluxo.debug.Debug");
            assertNotSame(Debug.class, hub);

            Object instance = hub.getMethod("get").invoke(null);
            assertNotNull(hub.getMethod("getSink").invoke(instance));
            assertDoesNotThrow(() -> hub.getMethod("w", String.class, String.class).invoke(instance, "Test", "no sink yet"));
        }
    }

    @Test
    public void nullSink_fallsBackToNoOp() {
        saved = Debug.get().getSink();
        Debug.get().setSink(null);

        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().e("Test", "dropped", new IllegalStateException("x")));
    }

    @Test
    public void engineRuns_withoutAnyDebugSink() {
        saved = Debug.get().getSink();
        Debug.get().setSink(null);

        List<OutputEvent> events = new FluxoScript().run("console.log(2 + 3)");
        assertEquals(1, events.size());
        assertEquals("5", events.get(0).message());

        List<ModuleMessage> sent = new ArrayList<>();
        VirtualScheduler clock = new VirtualScheduler(0);
        SandboxRuntime runtime = new SandboxRuntime(new FluxoScript(), clock, sent::add, 1000);
        runtime.bridge().require("/quiet", null);
        clock.advanceBy(1000);

        assertEquals(1, sent.size());
        assertFalse(runtime.bridge().isPending("/quiet.fxm"));
    }
}
