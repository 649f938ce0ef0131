import com.fluxo.protocol.MessageType;
import com.fluxo.protocol.ModuleMessage;
import com.fluxo.protocol.ModuleMessageCodec;
import com.fluxo.protocol.SandboxRuntime;
import com.fluxo.script.FluxoScript;
import com.fluxo.script.parser.FluxoModule;
import com.fluxo.script.schedule.Cancellable;
import com.fluxo.script.schedule.ExecutorScheduler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
public class ExecutorSchedulerTest {

    @Test
    public void tasksRunOnTheSchedulerThread_inDeadlineOrder() throws Exception {
        try (ExecutorScheduler s = new ExecutorScheduler("fluxo-test")) {
            List<String> ran = new CopyOnWriteArrayList<>();
            CountDownLatch done = new CountDownLatch(2);
            s.schedule(80, () -> { ran.add("late:" + Thread.currentThread().getName()); done.countDown(); });
            s.execute(() -> { ran.add("now:" + Thread.currentThread().getName()); done.countDown(); });

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("now:fluxo-test", "late:fluxo-test"), ran);
        }
    }

    @Test
    public void cancelledTaskNeverRuns() throws Exception {
        try (ExecutorScheduler s = new ExecutorScheduler("fluxo-test")) {
            List<String> ran = new CopyOnWriteArrayList<>();
            Cancellable c = s.schedule(50, () -> ran.add("cancelled"));
            assertTrue(c.cancel());
            CountDownLatch after = new CountDownLatch(1);
            s.schedule(150, after::countDown);

            assertTrue(after.await(5, TimeUnit.SECONDS));
            assertTrue(ran.isEmpty());
        }
    }

    @Test
    public void failingTaskDoesNotStopTheQueue() throws Exception {
        try (ExecutorScheduler s = new ExecutorScheduler("fluxo-test")) {
            CountDownLatch next = new CountDownLatch(1);
            s.execute(() -> { throw new IllegalStateException("boom"); });
            s.execute(next::countDown);

            assertTrue(next.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    public void liveSession_hostAnswersFromItsOwnThread() throws Exception {
        ModuleMessageCodec codec = new ModuleMessageCodec();
        SandboxRuntime[] session = new SandboxRuntime[1];

        try (ExecutorScheduler s = new ExecutorScheduler("fluxo-session")) {
            session[0] = new SandboxRuntime(new FluxoScript(), s, msg -> {
                if (msg.type() != MessageType.MODULE_REQUEST) return;
                new Thread(() -> session[0].onMessage(codec.encode(ModuleMessage.response(msg.path(),
                        "module math { export function sq(x) { return x * x } }")))).start();
            }, 2000);

            CompletableFuture<FluxoModule> loaded = new CompletableFuture<>();
            s.execute(() -> session[0].bridge().require("/lib/math", null).whenComplete((m, err) -> {
                if (err != null) loaded.completeExceptionally(err);
                else loaded.complete(m);
            }));

            FluxoModule math = loaded.get(5, TimeUnit.SECONDS);
            assertEquals("/lib/math.fxm", math.path());
            assertTrue(math.exports().containsKey("sq"));
        }
    }

    @Test
    public void hostThreadCalls_runOnTheSessionThread() throws Exception {
        ModuleMessageCodec codec = new ModuleMessageCodec();
        SandboxRuntime[] session = new SandboxRuntime[1];
        List<String> postingThreads = new CopyOnWriteArrayList<>();

        try (ExecutorScheduler s = new ExecutorScheduler("fluxo-session")) {
            assertFalse(s.inSchedulerThread());
            session[0] = new SandboxRuntime(new FluxoScript(), s, msg -> {
                postingThreads.add(Thread.currentThread().getName());
                if (msg.type() != MessageType.MODULE_REQUEST) return;
                new Thread(() -> session[0].onMessage(codec.encode(ModuleMessage.response(msg.path(),
                        "module " + msg.path().substring(1, 2) + " { console.log(\"" + msg.path() + "\") }")))).start();
            }, 2000);

            List<FluxoModule> loaded = session[0].loadEntries(List.of("/a", "/b", "/c")).get(5, TimeUnit.SECONDS);
            session[0].executeInline("console.log(\"inline\")").get(5, TimeUnit.SECONDS);

            assertEquals(3, loaded.size());
            assertEquals(List.of("fluxo-session", "fluxo-session", "fluxo-session"), postingThreads);
            assertEquals(4, session[0].events().size());
            assertEquals("inline", session[0].events().events().get(3).message());
        }
    }
}
