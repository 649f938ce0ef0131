package com.fluxo.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide diagnostics hub for Fluxo engine components.
 *
 * Operators see these messages; Fluxo programs never do (their output goes
 * through the run's event sink). No sink is installed by default.
 */
public final class Debug {

    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // no sink installed
    };

    // Declared after NOOP, which the instance initializer reads.
    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Routes the hub to SLF4J. Used by the CLI and the RPC server at startup. */
    public static void useSlf4j() {
        INSTANCE.setSink(new Slf4jDebugSink());
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        DebugSink sink = sinkRef.get();
        if (sink != null) sink.log(level, tag, message, error);
    }
}
