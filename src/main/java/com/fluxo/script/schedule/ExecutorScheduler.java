package com.fluxo.script.schedule;

import com.fluxo.debug.Debug;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** Wall-clock scheduler backed by one daemon thread. */
public final class ExecutorScheduler implements Scheduler, AutoCloseable {

    private static final String TAG = "ExecutorScheduler";

    private final ScheduledExecutorService executor;
    private volatile Thread worker;

    public ExecutorScheduler(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            worker = t;
            return t;
        });
    }

    @Override
    public boolean inSchedulerThread() {
        return Thread.currentThread() == worker;
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    @Override
    public Cancellable schedule(long delayMillis, Runnable task) {
        ScheduledFuture<?> f = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                Debug.get().e(TAG, "scheduled task failed", e);
            }
        }, Math.max(0L, delayMillis), TimeUnit.MILLISECONDS);
        return () -> f.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
