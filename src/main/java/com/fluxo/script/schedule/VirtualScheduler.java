package com.fluxo.script.schedule;

import com.fluxo.debug.Debug;

import java.util.PriorityQueue;

/**
 * Deterministic scheduler over a simulated clock.
 *
 * Time moves only when the owner calls {@link #advanceBy(long)} or
 * {@link #runUntilIdle()}. Tasks are ordered by absolute deadline, then by
 * scheduling sequence.
 */
public final class VirtualScheduler implements Scheduler {

    private static final String TAG = "VirtualScheduler";

    private static final class Entry implements Cancellable, Comparable<Entry> {
        final long deadline;
        final long seq;
        final Runnable task;
        boolean cancelled;
        boolean done;

        Entry(long deadline, long seq, Runnable task) {
            this.deadline = deadline;
            this.seq = seq;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            if (cancelled || done) return false;
            cancelled = true;
            return true;
        }

        @Override
        public int compareTo(Entry o) {
            int c = Long.compare(deadline, o.deadline);
            return (c != 0) ? c : Long.compare(seq, o.seq);
        }
    }

    private final PriorityQueue<Entry> queue = new PriorityQueue<>();
    private long now;
    private long nextSeq = 0;

    public VirtualScheduler() {
        this(System.currentTimeMillis());
    }

    public VirtualScheduler(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public long now() {
        return now;
    }

    @Override
    public Cancellable schedule(long delayMillis, Runnable task) {
        if (task == null) throw new IllegalArgumentException("task is required");
        Entry e = new Entry(now + Math.max(0L, delayMillis), nextSeq++, task);
        queue.add(e);
        return e;
    }

    /** Runs every task already due at the current time, including ones they schedule for now. */
    public int runDue() {
        return runThrough(now);
    }

    /** Moves the clock forward, running tasks in deadline order as it passes them. */
    public int advanceBy(long millis) {
        if (millis < 0) throw new IllegalArgumentException("cannot move the clock backwards");
        return runThrough(now + millis);
    }

    /** Runs until the queue is empty, jumping the clock to each deadline. */
    public int runUntilIdle() {
        int ran = 0;
        Entry e;
        while ((e = queue.poll()) != null) {
            if (e.cancelled) continue;
            if (e.deadline > now) now = e.deadline;
            run(e);
            ran++;
        }
        return ran;
    }

    /** Number of tasks still queued and not cancelled. */
    public int pending() {
        int n = 0;
        for (Entry e : queue) if (!e.cancelled) n++;
        return n;
    }

    private int runThrough(long target) {
        int ran = 0;
        while (true) {
            Entry head = queue.peek();
            if (head == null || head.deadline > target) break;
            queue.poll();
            if (head.cancelled) continue;
            if (head.deadline > now) now = head.deadline;
            run(head);
            ran++;
        }
        if (target > now) now = target;
        return ran;
    }

    private void run(Entry e) {
        e.done = true;
        try {
            e.task.run();
        } catch (RuntimeException ex) {
            Debug.get().e(TAG, "scheduled task failed at t=" + now, ex);
        }
    }
}
