package com.fluxo.script.output;

import com.fluxo.debug.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only event log in emission order, with optional listeners that see
 * each event as it is appended (terminal streaming, RPC forwarding).
 */
public final class EventLog implements OutputSink {

    private static final String TAG = "EventLog";

    private final List<OutputEvent> events = Collections.synchronizedList(new ArrayList<>());
    private final List<OutputSink> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void emit(OutputEvent event) {
        if (event == null) return;
        events.add(event);
        for (OutputSink l : listeners) {
            try {
                l.emit(event);
            } catch (RuntimeException e) {
                // a broken listener must not stop evaluation
                Debug.get().e(TAG, "listener failed on event " + event.id(), e);
            }
        }
    }

    public void addListener(OutputSink listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(OutputSink listener) {
        listeners.remove(listener);
    }

    /** Snapshot of the events emitted so far. */
    public List<OutputEvent> events() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public int size() {
        return events.size();
    }
}
