package com.fluxo.script.schedule;

public interface Cancellable {
    /** @return true if the task was still pending and will now never run */
    boolean cancel();
}
