package com.fluxo.script.output;

/** Receives events as they are emitted. Implementations must return promptly. */
public interface OutputSink {
    void emit(OutputEvent event);
}
