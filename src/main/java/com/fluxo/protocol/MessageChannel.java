package com.fluxo.protocol;

/** Outbound half of the boundary: delivers a message to the host document. */
public interface MessageChannel {
    void post(ModuleMessage message);
}
