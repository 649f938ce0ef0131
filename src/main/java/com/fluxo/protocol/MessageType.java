package com.fluxo.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Wire names of the cross-boundary module protocol. */
public enum MessageType {
    MODULE_REQUEST("module-request"),
    MODULE_RESPONSE("module-response"),
    MODULE_ERROR("module-error"),
    EXECUTE("execute");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static MessageType fromWire(String s) {
        for (MessageType t : values()) {
            if (t.wireName.equals(s)) return t;
        }
        throw new IllegalArgumentException("Unknown message type: " + s);
    }
}
