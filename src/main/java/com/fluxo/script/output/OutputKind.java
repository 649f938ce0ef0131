package com.fluxo.script.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OutputKind {
    LOG,
    WARNING,
    ERROR,
    SUCCESS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OutputKind fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("output kind is required");
        return OutputKind.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
