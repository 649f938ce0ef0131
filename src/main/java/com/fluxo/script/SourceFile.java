package com.fluxo.script;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One file of an execute request, as sent by the caller. */
public final class SourceFile {
    private final String path;
    private final String code;

    @JsonCreator
    public SourceFile(@JsonProperty("path") String path, @JsonProperty("code") String code) {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("file path is required");
        this.path = path;
        this.code = (code == null) ? "" : code;
    }

    @JsonProperty("path") public String path() { return path; }
    @JsonProperty("code") public String code() { return code; }
}
