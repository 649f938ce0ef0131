package com.fluxo.script;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** {@code {files: [{path, code}], entryPoint}} */
public final class ExecuteRequest {
    private final List<SourceFile> files;
    private final String entryPoint;

    @JsonCreator
    public ExecuteRequest(@JsonProperty("files") List<SourceFile> files,
                          @JsonProperty("entryPoint") String entryPoint) {
        this.files = (files == null) ? List.of() : List.copyOf(files);
        this.entryPoint = entryPoint;
    }

    @JsonProperty("files") public List<SourceFile> files() { return files; }
    @JsonProperty("entryPoint") public String entryPoint() { return entryPoint; }
}
