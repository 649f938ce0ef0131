package com.fluxo.script.resolve;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FileKind {
    MODULE,
    SCRIPT;

    public static final String MODULE_EXTENSION = ".fxm";
    public static final String SCRIPT_EXTENSION = ".fxo";

    /** {@code .fxm} files are modules; everything else runs as a script. */
    public static FileKind fromPath(String path) {
        String p = (path == null) ? "" : path.toLowerCase(Locale.ROOT);
        return p.endsWith(MODULE_EXTENSION) ? MODULE : SCRIPT;
    }

    public static boolean isHtml(String path) {
        String p = (path == null) ? "" : path.toLowerCase(Locale.ROOT);
        return p.endsWith(".html") || p.endsWith(".htm");
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
