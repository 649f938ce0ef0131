package com.fluxo.script.resolve;

import java.util.Objects;

/** One file of a run: canonical path, raw text, kind. Immutable. */
public final class SourceUnit {
    private final String path;
    private final String text;
    private final FileKind kind;

    public SourceUnit(String path, String text, FileKind kind) {
        this.path = Objects.requireNonNull(path, "path");
        this.text = (text == null) ? "" : text;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /** Canonicalises {@code path} and infers the kind from its extension. */
    public static SourceUnit of(String path, String text) {
        String canonical = ModuleResolver.normalize(path);
        return new SourceUnit(canonical, text, FileKind.fromPath(canonical));
    }

    public String path() { return path; }
    public String text() { return text; }
    public FileKind kind() { return kind; }

    public boolean isHtml() {
        return FileKind.isHtml(path);
    }

    @Override
    public String toString() {
        return kind.wireName() + " " + path;
    }
}
