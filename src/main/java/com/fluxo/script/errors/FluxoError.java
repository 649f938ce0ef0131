package com.fluxo.script.errors;

/**
 * Base class of every error a Fluxo evaluation can raise.
 *
 * <p>The error is fatal only to its unit of evaluation: one file in a batch
 * run, or one module load in the sandboxed runtime. Location fields are
 * filled in as the error travels outward; the first writer wins.
 */
public class FluxoError extends RuntimeException {

    private final String kind;
    private String sourceFile;
    private Integer line;
    private Integer column;

    public FluxoError(String kind, String message) {
        this(kind, message, null, null, null);
    }

    public FluxoError(String kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FluxoError(String kind, String message, String sourceFile, Integer line, Integer column) {
        super(message);
        this.kind = kind;
        this.sourceFile = sourceFile;
        this.line = line;
        this.column = column;
    }

    public String kind() { return kind; }
    public String sourceFile() { return sourceFile; }
    public Integer line() { return line; }
    public Integer column() { return column; }

    public FluxoError attachFile(String path) {
        if (sourceFile == null) sourceFile = path;
        return this;
    }

    public FluxoError attachPosition(int line, int column) {
        if (this.line == null) {
            this.line = line;
            this.column = column;
        }
        return this;
    }

    /** "Kind: message", the form used for error events. */
    public String describe() {
        return kind + ": " + getMessage();
    }
}
