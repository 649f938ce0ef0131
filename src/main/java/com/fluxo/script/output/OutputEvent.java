package com.fluxo.script.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * One unit of observable engine output.
 *
 * Attribution fields are null when unknown and are left out of the JSON form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OutputEvent {

    private final String id;
    private final OutputKind kind;
    private final String message;
    private final long timestamp;
    private final String sourceFile;
    private final Integer line;
    private final Integer column;

    @JsonCreator
    public OutputEvent(@JsonProperty("id") String id,
                       @JsonProperty("kind") OutputKind kind,
                       @JsonProperty("message") String message,
                       @JsonProperty("timestamp") long timestamp,
                       @JsonProperty("sourceFile") String sourceFile,
                       @JsonProperty("line") Integer line,
                       @JsonProperty("column") Integer column) {
        this.id = (id == null) ? UUID.randomUUID().toString() : id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = (message == null) ? "" : message;
        this.timestamp = timestamp;
        this.sourceFile = sourceFile;
        this.line = line;
        this.column = column;
    }

    public static OutputEvent of(OutputKind kind, String message, long timestamp, String sourceFile) {
        return new OutputEvent(null, kind, message, timestamp, sourceFile, null, null);
    }

    @JsonProperty("id") public String id() { return id; }
    @JsonProperty("kind") public OutputKind kind() { return kind; }
    @JsonProperty("message") public String message() { return message; }
    @JsonProperty("timestamp") public long timestamp() { return timestamp; }
    @JsonProperty("sourceFile") public String sourceFile() { return sourceFile; }
    @JsonProperty("line") public Integer line() { return line; }
    @JsonProperty("column") public Integer column() { return column; }

    public OutputEvent withPosition(Integer line, Integer column) {
        return new OutputEvent(id, kind, message, timestamp, sourceFile, line, column);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(kind.wireName()).append(']');
        if (sourceFile != null) {
            sb.append(' ').append(sourceFile);
            if (line != null) sb.append(':').append(line);
            if (column != null) sb.append(':').append(column);
        }
        sb.append(' ').append(message);
        return sb.toString();
    }
}
