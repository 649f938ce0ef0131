package com.fluxo.script;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fluxo.script.output.OutputEvent;
import com.fluxo.script.output.OutputKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one batch run: the ordered event log, plus a request-level
 * error when the run could not start at all. Per-file failures are error
 * events, never this field.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecuteResult {
    private final List<OutputEvent> events;
    private final String error;

    @JsonCreator
    public ExecuteResult(@JsonProperty("events") List<OutputEvent> events,
                         @JsonProperty("error") String error) {
        this.events = (events == null) ? List.of() : List.copyOf(events);
        this.error = error;
    }

    @JsonProperty("events") public List<OutputEvent> events() { return events; }
    @JsonProperty("error") public String error() { return error; }

    public List<String> messages(OutputKind kind) {
        List<String> out = new ArrayList<>();
        for (OutputEvent e : events) {
            if (e.kind() == kind) out.add(e.message());
        }
        return out;
    }

    public boolean hasErrors() {
        if (error != null) return true;
        for (OutputEvent e : events) {
            if (e.kind() == OutputKind.ERROR) return true;
        }
        return false;
    }
}
