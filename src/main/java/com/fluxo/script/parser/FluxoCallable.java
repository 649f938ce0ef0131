package com.fluxo.script.parser;

import java.util.List;

/** Anything a Fluxo call expression can invoke. */
public interface FluxoCallable {

    String name();

    /**
     * @param site the call's opening parenthesis, for error positions; may be null
     *             when the host invokes the function (e.g. an event handler)
     */
    Value call(Interpreter interpreter, List<Value> args, Token site);
}
