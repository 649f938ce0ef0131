package com.fluxo.script.parser;

import java.util.List;

/** Host-implemented function exposed to Fluxo code. */
public final class NativeFunction implements FluxoCallable {

    public interface Body {
        Value call(Interpreter interpreter, List<Value> args, Token site);
    }

    private final String name;
    private final Body body;

    public NativeFunction(String name, Body body) {
        this.name = name;
        this.body = body;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args, Token site) {
        Value v = body.call(interpreter, args, site);
        return (v == null) ? Value.undefined() : v;
    }
}
