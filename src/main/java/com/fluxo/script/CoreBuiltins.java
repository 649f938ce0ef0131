package com.fluxo.script;

import com.fluxo.script.output.OutputKind;
import com.fluxo.script.parser.ExecutionContext;
import com.fluxo.script.parser.Interpreter;
import com.fluxo.script.parser.NativeFunction;
import com.fluxo.script.parser.Token;
import com.fluxo.script.parser.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Globals every run starts with: {@code console}, plus the server-side element stub. */
final class CoreBuiltins {

    static final String[] ELEMENT_EVENTS = { "onClick", "onChange", "onHover", "onFocus", "onBlur" };

    private CoreBuiltins() {}

    static void installConsole(ExecutionContext ctx) {
        Map<String, Value> console = new LinkedHashMap<>();
        console.put("log", consoleMethod("log", OutputKind.LOG));
        console.put("info", consoleMethod("info", OutputKind.LOG));
        console.put("warn", consoleMethod("warn", OutputKind.WARNING));
        console.put("error", consoleMethod("error", OutputKind.ERROR));
        console.put("success", consoleMethod("success", OutputKind.SUCCESS));
        ctx.globals().define("console", Value.map(console));
    }

    /**
     * {@code selectElement(selector)}: there is no document on the server, so
     * the element only records handler registrations as log events.
     */
    static void installElementStub(ExecutionContext ctx) {
        ctx.globals().define("selectElement", Value.func(new NativeFunction("selectElement", (in, args, site) -> {
            String selector = args.isEmpty() ? "undefined" : args.get(0).toDisplayString();
            Map<String, Value> element = new LinkedHashMap<>();
            element.put("selector", Value.string(selector));
            element.put("text", Value.string(""));
            element.put("value", Value.string(""));
            for (String event : ELEMENT_EVENTS) {
                element.put(event, Value.func(new NativeFunction(event, (in2, handlerArgs, site2) -> {
                    emit(in2, OutputKind.LOG, "Event handler registered for " + selector + ": " + event, site2);
                    return Value.undefined();
                })));
            }
            return Value.map(element);
        })));
    }

    static String joinArgs(List<Value> args) {
        List<String> parts = new ArrayList<>(args.size());
        for (Value v : args) parts.add(v.toDisplayString());
        return String.join(" ", parts);
    }

    private static Value consoleMethod(String name, OutputKind kind) {
        return Value.func(new NativeFunction("console." + name, (in, args, site) -> {
            emit(in, kind, joinArgs(args), site);
            return Value.undefined();
        }));
    }

    private static void emit(Interpreter in, OutputKind kind, String message, Token site) {
        Integer line = (site == null) ? null : site.line;
        Integer column = (site == null) ? null : site.column;
        in.context().emit(kind, message, line, column);
    }
}
