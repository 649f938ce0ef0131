package com.fluxo.script.parser;

import com.fluxo.script.errors.FluxoTypeError;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Property and index access on runtime values, including the few built-in array and string methods. */
final class Members {

    private Members() {}

    static Value get(Value object, String name) {
        switch (object.getType()) {
            case NULL:
            case UNDEFINED:
                throw new FluxoTypeError("Cannot read property '" + name + "' of " + object.typeName());
            case MAP: {
                Value v = object.asMap().get(name);
                return (v == null) ? Value.undefined() : v;
            }
            case MODULE:
                return object.asModule().get(name);
            case ARRAY:
                return arrayMember(object, name);
            case STRING:
                return stringMember(object.asString(), name);
            default:
                return Value.undefined();
        }
    }

    static Value index(Value target, Value index) {
        switch (target.getType()) {
            case ARRAY: {
                List<Value> list = target.asArray();
                int i = toIndex(index);
                return (i >= 0 && i < list.size()) ? list.get(i) : Value.undefined();
            }
            case STRING: {
                String s = target.asString();
                int i = toIndex(index);
                return (i >= 0 && i < s.length()) ? Value.string(String.valueOf(s.charAt(i))) : Value.undefined();
            }
            case MAP:
            case MODULE:
                return get(target, index.toDisplayString());
            case NULL:
            case UNDEFINED:
                throw new FluxoTypeError("Cannot index " + target.typeName());
            default:
                return Value.undefined();
        }
    }

    static void setIndex(Value target, Value index, Value v) {
        switch (target.getType()) {
            case ARRAY: {
                List<Value> list = target.asArray();
                int i = toIndex(index);
                if (i < 0) throw new FluxoTypeError("Invalid array index: " + index.toDisplayString());
                while (list.size() < i) list.add(Value.undefined());
                if (i == list.size()) list.add(v);
                else list.set(i, v);
                return;
            }
            case MAP:
                target.asMap().put(index.toDisplayString(), v);
                return;
            case MODULE:
                throw new FluxoTypeError("Cannot assign into module '" + target.asModule().name() + "': it is read-only");
            default:
                throw new FluxoTypeError("Cannot index-assign on " + target.typeName());
        }
    }

    /** Integral non-negative index, or -1. */
    private static int toIndex(Value index) {
        if (index.getType() != Value.Type.NUMBER) return -1;
        double d = index.asNumber();
        if (d != Math.floor(d) || d < 0 || d > Integer.MAX_VALUE) return -1;
        return (int) d;
    }

    private static Value arrayMember(Value array, String name) {
        List<Value> list = array.asArray();
        switch (name) {
            case "length":
                return Value.number(list.size());
            case "push":
                return Value.func(new NativeFunction("push", (in, args, site) -> {
                    list.addAll(args);
                    return Value.number(list.size());
                }));
            case "pop":
                return Value.func(new NativeFunction("pop", (in, args, site) ->
                        list.isEmpty() ? Value.undefined() : list.remove(list.size() - 1)));
            case "indexOf":
                return Value.func(new NativeFunction("indexOf", (in, args, site) -> {
                    Value needle = args.isEmpty() ? Value.undefined() : args.get(0);
                    for (int i = 0; i < list.size(); i++) {
                        if (Value.looseEquals(list.get(i), needle)) return Value.number(i);
                    }
                    return Value.number(-1);
                }));
            case "join":
                return Value.func(new NativeFunction("join", (in, args, site) -> {
                    String sep = args.isEmpty() || args.get(0).getType() == Value.Type.UNDEFINED
                            ? "," : args.get(0).toDisplayString();
                    List<String> parts = new ArrayList<>(list.size());
                    for (Value v : list) parts.add(v.isNullish() ? "" : v.toDisplayString());
                    return Value.string(String.join(sep, parts));
                }));
            default:
                return Value.undefined();
        }
    }

    private static Value stringMember(String s, String name) {
        switch (name) {
            case "length":
                return Value.number(s.length());
            case "toUpperCase":
                return Value.func(new NativeFunction("toUpperCase", (in, args, site) -> Value.string(s.toUpperCase(Locale.ROOT))));
            case "toLowerCase":
                return Value.func(new NativeFunction("toLowerCase", (in, args, site) -> Value.string(s.toLowerCase(Locale.ROOT))));
            case "trim":
                return Value.func(new NativeFunction("trim", (in, args, site) -> Value.string(s.trim())));
            case "includes":
                return Value.func(new NativeFunction("includes", (in, args, site) ->
                        Value.bool(!args.isEmpty() && s.contains(args.get(0).toDisplayString()))));
            default:
                return Value.undefined();
        }
    }
}
