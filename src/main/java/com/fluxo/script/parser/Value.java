package com.fluxo.script.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fluxo.script.errors.FluxoTypeError;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Tagged Fluxo runtime value.
 *
 * Numbers are doubles. Arrays and objects are mutable and shared by reference.
 */
public class Value {
    public enum Type { NUMBER, BOOL, STRING, NULL, UNDEFINED, FUNC, ARRAY, MAP, MODULE }

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Value NIL = new Value(Type.NULL, null);
    private static final Value UNDEFINED = new Value(Type.UNDEFINED, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s == null ? "" : s); }
    public static Value func(FluxoCallable f) { return new Value(Type.FUNC, f); }
    public static Value array(List<Value> a) { return new Value(Type.ARRAY, a); }
    public static Value map(Map<String, Value> m) { return new Value(Type.MAP, m); }
    public static Value module(FluxoModule m) { return new Value(Type.MODULE, m); }
    public static Value nil() { return NIL; }
    public static Value undefined() { return UNDEFINED; }

    public static Value newArray() { return array(new ArrayList<>()); }
    public static Value newMap() { return map(new LinkedHashMap<>()); }

    public Type getType() { return type; }

    public boolean isNullish() { return type == Type.NULL || type == Type.UNDEFINED; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new FluxoTypeError("Expected number, got " + typeName());
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new FluxoTypeError("Expected boolean, got " + typeName());
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new FluxoTypeError("Expected string, got " + typeName());
        return (String) value;
    }

    public FluxoCallable asFunc() {
        if (type != Type.FUNC) throw new FluxoTypeError("Expected function, got " + typeName());
        return (FluxoCallable) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw new FluxoTypeError("Expected array, got " + typeName());
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asMap() {
        if (type != Type.MAP) throw new FluxoTypeError("Expected object, got " + typeName());
        return (Map<String, Value>) value;
    }

    public FluxoModule asModule() {
        if (type != Type.MODULE) throw new FluxoTypeError("Expected module, got " + typeName());
        return (FluxoModule) value;
    }

    /** Name used in error messages. */
    public String typeName() {
        switch (type) {
            case NUMBER: return "number";
            case BOOL: return "boolean";
            case STRING: return "string";
            case NULL: return "null";
            case UNDEFINED: return "undefined";
            case FUNC: return "function";
            case ARRAY: return "array";
            case MAP: return "object";
            default: return "module";
        }
    }

    // ===================== CONVERSIONS =====================

    public boolean isTruthy() {
        switch (type) {
            case NULL:
            case UNDEFINED:
                return false;
            case BOOL:
                return (boolean) value;
            case NUMBER: {
                double d = (double) value;
                return d != 0.0 && !Double.isNaN(d);
            }
            case STRING:
                return !((String) value).isEmpty();
            default:
                return true;
        }
    }

    /**
     * Number coercion for arithmetic and mixed comparisons. Only primitives
     * coerce; anything else is a TypeError.
     */
    private static final Pattern NUMERIC_TEXT =
            Pattern.compile("[+-]?(Infinity|(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?)");
    private static final Pattern HEX_TEXT = Pattern.compile("0[xX][0-9a-fA-F]+");

    public double toNumber() {
        switch (type) {
            case NUMBER: return (double) value;
            case BOOL: return ((boolean) value) ? 1.0 : 0.0;
            case NULL: return 0.0;
            case UNDEFINED: return Double.NaN;
            case STRING: {
                String s = ((String) value).trim();
                if (s.isEmpty()) return 0.0;
                if (HEX_TEXT.matcher(s).matches()) return new BigInteger(s.substring(2), 16).doubleValue();
                if (!NUMERIC_TEXT.matcher(s).matches()) return Double.NaN;
                return Double.parseDouble(s);
            }
            default:
                throw new FluxoTypeError("Cannot convert " + typeName() + " to number");
        }
    }

    public boolean isPrimitive() {
        switch (type) {
            case NUMBER:
            case BOOL:
            case STRING:
            case NULL:
            case UNDEFINED:
                return true;
            default:
                return false;
        }
    }

    /** Textual form used by '+' concatenation and console output. */
    public String toDisplayString() {
        switch (type) {
            case STRING: return (String) value;
            case NUMBER: return formatNumber((double) value);
            case BOOL: return Boolean.toString((boolean) value);
            case NULL: return "null";
            case UNDEFINED: return "undefined";
            case FUNC: return "[function " + asFunc().name() + "]";
            case MODULE: return "[module " + asModule().name() + "]";
            default:
                try {
                    return JSON.writeValueAsString(toJson());
                } catch (JsonProcessingException e) {
                    throw new FluxoTypeError("Cannot render " + typeName() + ": " + e.getOriginalMessage());
                }
        }
    }

    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
        if (d == 0.0) return "0";
        double abs = Math.abs(d);
        if (abs >= 1e-6 && abs < 1e21) {
            return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
        }
        // 1.0E-7 -> 1e-7, 1.5E21 -> 1.5e+21
        String s = Double.toString(d);
        int e = s.indexOf('E');
        String mantissa = s.substring(0, e);
        String exp = s.substring(e + 1);
        if (mantissa.endsWith(".0")) mantissa = mantissa.substring(0, mantissa.length() - 2);
        return mantissa + "e" + (exp.startsWith("-") ? exp : "+" + exp);
    }

    /** JSON tree for arrays/objects; functions and undefined become null, cycles "[Circular]". */
    public JsonNode toJson() {
        return toJson(this, new IdentityHashMap<>());
    }

    private static JsonNode toJson(Value v, IdentityHashMap<Object, Boolean> seen) {
        switch (v.type) {
            case NUMBER: {
                double d = (double) v.value;
                if (Double.isNaN(d) || Double.isInfinite(d)) return NODES.nullNode();
                if (d == Math.rint(d) && Math.abs(d) < 9.007199254740992E15) return NODES.numberNode((long) d);
                return NODES.numberNode(d);
            }
            case STRING: return NODES.textNode((String) v.value);
            case BOOL: return NODES.booleanNode((boolean) v.value);
            case ARRAY: {
                if (seen.put(v.value, Boolean.TRUE) != null) return NODES.textNode("[Circular]");
                ArrayNode arr = NODES.arrayNode();
                for (Value item : v.asArray()) arr.add(toJson(item, seen));
                seen.remove(v.value);
                return arr;
            }
            case MAP: {
                if (seen.put(v.value, Boolean.TRUE) != null) return NODES.textNode("[Circular]");
                ObjectNode obj = NODES.objectNode();
                for (Map.Entry<String, Value> e : v.asMap().entrySet()) {
                    Value ev = e.getValue();
                    if (ev.type == Type.FUNC || ev.type == Type.UNDEFINED) continue;
                    obj.set(e.getKey(), toJson(ev, seen));
                }
                seen.remove(v.value);
                return obj;
            }
            case MODULE: {
                ObjectNode obj = NODES.objectNode();
                for (Map.Entry<String, Value> e : v.asModule().exports().entrySet()) {
                    Value ev = e.getValue();
                    if (ev.type == Type.FUNC || ev.type == Type.UNDEFINED) continue;
                    obj.set(e.getKey(), toJson(ev, seen));
                }
                return obj;
            }
            default:
                return NODES.nullNode();
        }
    }

    /** Converts parsed JSON (e.g. host input) into a Fluxo value. */
    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return nil();
        if (node.isNumber()) return number(node.asDouble());
        if (node.isTextual()) return string(node.asText());
        if (node.isBoolean()) return bool(node.asBoolean());
        if (node.isArray()) {
            List<Value> out = new ArrayList<>(node.size());
            for (JsonNode n : node) out.add(fromJson(n));
            return array(out);
        }
        Map<String, Value> out = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> out.put(e.getKey(), fromJson(e.getValue())));
        return map(out);
    }

    // ===================== EQUALITY =====================

    /**
     * Fluxo '=='. No cross-type coercion except null == undefined; reference
     * types compare by identity.
     */
    public static boolean looseEquals(Value a, Value b) {
        if (a.isNullish() && b.isNullish()) return true;
        if (a.type != b.type) return false;
        switch (a.type) {
            case NUMBER: return (double) a.value == (double) b.value;
            case STRING:
            case BOOL:
                return a.value.equals(b.value);
            default:
                return a.value == b.value;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.NUMBER || type == Type.STRING || type == Type.BOOL) return value.equals(other.value);
        return value == other.value;
    }

    @Override
    public int hashCode() {
        if (type == Type.NUMBER || type == Type.STRING || type == Type.BOOL) return value.hashCode();
        return System.identityHashCode(value) * 31 + type.hashCode();
    }

    @Override
    public String toString() {
        return (type == Type.STRING) ? '"' + (String) value + '"' : toDisplayString();
    }
}
