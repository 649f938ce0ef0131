package com.fluxo.script.parser;

import com.fluxo.script.errors.FluxoTypeError;

/**
 * Binary operator semantics.
 *
 * <ul>
 *   <li>{@code +}: string concatenation when either side is a string, else numeric addition.</li>
 *   <li>{@code - * / %}: numeric, with primitive number coercion.</li>
 *   <li>{@code < <= > >=}: two strings compare lexicographically, other primitive
 *       pairs compare as numbers; any NaN makes the result false.</li>
 *   <li>{@code == !=}: see {@link Value#looseEquals(Value, Value)}.</li>
 * </ul>
 * Arrays, objects, functions and modules are rejected by arithmetic and
 * ordering with a TypeError.
 */
final class Operators {

    private Operators() {}

    static Value binary(TokenType op, Value left, Value right) {
        switch (op) {
            case PLUS:
                if (left.getType() == Value.Type.STRING || right.getType() == Value.Type.STRING) {
                    return Value.string(left.toDisplayString() + right.toDisplayString());
                }
                requirePrimitive("+", left, right);
                return Value.number(left.toNumber() + right.toNumber());
            case MINUS:
                requirePrimitive("-", left, right);
                return Value.number(left.toNumber() - right.toNumber());
            case STAR:
                requirePrimitive("*", left, right);
                return Value.number(left.toNumber() * right.toNumber());
            case SLASH:
                requirePrimitive("/", left, right);
                return Value.number(left.toNumber() / right.toNumber());
            case PERCENT:
                requirePrimitive("%", left, right);
                return Value.number(left.toNumber() % right.toNumber());
            case EQUAL_EQUAL:
                return Value.bool(Value.looseEquals(left, right));
            case BANG_EQUAL:
                return Value.bool(!Value.looseEquals(left, right));
            case LESS:
            case LESS_EQUAL:
            case GREATER:
            case GREATER_EQUAL:
                return Value.bool(compare(op, left, right));
            default:
                throw new FluxoTypeError("Unsupported binary operator: " + op);
        }
    }

    private static boolean compare(TokenType op, Value left, Value right) {
        if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
            int c = left.asString().compareTo(right.asString());
            switch (op) {
                case LESS: return c < 0;
                case LESS_EQUAL: return c <= 0;
                case GREATER: return c > 0;
                default: return c >= 0;
            }
        }
        requirePrimitive(symbol(op), left, right);
        double a = left.toNumber();
        double b = right.toNumber();
        switch (op) {
            case LESS: return a < b;
            case LESS_EQUAL: return a <= b;
            case GREATER: return a > b;
            default: return a >= b;
        }
    }

    private static void requirePrimitive(String op, Value left, Value right) {
        if (!left.isPrimitive() || !right.isPrimitive()) {
            throw new FluxoTypeError("Operator '" + op + "' cannot be applied to "
                    + left.typeName() + " and " + right.typeName());
        }
    }

    private static String symbol(TokenType op) {
        switch (op) {
            case LESS: return "<";
            case LESS_EQUAL: return "<=";
            case GREATER: return ">";
            default: return ">=";
        }
    }
}
