package com.panini.script.parser;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runtime value. Instances are immutable (lists included), so handing the same
 * instance to another context behaves like a copy.
 */
public final class Value {
    public enum Type { NUMBER, BOOL, STRING, LIST, NULL }

    private static final Value NIL = new Value(Type.NULL, null);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s)); }
    public static Value nil() { return NIL; }

    public static Value list(List<Value> items) {
        return new Value(Type.LIST, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public boolean isNumber() { return type == Type.NUMBER; }
    public boolean isString() { return type == Type.STRING; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw new IllegalStateException("Expected list, got " + type);
        return (List<Value>) value;
    }

    /** Display form used by print and by string concatenation. */
    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return formatNumber(asNumber());
            case BOOL:
                return asBool() ? Keywords.TRUE : Keywords.FALSE;
            case STRING:
                return asString();
            case LIST: {
                StringBuilder sb = new StringBuilder("[");
                List<Value> items = asList();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(items.get(i));
                }
                return sb.append(']').toString();
            }
            default:
                return "null";
        }
    }

    /**
     * Shortest decimal that reads back as the same double, without exponent
     * and without a trailing ".0" for integral values: 5.0 prints as "5",
     * 0.1 as "0.1", 2.82879384806159E17 as "282879384806159000".
     */
    static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return (1.0 / d < 0) ? "-0" : "0";
        BigDecimal exact = new BigDecimal(d);
        for (int digits = 1; digits < 17; digits++) {
            BigDecimal rounded = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
            if (rounded.doubleValue() == d) return rounded.stripTrailingZeros().toPlainString();
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }
}
