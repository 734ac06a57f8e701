package com.tenda.script.runtime;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A runtime datum. Scalars (number, boolean, text, nil, range) are immutable;
 * lists and maps are mutable containers shared by reference, so every holder of
 * the same {@code Value} sees the same elements.
 */
public final class Value {
    public enum Type {
        NUMBER("número"),
        BOOL("lógico"),
        STRING("texto"),
        LIST("lista"),
        MAP("dicionário"),
        RANGE("intervalo"),
        FUNCTION("função"),
        NATIVE("função"),
        NIL("Nada");

        public final String displayName;

        Type(String displayName) {
            this.displayName = displayName;
        }
    }

    public static final String TRUE_LITERAL = "verdadeiro";
    public static final String FALSE_LITERAL = "falso";
    public static final String NIL_LITERAL = "Nada";
    public static final String POSITIVE_INFINITY_LITERAL = "infinito";
    public static final String NEGATIVE_INFINITY_LITERAL = "-infinito";
    public static final String CYCLIC_LIST = "[...]";
    public static final String CYCLIC_MAP = "{...}";
    public static final String NAN_LITERAL = "NaN";

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    /** Inclusive integer interval {@code start até end}; empty when start > end. */
    public static final class Range implements Iterable<Value> {
        public final long start;
        public final long end;

        public Range(long start, long end) {
            this.start = start;
            this.end = end;
        }

        public long size() {
            return (end < start) ? 0 : end - start + 1;
        }

        @Override
        public Iterator<Value> iterator() {
            return new Iterator<Value>() {
                long next = start;

                @Override public boolean hasNext() { return next <= end; }
                @Override public Value next() { return Value.number(next++); }
            };
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Range)) return false;
            Range r = (Range) o;
            return start == r.start && end == r.end;
        }

        @Override
        public int hashCode() {
            return Objects.hash(start, end);
        }
    }

    // -------------------------
    // Factories
    // -------------------------

    public static Value nil() { return NIL; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s, "s")); }

    /** Wraps the given list without copying; later changes to it are visible through the value. */
    public static Value list(List<Value> l) { return new Value(Type.LIST, Objects.requireNonNull(l, "l")); }
    public static Value listOf(Value... items) { return list(new ArrayList<>(Arrays.asList(items))); }

    /** Wraps the given map without copying. */
    public static Value map(Map<AssociativeKey, Value> m) { return new Value(Type.MAP, Objects.requireNonNull(m, "m")); }
    public static Value emptyMap() { return map(new LinkedHashMap<>()); }

    public static Value range(long start, long end) { return new Value(Type.RANGE, new Range(start, end)); }
    public static Value function(Function f) { return new Value(Type.FUNCTION, f); }
    public static Value nativeFunction(NativeFunction f) { return new Value(Type.NATIVE, f); }

    /** Literal payloads from the syntax tree: null, Boolean, Double or String. */
    public static Value fromLiteral(Object literal) {
        if (literal == null) return NIL;
        if (literal instanceof Boolean) return bool((Boolean) literal);
        if (literal instanceof Number) return number(((Number) literal).doubleValue());
        if (literal instanceof String) return string((String) literal);
        throw new IllegalArgumentException("Unsupported literal: " + literal.getClass().getName());
    }

    // -------------------------
    // Accessors
    // -------------------------

    public Type getType() { return type; }

    public String typeName() { return type.displayName; }

    public boolean isNil() { return type == Type.NIL; }

    public boolean isCallable() { return type == Type.FUNCTION || type == Type.NATIVE; }

    public boolean isIterable() { return type == Type.LIST || type == Type.RANGE; }

    private Value expect(Type t) {
        if (type != t) throw new RuntimeError(Diagnostic.unexpectedType("conversão", t, this));
        return this;
    }

    public double asNumber() {
        return (double) expect(Type.NUMBER).value;
    }

    public boolean asBool() {
        return (boolean) expect(Type.BOOL).value;
    }

    public String asString() {
        return (String) expect(Type.STRING).value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        return (List<Value>) expect(Type.LIST).value;
    }

    @SuppressWarnings("unchecked")
    public Map<AssociativeKey, Value> asMap() {
        return (Map<AssociativeKey, Value>) expect(Type.MAP).value;
    }

    public Range asRange() {
        return (Range) expect(Type.RANGE).value;
    }

    public Callable asCallable() {
        if (!isCallable()) throw new RuntimeError(Diagnostic.unexpectedType("chamada", Type.FUNCTION, this));
        return (Callable) value;
    }

    /** Nada, falso and 0 are false. */
    public boolean isTruthy() {
        switch (type) {
            case NIL:
                return false;
            case BOOL:
                return (boolean) value;
            case NUMBER:
                return (double) value != 0.0;
            default:
                return true;
        }
    }

    // -------------------------
    // Display
    // -------------------------

    /** How {@code exiba} and text concatenation show the value: text unquoted. */
    public String display() {
        return (type == Type.STRING) ? (String) value : repr();
    }

    /** Like {@link #display()} but text is quoted, as inside list and map displays. */
    public String repr() {
        return repr(Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /** {@code open} holds the containers being rendered; one met again prints as [...] or {...}. */
    private String repr(Set<Object> open) {
        switch (type) {
            case NUMBER:
                return formatNumber((double) value);
            case BOOL:
                return (boolean) value ? TRUE_LITERAL : FALSE_LITERAL;
            case STRING:
                return '"' + escape((String) value) + '"';
            case LIST: {
                List<Value> items = asList();
                if (!open.add(items)) return CYCLIC_LIST;
                StringBuilder sb = new StringBuilder("[");
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(items.get(i).repr(open));
                }
                open.remove(items);
                return sb.append(']').toString();
            }
            case MAP: {
                Map<AssociativeKey, Value> m = asMap();
                if (m.isEmpty()) return "{}";
                if (!open.add(m)) return CYCLIC_MAP;
                StringBuilder sb = new StringBuilder("{ ");
                boolean first = true;
                for (Map.Entry<AssociativeKey, Value> e : m.entrySet()) {
                    if (!first) sb.append(", ");
                    sb.append(e.getKey()).append(": ").append(e.getValue().repr(open));
                    first = false;
                }
                open.remove(m);
                return sb.append(" }").toString();
            }
            case RANGE: {
                Range r = asRange();
                return r.start + " até " + r.end;
            }
            case FUNCTION:
            case NATIVE: {
                String name = ((Callable) value).name();
                return "<função " + (name == null ? TraceEntry.ANONYMOUS : name) + ">";
            }
            case NIL:
            default:
                return NIL_LITERAL;
        }
    }

    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return NAN_LITERAL;
        if (Double.isInfinite(d)) return d > 0 ? POSITIVE_INFINITY_LITERAL : NEGATIVE_INFINITY_LITERAL;
        if (d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\r': sb.append("\\r"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    // -------------------------
    // Equality
    // -------------------------

    /**
     * Language equality ({@code ==}): numeric comparison for numbers (NaN is never
     * equal), structural for lists, maps and ranges, identity for functions.
     * Values of different types are never equal.
     */
    public static boolean equal(Value a, Value b) {
        if (a.type != b.type) return false;
        switch (a.type) {
            case NIL:
                return true;
            case NUMBER:
                return (double) a.value == (double) b.value;
            case LIST: {
                List<Value> l = a.asList();
                List<Value> r = b.asList();
                if (l == r) return true;
                if (l.size() != r.size()) return false;
                for (int i = 0; i < l.size(); i++) {
                    if (!equal(l.get(i), r.get(i))) return false;
                }
                return true;
            }
            case MAP: {
                Map<AssociativeKey, Value> l = a.asMap();
                Map<AssociativeKey, Value> r = b.asMap();
                if (l == r) return true;
                if (l.size() != r.size()) return false;
                for (Map.Entry<AssociativeKey, Value> e : l.entrySet()) {
                    Value other = r.get(e.getKey());
                    if (other == null || !equal(e.getValue(), other)) return false;
                }
                return true;
            }
            case FUNCTION:
            case NATIVE:
                return a.value == b.value;
            default:
                return a.value.equals(b.value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return (o instanceof Value) && equal(this, (Value) o);
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NIL:
                return 0;
            case NUMBER: {
                double d = (double) value;
                // 0 and -0 are equal
                return Double.hashCode(d == 0.0 ? 0.0 : d);
            }
            case FUNCTION:
            case NATIVE:
                return System.identityHashCode(value);
            case LIST:
            case MAP:
                // contents are mutable
                return type.hashCode();
            default:
                return value.hashCode();
        }
    }

    @Override
    public String toString() {
        return repr();
    }
}
