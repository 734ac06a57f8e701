package com.tenda.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tenda.script.ast.SourceSpan;

/**
 * Structured runtime failure. Carries no rendered text: the payload holds the
 * offending names and values under stable keys, and formatting is left to
 * whoever reports it ({@link com.tenda.script.json.DiagnosticJson}, a host UI).
 *
 * <p>Payload keys are Portuguese because a non-fatal diagnostic caught by
 * {@code tente} is handed to the program as a map built from them.
 */
public final class Diagnostic {

    public final DiagnosticKind kind;
    private SourceSpan span;
    private final Map<String, Value> payload;
    private final List<TraceEntry> stacktrace = new ArrayList<>();

    public Diagnostic(DiagnosticKind kind, SourceSpan span, Map<String, Value> payload) {
        if (kind == null) throw new IllegalArgumentException("kind");
        this.kind = kind;
        this.span = span;
        this.payload = (payload == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
    }

    private static Diagnostic of(DiagnosticKind kind, Object... keysAndValues) {
        Map<String, Value> p = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            p.put((String) keysAndValues[i], (Value) keysAndValues[i + 1]);
        }
        return new Diagnostic(kind, null, p);
    }

    // -------------------------
    // Factories
    // -------------------------

    /** payload: {@code nome} */
    public static Diagnostic alreadyDeclared(String name) {
        return of(DiagnosticKind.ALREADY_DECLARED, "nome", Value.string(name));
    }

    /** payload: {@code nome} */
    public static Diagnostic undefinedVariable(String name) {
        return of(DiagnosticKind.UNDEFINED_VARIABLE, "nome", Value.string(name));
    }

    /** Binary operator on incompatible operands. payload: {@code operação, primeiro, segundo} (type names) */
    public static Diagnostic typeMismatch(String operation, Value first, Value second) {
        return of(DiagnosticKind.TYPE_MISMATCH,
                "operação", Value.string(operation),
                "primeiro", Value.string(first.typeName()),
                "segundo", Value.string(second.typeName()));
    }

    /** A single value of the wrong type. payload: {@code operação, esperado, encontrado} */
    public static Diagnostic unexpectedType(String operation, Value.Type expected, Value found) {
        return of(DiagnosticKind.TYPE_MISMATCH,
                "operação", Value.string(operation),
                "esperado", Value.string(expected.displayName),
                "encontrado", Value.string(found.typeName()));
    }

    /** payload: {@code esperado, mínimo, encontrado}; {@code esperado} is Nada when variadic */
    public static Diagnostic arityMismatch(int required, int total, boolean variadic, int found) {
        return of(DiagnosticKind.ARITY_MISMATCH,
                "esperado", variadic ? Value.nil() : Value.number(total),
                "mínimo", Value.number(required),
                "encontrado", Value.number(found));
    }

    public static Diagnostic divisionByZero() {
        return of(DiagnosticKind.DIVISION_BY_ZERO);
    }

    /** payload: {@code valor} */
    public static Diagnostic userRaised(Value value) {
        return of(DiagnosticKind.USER_RAISED, "valor", value);
    }

    /** payload: {@code limite} */
    public static Diagnostic stackOverflow(int limit) {
        return of(DiagnosticKind.STACK_OVERFLOW, "limite", Value.number(limit));
    }

    /** payload: {@code índice, tamanho} */
    public static Diagnostic indexOutOfBounds(long index, int length) {
        return of(DiagnosticKind.INDEX_OUT_OF_BOUNDS,
                "índice", Value.number(index),
                "tamanho", Value.number(length));
    }

    /** payload: {@code índice} */
    public static Diagnostic invalidIndex(double index) {
        return of(DiagnosticKind.INVALID_INDEX, "índice", Value.number(index));
    }

    /** payload: {@code limite} */
    public static Diagnostic invalidRangeBounds(double bound) {
        return of(DiagnosticKind.INVALID_RANGE_BOUNDS, "limite", Value.number(bound));
    }

    /** payload: {@code chave} */
    public static Diagnostic invalidMapKey(Value key) {
        return of(DiagnosticKind.INVALID_MAP_KEY, "chave", key);
    }

    /** payload: {@code chave} */
    public static Diagnostic keyNotFound(AssociativeKey key) {
        return of(DiagnosticKind.KEY_NOT_FOUND, "chave", key.toValue());
    }

    /** payload: {@code encontrado} */
    public static Diagnostic notIterable(Value value) {
        return of(DiagnosticKind.NOT_ITERABLE, "encontrado", Value.string(value.typeName()));
    }

    public static Diagnostic immutableString() {
        return of(DiagnosticKind.IMMUTABLE_STRING);
    }

    /** payload: {@code nome} */
    public static Diagnostic reassignBuiltin(String name) {
        return of(DiagnosticKind.REASSIGN_BUILTIN, "nome", Value.string(name));
    }

    /** payload: {@code função, mensagem} */
    public static Diagnostic invalidArgument(String function, String message) {
        return of(DiagnosticKind.INVALID_ARGUMENT,
                "função", Value.string(function),
                "mensagem", Value.string(message));
    }

    /** payload: {@code módulo} */
    public static Diagnostic moduleNotFound(String module) {
        return of(DiagnosticKind.MODULE_NOT_FOUND, "módulo", Value.string(module));
    }

    /** payload: {@code módulo} */
    public static Diagnostic importCycle(String module) {
        return of(DiagnosticKind.IMPORT_CYCLE, "módulo", Value.string(module));
    }

    /** payload: {@code módulo, nome} */
    public static Diagnostic notExported(String module, String name) {
        return of(DiagnosticKind.NOT_EXPORTED,
                "módulo", Value.string(module),
                "nome", Value.string(name));
    }

    // -------------------------
    // Accessors
    // -------------------------

    public SourceSpan span() {
        return span;
    }

    /** The innermost node that knows its position wins. */
    public Diagnostic attachSpanIfMissing(SourceSpan candidate) {
        if (span == null && candidate != null) span = candidate;
        return this;
    }

    public Map<String, Value> payload() {
        return Collections.unmodifiableMap(payload);
    }

    public Value get(String key) {
        Value v = payload.get(key);
        return (v == null) ? Value.nil() : v;
    }

    public List<TraceEntry> stacktrace() {
        return Collections.unmodifiableList(stacktrace);
    }

    void appendTrace(TraceEntry entry) {
        stacktrace.add(entry);
    }

    public boolean isFatal() {
        return kind.fatal;
    }

    /** What {@code tente ... capture erro} binds to {@code erro}. */
    public Value toHandlerValue() {
        if (kind == DiagnosticKind.USER_RAISED) return get("valor");
        Map<AssociativeKey, Value> m = new LinkedHashMap<>();
        m.put(AssociativeKey.of("tipo"), Value.string(kind.code));
        for (Map.Entry<String, Value> e : payload.entrySet()) {
            m.put(AssociativeKey.of(e.getKey()), e.getValue());
        }
        return Value.map(m);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.code);
        if (!payload.isEmpty()) {
            sb.append(' ');
            boolean first = true;
            for (Map.Entry<String, Value> e : payload.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(e.getKey()).append('=').append(e.getValue().repr());
                first = false;
            }
        }
        if (span != null) sb.append(" at ").append(span);
        return sb.toString();
    }
}
