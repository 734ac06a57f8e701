package com.tenda.script.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A built-in function implemented in Java. Called exactly like a closure: the
 * arity is checked first, then a CALL frame holding the arguments is pushed
 * around {@link Body#call}.
 */
public final class NativeFunction implements Callable {

    /** Functional interface for built-in function bodies. */
    @FunctionalInterface
    public interface Body {
        Value call(CallContext ctx, List<Value> args);
    }

    private final String name;
    private final List<String> params;
    private final int required;
    private final boolean variadic;
    private final Body body;

    /**
     * @param params   parameter names; with {@code variadic} the last one collects the rest
     * @param required how many of the leading parameters must be supplied
     */
    public NativeFunction(String name, List<String> params, int required, boolean variadic, Body body) {
        if (name == null || body == null) throw new IllegalArgumentException("name and body are required");
        int declared = variadic ? params.size() - 1 : params.size();
        if (required < 0 || required > declared) {
            throw new IllegalArgumentException("Invalid required count for " + name + ": " + required);
        }
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.required = required;
        this.variadic = variadic;
        this.body = body;
    }

    /** Fixed arity: every parameter is required. */
    public static NativeFunction of(String name, Body body, String... params) {
        return new NativeFunction(name, Arrays.asList(params), params.length, false, body);
    }

    /** The last parameter collects any remaining arguments; the ones before it are required. */
    public static NativeFunction variadic(String name, Body body, String... params) {
        return new NativeFunction(name, Arrays.asList(params), params.length - 1, true, body);
    }

    public List<String> params() {
        return params;
    }

    public Value invoke(CallContext ctx, List<Value> args) {
        Value v = body.call(ctx, args);
        return (v == null) ? Value.nil() : v;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int requiredArity() {
        return required;
    }

    @Override
    public int declaredArity() {
        return variadic ? params.size() - 1 : params.size();
    }

    @Override
    public boolean isVariadic() {
        return variadic;
    }

    @Override
    public String toString() {
        return "NativeFunction(" + name + ")";
    }
}
