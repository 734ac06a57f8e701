package com.tenda.script.prelude;

import java.util.ArrayList;
import java.util.List;

import com.tenda.script.runtime.Callable;
import com.tenda.script.runtime.CallContext;
import com.tenda.script.runtime.Diagnostic;
import com.tenda.script.runtime.RuntimeError;
import com.tenda.script.runtime.Value;

/** Argument helpers shared by the prelude plugins. Arity is already checked by the caller. */
final class Args {

    private Args() {}

    static Value arg(List<Value> args, int idx) {
        return (idx < args.size()) ? args.get(idx) : Value.nil();
    }

    static double num(String fn, List<Value> args, int idx) {
        return expect(fn, args, idx, Value.Type.NUMBER).asNumber();
    }

    static String text(String fn, List<Value> args, int idx) {
        return expect(fn, args, idx, Value.Type.STRING).asString();
    }

    static List<Value> list(String fn, List<Value> args, int idx) {
        return expect(fn, args, idx, Value.Type.LIST).asList();
    }

    static Value function(String fn, List<Value> args, int idx) {
        Value v = arg(args, idx);
        if (!v.isCallable()) {
            throw new RuntimeError(Diagnostic.unexpectedType(fn, Value.Type.FUNCTION, v));
        }
        return v;
    }

    /** A non-negative integral number. */
    static int index(String fn, List<Value> args, int idx) {
        double d = num(fn, args, idx);
        if (!Double.isFinite(d) || d != Math.rint(d) || d < 0 || d > Integer.MAX_VALUE) {
            throw new RuntimeError(Diagnostic.invalidIndex(d));
        }
        return (int) d;
    }

    private static Value expect(String fn, List<Value> args, int idx, Value.Type type) {
        Value v = arg(args, idx);
        if (v.type != type) {
            throw new RuntimeError(Diagnostic.unexpectedType(fn, type, v));
        }
        return v;
    }

    /**
     * Calls a script callback with as many of {@code values} as it declares,
     * so {@code para_cada(xs, função(x) ... fim)} works without the index.
     */
    static Value callback(CallContext ctx, Value fn, Value... values) {
        Callable c = fn.asCallable();
        int n = c.isVariadic() ? values.length : Math.min(values.length, c.declaredArity());
        List<Value> passed = new ArrayList<>(n);
        for (int i = 0; i < n; i++) passed.add(values[i]);
        return ctx.call(fn, passed);
    }
}
