package com.tenda.script.prelude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.tenda.debug.Debug;
import com.tenda.script.runtime.AssociativeKey;
import com.tenda.script.runtime.Environment;
import com.tenda.script.runtime.NativeFunction;
import com.tenda.script.runtime.Value;
import com.tenda.script.runtime.ValueCell;

/**
 * Prelude
 *
 * The built-in names every program starts with. Filled by the plugin classes
 * before the first run, then frozen: after {@link #freeze()} no name can be
 * added or replaced.
 *
 * Usage:
 *   Prelude p = Prelude.standard();
 *   p.function("dobro", (ctx, args) -> Value.number(args.get(0).asNumber() * 2), "x");
 *   p.freeze();
 *   Stack stack = new Stack(p.toEnvironment());
 */
public final class Prelude {

    private static final String TAG = "Prelude";

    private final Map<String, Value> bindings = new LinkedHashMap<>();
    private boolean frozen = false;

    /** Io, Lista, Matemática and Texto. */
    public static Prelude standard() {
        Prelude p = new Prelude();
        IoPrelude.register(p);
        ListPrelude.register(p);
        MathPrelude.register(p);
        TextPrelude.register(p);
        Debug.get().t(TAG, "standard prelude: " + p.bindings.size() + " names");
        return p;
    }

    public void define(String name, Value value) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("name is required");
        if (value == null) throw new IllegalArgumentException("value is required for " + name);
        if (frozen) throw new IllegalStateException("Prelude is frozen; cannot define " + name);
        if (bindings.containsKey(name)) throw new IllegalArgumentException("Prelude name already defined: " + name);
        bindings.put(name, value);
    }

    /** Fixed-arity native function. */
    public void function(String name, NativeFunction.Body body, String... params) {
        define(name, Value.nativeFunction(NativeFunction.of(name, body, params)));
    }

    public void define(Namespace namespace) {
        define(namespace.name, namespace.toValue());
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean has(String name) {
        return bindings.containsKey(name);
    }

    public Value get(String name) {
        return bindings.get(name);
    }

    public Map<String, Value> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * A fresh base environment holding one owned cell per name. Namespace maps
     * are copied, so a script that adds a member to {@code Lista} only changes
     * its own run.
     */
    public Environment toEnvironment() {
        Environment env = new Environment();
        for (Map.Entry<String, Value> e : bindings.entrySet()) {
            Value v = e.getValue();
            if (v.type == Value.Type.MAP) v = Value.map(new LinkedHashMap<>(v.asMap()));
            env.declare(e.getKey(), ValueCell.owned(v));
        }
        return env;
    }

    public static Namespace namespace(String name) {
        return new Namespace(name);
    }

    /** A dicionário of related built-ins, such as {@code Lista} or {@code Matemática}. */
    public static final class Namespace {
        private final String name;
        private final Map<String, Value> members = new LinkedHashMap<>();

        private Namespace(String name) {
            this.name = name;
        }

        public Namespace value(String member, Value value) {
            if (members.containsKey(member)) {
                throw new IllegalArgumentException("Duplicate member " + name + "." + member);
            }
            members.put(member, value);
            return this;
        }

        public Namespace function(String member, NativeFunction.Body body, String... params) {
            return value(member, Value.nativeFunction(NativeFunction.of(name + "." + member, body, params)));
        }

        public Namespace function(NativeFunction fn, String member) {
            return value(member, Value.nativeFunction(fn));
        }

        public String qualified(String member) {
            return name + "." + member;
        }

        Value toValue() {
            Value map = Value.emptyMap();
            for (Map.Entry<String, Value> e : members.entrySet()) {
                map.asMap().put(AssociativeKey.of(e.getKey()), e.getValue());
            }
            return map;
        }
    }
}
